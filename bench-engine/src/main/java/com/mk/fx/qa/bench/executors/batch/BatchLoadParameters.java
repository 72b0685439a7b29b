package com.mk.fx.qa.bench.executors.batch;

/**
 * Parameters of one batched run.
 *
 * @param concurrency maximum number of requests outstanding within one batch
 * @param totalRequests request budget of the run
 */
public record BatchLoadParameters(int concurrency, int totalRequests) {}
