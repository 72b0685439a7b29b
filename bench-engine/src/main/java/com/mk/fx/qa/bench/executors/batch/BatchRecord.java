package com.mk.fx.qa.bench.executors.batch;

/**
 * Timing of one settled batch.
 *
 * @param batchIndex zero-based batch number
 * @param firstRequestIndex index of the batch's first outcome in the run's outcome list
 * @param size number of requests in the batch
 * @param durationMs wall-clock time from the batch's first send to its last settle
 */
public record BatchRecord(int batchIndex, int firstRequestIndex, int size, long durationMs) {}
