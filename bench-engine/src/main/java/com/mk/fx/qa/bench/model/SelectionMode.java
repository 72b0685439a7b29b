package com.mk.fx.qa.bench.model;

/** How endpoints are picked for the requests of a run. */
public enum SelectionMode {
  /** Uniform random pick, with replacement, for every request of the budget. */
  RANDOM,
  /** One concurrency-sized batch per endpoint, in pool order. */
  SEQUENTIAL
}
