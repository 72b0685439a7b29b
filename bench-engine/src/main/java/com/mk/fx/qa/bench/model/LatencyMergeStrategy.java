package com.mk.fx.qa.bench.model;

/** How latency statistics are rebuilt when several runs are merged into one summary. */
public enum LatencyMergeStrategy {
  /**
   * Replays each run's average latency once per request of that run. Min, max and percentiles of
   * the merged summary are approximations.
   */
  AVERAGE_REPLAY,
  /** Concatenates the raw per-request latencies kept by every run; statistics are exact. */
  RAW_SAMPLES
}
