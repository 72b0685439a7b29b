package com.mk.fx.qa.bench.metrics;

import com.mk.fx.qa.bench.model.LatencyMergeStrategy;
import java.util.List;

/**
 * Metrics merged over every run of a benchmark.
 *
 * @param runCount number of merged runs
 * @param totalDurationMs sum of all run durations
 * @param latencyMerge how latency statistics were rebuilt
 * @param metrics merged per-endpoint metrics sorted by endpoint
 */
public record GlobalSummary(
    int runCount,
    long totalDurationMs,
    LatencyMergeStrategy latencyMerge,
    List<EndpointMetrics> metrics) {

  public GlobalSummary {
    metrics = List.copyOf(metrics);
  }
}
