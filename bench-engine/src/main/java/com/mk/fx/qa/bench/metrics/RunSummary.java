package com.mk.fx.qa.bench.metrics;

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.util.List;
import java.util.Map;

/**
 * Metrics of one run.
 *
 * @param runIndex one-based run number
 * @param durationMs wall-clock duration of the run
 * @param metrics per-endpoint metrics sorted by endpoint
 * @param latencySamples raw latencies per endpoint, kept for exact cross-run merging
 */
public record RunSummary(
    int runIndex,
    long durationMs,
    List<EndpointMetrics> metrics,
    @JsonIgnore Map<String, List<Long>> latencySamples) {

  public RunSummary {
    metrics = List.copyOf(metrics);
    latencySamples = latencySamples != null ? Map.copyOf(latencySamples) : Map.of();
  }
}
