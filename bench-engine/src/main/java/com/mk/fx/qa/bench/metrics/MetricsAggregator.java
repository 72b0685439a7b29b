package com.mk.fx.qa.bench.metrics;

import com.mk.fx.qa.bench.model.ErrorKind;
import com.mk.fx.qa.bench.model.RequestOutcome;
import com.mk.fx.qa.bench.utils.LoadUtils;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Turns the outcomes of one run into per-endpoint metrics.
 *
 * <p>Throughput of every endpoint uses the whole run's duration as denominator, not the time the
 * endpoint was actually busy. Pool endpoints without outcomes are reported with zero metrics, and
 * the result is sorted by endpoint in code point order. Pure: the same input always yields equal
 * output.
 */
public final class MetricsAggregator {

  private MetricsAggregator() {
    throw new UnsupportedOperationException("MetricsAggregator cannot be instantiated");
  }

  public static List<EndpointMetrics> aggregate(
      List<RequestOutcome> outcomes, long runDurationMs, List<String> pool) {
    Objects.requireNonNull(outcomes, "outcomes");
    Objects.requireNonNull(pool, "pool");

    Map<String, List<RequestOutcome>> groups = groupByEndpoint(outcomes);
    for (String endpoint : pool) {
      groups.putIfAbsent(endpoint, List.of());
    }

    List<EndpointMetrics> metrics = new ArrayList<>(groups.size());
    for (var group : groups.entrySet()) {
      metrics.add(summarise(group.getKey(), group.getValue(), runDurationMs));
    }
    metrics.sort(EndpointMetrics.BY_ENDPOINT);
    return List.copyOf(metrics);
  }

  /** Raw latency samples per endpoint, in dispatch order. */
  public static Map<String, List<Long>> latencySamples(List<RequestOutcome> outcomes) {
    Map<String, List<Long>> samples = new LinkedHashMap<>();
    for (RequestOutcome outcome : outcomes) {
      samples.computeIfAbsent(outcome.endpoint(), k -> new ArrayList<>()).add(outcome.latencyMs());
    }
    Map<String, List<Long>> copy = new LinkedHashMap<>();
    samples.forEach((endpoint, values) -> copy.put(endpoint, List.copyOf(values)));
    return copy;
  }

  static EndpointMetrics summarise(
      String endpoint, List<RequestOutcome> group, long runDurationMs) {
    if (group.isEmpty()) {
      return EndpointMetrics.empty(endpoint, runDurationMs);
    }
    long successes = 0;
    Map<ErrorKind, Long> breakdown = new EnumMap<>(ErrorKind.class);
    double[] latencies = new double[group.size()];
    for (int i = 0; i < group.size(); i++) {
      RequestOutcome outcome = group.get(i);
      latencies[i] = outcome.latencyMs();
      if (outcome.success()) {
        successes++;
      } else {
        var kind = outcome.errorKind() != null ? outcome.errorKind() : ErrorKind.UNKNOWN_ERROR;
        breakdown.merge(kind, 1L, Long::sum);
      }
    }
    long total = group.size();
    return new EndpointMetrics(
        endpoint,
        total,
        successes,
        total - successes,
        runDurationMs,
        LoadUtils.throughput(successes, runDurationMs),
        LatencyStats.of(latencies),
        breakdown);
  }

  private static Map<String, List<RequestOutcome>> groupByEndpoint(List<RequestOutcome> outcomes) {
    Map<String, List<RequestOutcome>> groups = new LinkedHashMap<>();
    for (RequestOutcome outcome : outcomes) {
      groups.computeIfAbsent(outcome.endpoint(), k -> new ArrayList<>()).add(outcome);
    }
    return groups;
  }
}
