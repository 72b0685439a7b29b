package com.mk.fx.qa.bench.metrics;

import com.mk.fx.qa.bench.model.ErrorKind;
import com.mk.fx.qa.bench.utils.LoadUtils;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Statistics of one endpoint over one run, or over all runs once merged.
 *
 * @param endpoint endpoint identifier
 * @param totalRequests requests observed
 * @param successes 2xx responses
 * @param failures everything else
 * @param runDurationMs duration used as throughput denominator
 * @param throughputReqPerSec successful requests per second, two decimals
 * @param latency latency distribution
 * @param errorBreakdown failures per classification
 */
public record EndpointMetrics(
    String endpoint,
    long totalRequests,
    long successes,
    long failures,
    long runDurationMs,
    double throughputReqPerSec,
    LatencyStats latency,
    Map<ErrorKind, Long> errorBreakdown) {

  public static final Comparator<EndpointMetrics> BY_ENDPOINT =
      Comparator.comparing(EndpointMetrics::endpoint, LoadUtils.CODE_POINT_ORDER);

  public EndpointMetrics {
    Objects.requireNonNull(endpoint, "endpoint");
    Objects.requireNonNull(latency, "latency");
    if (successes + failures != totalRequests) {
      throw new IllegalArgumentException(
          "successes + failures must equal totalRequests for " + endpoint);
    }
    var breakdown = new EnumMap<ErrorKind, Long>(ErrorKind.class);
    if (errorBreakdown != null) {
      breakdown.putAll(errorBreakdown);
    }
    errorBreakdown = Collections.unmodifiableMap(breakdown);
  }

  /** Metrics of an endpoint that received no requests. */
  public static EndpointMetrics empty(String endpoint, long runDurationMs) {
    return new EndpointMetrics(endpoint, 0, 0, 0, runDurationMs, 0.0, LatencyStats.EMPTY, Map.of());
  }
}
