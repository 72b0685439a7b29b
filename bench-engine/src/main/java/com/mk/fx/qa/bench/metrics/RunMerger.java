package com.mk.fx.qa.bench.metrics;

import com.mk.fx.qa.bench.model.ErrorKind;
import com.mk.fx.qa.bench.model.LatencyMergeStrategy;
import com.mk.fx.qa.bench.utils.LoadUtils;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import lombok.extern.slf4j.Slf4j;

/**
 * Merges the summaries of repeated runs into one {@link GlobalSummary}.
 *
 * <p>Counts, error breakdowns and durations are summed per endpoint and throughput is recomputed
 * from the sums. Latency depends on the {@link LatencyMergeStrategy}: {@code AVERAGE_REPLAY}
 * rebuilds a sample by repeating each run's average once per request of that run, so min, max and
 * percentiles are approximations; {@code RAW_SAMPLES} uses the latencies retained by each run.
 */
@Slf4j
public final class RunMerger {

  private RunMerger() {
    throw new UnsupportedOperationException("RunMerger cannot be instantiated");
  }

  public static GlobalSummary merge(
      List<RunSummary> runs, List<String> pool, LatencyMergeStrategy strategy) {
    Objects.requireNonNull(runs, "runs");
    Objects.requireNonNull(pool, "pool");
    Objects.requireNonNull(strategy, "strategy");

    Map<String, Accumulator> perEndpoint = new LinkedHashMap<>();
    for (String endpoint : pool) {
      perEndpoint.computeIfAbsent(endpoint, Accumulator::new);
    }

    long totalDurationMs = 0;
    for (RunSummary run : runs) {
      totalDurationMs += run.durationMs();
      for (EndpointMetrics m : run.metrics()) {
        var samples = run.latencySamples().getOrDefault(m.endpoint(), List.of());
        perEndpoint.computeIfAbsent(m.endpoint(), Accumulator::new).add(m, samples, strategy);
      }
    }

    if (strategy == LatencyMergeStrategy.AVERAGE_REPLAY && runs.size() > 1) {
      log.warn(
          "Merged latency min/max/percentiles are rebuilt from per-run averages"
              + " and are approximate; set bench.latency-merge=RAW_SAMPLES for exact values");
    }

    List<EndpointMetrics> merged = new ArrayList<>(perEndpoint.size());
    for (Accumulator acc : perEndpoint.values()) {
      merged.add(acc.toMetrics());
    }
    merged.sort(EndpointMetrics.BY_ENDPOINT);
    return new GlobalSummary(runs.size(), totalDurationMs, strategy, merged);
  }

  private static final class Accumulator {
    private final String endpoint;
    private long totalRequests;
    private long successes;
    private long failures;
    private long durationMs;
    private final Map<ErrorKind, Long> breakdown = new EnumMap<>(ErrorKind.class);
    private double[] sample = new double[0];
    private int sampleSize;

    private Accumulator(String endpoint) {
      this.endpoint = endpoint;
    }

    private void add(EndpointMetrics m, List<Long> rawLatencies, LatencyMergeStrategy strategy) {
      totalRequests += m.totalRequests();
      successes += m.successes();
      failures += m.failures();
      durationMs += m.runDurationMs();
      m.errorBreakdown().forEach((kind, count) -> breakdown.merge(kind, count, Long::sum));

      if (strategy == LatencyMergeStrategy.RAW_SAMPLES) {
        ensureCapacity(rawLatencies.size());
        for (Long latency : rawLatencies) {
          sample[sampleSize++] = latency;
        }
      } else {
        int replays = Math.toIntExact(m.totalRequests());
        ensureCapacity(replays);
        Arrays.fill(sample, sampleSize, sampleSize + replays, m.latency().avg());
        sampleSize += replays;
      }
    }

    private void ensureCapacity(int extra) {
      int required = sampleSize + extra;
      if (required > sample.length) {
        sample = Arrays.copyOf(sample, Math.max(required, sample.length * 2));
      }
    }

    private EndpointMetrics toMetrics() {
      return new EndpointMetrics(
          endpoint,
          totalRequests,
          successes,
          failures,
          durationMs,
          LoadUtils.throughput(successes, durationMs),
          LatencyStats.of(Arrays.copyOf(sample, sampleSize)),
          breakdown);
    }
  }
}
