package com.mk.fx.qa.bench.metrics;

import com.mk.fx.qa.bench.utils.LoadUtils;
import java.util.Arrays;

/**
 * Latency distribution of one endpoint, in milliseconds. Average is rounded to two decimals; the
 * other fields are sample values.
 */
public record LatencyStats(double min, double max, double avg, double p50, double p90, double p99) {

  public static final LatencyStats EMPTY = new LatencyStats(0, 0, 0, 0, 0, 0);

  /** Computes the statistics of the given sample; the array is not modified. */
  public static LatencyStats of(double[] sample) {
    if (sample.length == 0) {
      return EMPTY;
    }
    double[] sorted = Arrays.copyOf(sample, sample.length);
    Arrays.sort(sorted);
    double sum = 0;
    for (double v : sorted) {
      sum += v;
    }
    return new LatencyStats(
        sorted[0],
        sorted[sorted.length - 1],
        LoadUtils.round2(sum / sorted.length),
        Percentiles.nearestRank(sorted, 50),
        Percentiles.nearestRank(sorted, 90),
        Percentiles.nearestRank(sorted, 99));
  }
}
