package com.mk.fx.qa.bench.metrics;

/** Nearest-rank percentile estimation over an ascending-sorted sample. */
public final class Percentiles {

  private Percentiles() {}

  /**
   * Returns the value at index {@code ceil(p/100 * n) - 1}, clamped into {@code [0, n-1]}.
   *
   * @param sorted sample sorted ascending
   * @param p percentile in {@code [0, 100]}
   * @return the percentile value, or 0 for an empty sample
   */
  public static double nearestRank(double[] sorted, double p) {
    if (p < 0 || p > 100) {
      throw new IllegalArgumentException("Percentile must be between 0 and 100");
    }
    int n = sorted.length;
    if (n == 0) {
      return 0;
    }
    int idx = (int) Math.ceil((p / 100.0) * n) - 1;
    return sorted[Math.min(n - 1, Math.max(0, idx))];
  }
}
