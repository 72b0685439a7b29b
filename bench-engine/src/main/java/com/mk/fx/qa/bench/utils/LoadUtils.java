package com.mk.fx.qa.bench.utils;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Comparator;

public final class LoadUtils {

  /** Orders strings by Unicode code point, not by UTF-16 code unit. */
  public static final Comparator<String> CODE_POINT_ORDER = LoadUtils::compareCodePoints;

  private LoadUtils() {
    // Utility class, no instantiation
  }

  /**
   * Rounds the exact binary value half-up to two decimal places, so {@code 1.005} (stored as
   * 1.00499...) becomes 1.0. Non-finite values become 0.
   */
  public static double round2(double value) {
    if (Double.isNaN(value) || Double.isInfinite(value)) {
      return 0.0;
    }
    return new BigDecimal(value).setScale(2, RoundingMode.HALF_UP).doubleValue();
  }

  /** Requests per second over the given window, 0 for an empty window. */
  public static double throughput(long successes, long durationMs) {
    if (durationMs <= 0) {
      return 0.0;
    }
    return round2(successes / (durationMs / 1000.0));
  }

  private static int compareCodePoints(String left, String right) {
    int i = 0;
    int j = 0;
    while (i < left.length() && j < right.length()) {
      int a = left.codePointAt(i);
      int b = right.codePointAt(j);
      if (a != b) {
        return Integer.compare(a, b);
      }
      i += Character.charCount(a);
      j += Character.charCount(b);
    }
    return Integer.compare(left.length() - i, right.length() - j);
  }
}
