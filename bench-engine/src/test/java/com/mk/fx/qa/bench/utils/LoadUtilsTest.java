package com.mk.fx.qa.bench.utils;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

class LoadUtilsTest {

  @Test
  void round2_usesTheStoredBinaryValue() {
    assertEquals(1.0, LoadUtils.round2(1.005));
    assertEquals(2.67, LoadUtils.round2(2.675));
    assertEquals(1.01, LoadUtils.round2(1.0051));
  }

  @Test
  void round2_exactHalfRoundsUp() {
    assertEquals(0.13, LoadUtils.round2(0.125));
    assertEquals(0.38, LoadUtils.round2(0.375));
  }

  @Test
  void round2_nonFiniteBecomesZero() {
    assertEquals(0.0, LoadUtils.round2(Double.NaN));
    assertEquals(0.0, LoadUtils.round2(Double.POSITIVE_INFINITY));
  }

  @Test
  void throughput_emptyWindowIsZero() {
    assertEquals(0.0, LoadUtils.throughput(10, 0));
    assertEquals(4.0, LoadUtils.throughput(10, 2_500));
  }
}
