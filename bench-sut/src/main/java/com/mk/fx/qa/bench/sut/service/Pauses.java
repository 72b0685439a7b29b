package com.mk.fx.qa.bench.sut.service;

import java.time.Duration;

final class Pauses {

  private Pauses() {
    // Utility class, no instantiation
  }

  /** Blocks the calling thread for the given duration; zero or negative returns immediately. */
  static void pause(Duration duration) throws InterruptedException {
    if (duration.isZero() || duration.isNegative()) {
      return;
    }
    Thread.sleep(duration.toMillis());
  }
}
