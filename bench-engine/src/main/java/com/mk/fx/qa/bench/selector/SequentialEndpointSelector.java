package com.mk.fx.qa.bench.selector;

import java.util.List;
import java.util.Objects;

/**
 * Walks the pool in order, one full batch per endpoint: requests {@code [k*batchSize,
 * (k+1)*batchSize)} all go to endpoint {@code k}. Wraps around once the pool is exhausted.
 */
public final class SequentialEndpointSelector implements EndpointSelector {

  private final List<String> pool;
  private final int batchSize;

  public SequentialEndpointSelector(List<String> pool, int batchSize) {
    Objects.requireNonNull(pool, "pool");
    if (pool.isEmpty()) {
      throw new IllegalArgumentException("Endpoint pool must not be empty");
    }
    if (batchSize <= 0) {
      throw new IllegalArgumentException("batchSize must be > 0");
    }
    this.pool = List.copyOf(pool);
    this.batchSize = batchSize;
  }

  @Override
  public String select(int requestIndex) {
    return pool.get((requestIndex / batchSize) % pool.size());
  }
}
