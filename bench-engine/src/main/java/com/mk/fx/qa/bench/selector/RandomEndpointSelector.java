package com.mk.fx.qa.bench.selector;

import java.util.List;
import java.util.Objects;
import java.util.Random;

/**
 * Uniform pick with replacement from the pool. Pass a seeded {@link Random} for repeatable runs.
 */
public final class RandomEndpointSelector implements EndpointSelector {

  private final List<String> pool;
  private final Random random;

  public RandomEndpointSelector(List<String> pool, Random random) {
    Objects.requireNonNull(pool, "pool");
    if (pool.isEmpty()) {
      throw new IllegalArgumentException("Endpoint pool must not be empty");
    }
    this.pool = List.copyOf(pool);
    this.random = Objects.requireNonNull(random, "random");
  }

  @Override
  public String select(int requestIndex) {
    return pool.get(random.nextInt(pool.size()));
  }
}
