package com.mk.fx.qa.bench.sut.model;

import java.math.BigDecimal;

/** Response bodies of the demo endpoints. */
public final class Responses {

  private Responses() {
    // Holder class, no instantiation
  }

  public record ComputeResponse(double result) {}

  public record CounterResponse(long counter) {}

  public record FactorialResponse(int n, long factorial) {}

  public record FibonacciResponse(int n, long fibonacci) {}

  public record BalanceResponse(BigDecimal balance) {}

  public record HealthResponse(String status) {}
}
