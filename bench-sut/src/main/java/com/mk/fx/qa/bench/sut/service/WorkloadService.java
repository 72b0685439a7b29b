package com.mk.fx.qa.bench.sut.service;

import com.mk.fx.qa.bench.sut.cfg.SutProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** CPU-bound and latency-bound computations. Stateless. */
@Slf4j
@Service
@RequiredArgsConstructor
public class WorkloadService {

  private final SutProperties properties;

  /** Sums square roots over the configured number of iterations. */
  public double compute() {
    double result = 0;
    for (long i = 0; i < properties.getComputeIterations(); i++) {
      result += Math.sqrt(i % 1000);
    }
    return result;
  }

  public void slowOperation() throws InterruptedException {
    Pauses.pause(properties.getSlowDelay());
    log.debug("Slow operation finished");
  }

  /**
   * Iterative factorial, pausing before each multiplication.
   *
   * @throws IllegalArgumentException if n is outside 0..maxFactorialInput
   */
  public long factorial(int n) throws InterruptedException {
    requireInRange(n, properties.getMaxFactorialInput());
    long result = 1;
    for (int i = 2; i <= n; i++) {
      Pauses.pause(properties.getFactorialStepDelay());
      result *= i;
    }
    return result;
  }

  /**
   * Naive recursive Fibonacci, pausing on every call above the base cases.
   *
   * @throws IllegalArgumentException if n is outside 0..maxFibonacciInput
   */
  public long fibonacci(int n) throws InterruptedException {
    requireInRange(n, properties.getMaxFibonacciInput());
    return slowFibonacci(n);
  }

  private long slowFibonacci(int n) throws InterruptedException {
    if (n <= 1) {
      return n;
    }
    Pauses.pause(properties.getFibonacciCallDelay());
    return slowFibonacci(n - 1) + slowFibonacci(n - 2);
  }

  private static void requireInRange(int n, int max) {
    if (n < 0 || n > max) {
      throw new IllegalArgumentException("n must be between 0 and " + max + " but was " + n);
    }
  }
}
