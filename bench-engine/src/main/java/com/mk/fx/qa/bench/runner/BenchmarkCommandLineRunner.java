package com.mk.fx.qa.bench.runner;

import com.mk.fx.qa.bench.cfg.BenchProperties;
import com.mk.fx.qa.bench.cfg.RunConfig;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Starts the benchmark once the application context is ready. An invalid configuration fails
 * startup before any request is sent.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(
    prefix = "bench",
    name = "run-on-startup",
    havingValue = "true",
    matchIfMissing = true)
public class BenchmarkCommandLineRunner implements CommandLineRunner {

  private final BenchProperties properties;
  private final BenchmarkRunner benchmarkRunner;

  @Override
  public void run(String... args) throws Exception {
    RunConfig config = RunConfig.from(properties);
    try {
      benchmarkRunner.run(config);
    } catch (InterruptedException interrupted) {
      Thread.currentThread().interrupt();
      log.warn("Benchmark interrupted before completion");
      throw interrupted;
    }
  }
}
