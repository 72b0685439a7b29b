package com.mk.fx.qa.bench.cfg;

import com.mk.fx.qa.bench.report.ConsoleReporter;
import com.mk.fx.qa.bench.report.JsonReportWriter;
import com.mk.fx.qa.bench.runner.BenchmarkRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Wires the benchmark components. */
@Configuration
public class BenchCfg {

  @Bean
  public ConsoleReporter consoleReporter() {
    return new ConsoleReporter(System.out);
  }

  @Bean
  public JsonReportWriter jsonReportWriter() {
    return new JsonReportWriter();
  }

  @Bean
  public BenchmarkRunner benchmarkRunner(
      ConsoleReporter consoleReporter, JsonReportWriter jsonReportWriter) {
    return new BenchmarkRunner(consoleReporter, jsonReportWriter);
  }
}
