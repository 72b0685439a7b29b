package com.mk.fx.qa.bench.report;

import com.mk.fx.qa.bench.rest.JsonUtil;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import lombok.extern.slf4j.Slf4j;

/** Exports a {@link BenchmarkReport} as pretty-printed JSON. */
@Slf4j
public class JsonReportWriter {

  /**
   * Writes the report, creating parent directories as needed. A failed export is logged and
   * reported through the return value; it never fails the benchmark.
   *
   * @return true when the file was written
   */
  public boolean write(BenchmarkReport report, Path target) {
    try {
      var parent = target.toAbsolutePath().getParent();
      if (parent != null) {
        Files.createDirectories(parent);
      }
      Files.writeString(target, JsonUtil.toPrettyJson(report));
      log.info("Benchmark report written to {}", target.toAbsolutePath());
      return true;
    } catch (IOException e) {
      log.error("Failed to write benchmark report to {}: {}", target, e.getMessage(), e);
      return false;
    }
  }
}
