package com.mk.fx.qa.bench.report;

import com.mk.fx.qa.bench.cfg.RunConfig;
import com.mk.fx.qa.bench.metrics.GlobalSummary;
import com.mk.fx.qa.bench.metrics.RunSummary;
import java.time.Instant;
import java.util.List;

/**
 * Everything a benchmark produced.
 *
 * @param startedAt when the first run started
 * @param finishedAt when the merged summary was built
 * @param config configuration the benchmark ran with
 * @param runs per-run summaries in run order
 * @param summary merged summary over all runs
 */
public record BenchmarkReport(
    Instant startedAt,
    Instant finishedAt,
    RunConfig config,
    List<RunSummary> runs,
    GlobalSummary summary) {

  public BenchmarkReport {
    runs = List.copyOf(runs);
  }
}
