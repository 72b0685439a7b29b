package com.mk.fx.qa.bench.runner;

import com.google.common.annotations.VisibleForTesting;
import com.mk.fx.qa.bench.cfg.RunConfig;
import com.mk.fx.qa.bench.executors.batch.BatchLoadExecutor;
import com.mk.fx.qa.bench.executors.batch.BatchLoadParameters;
import com.mk.fx.qa.bench.executors.batch.BatchLoadResult;
import com.mk.fx.qa.bench.executors.batch.BatchRecord;
import com.mk.fx.qa.bench.executors.batch.RequestLauncher;
import com.mk.fx.qa.bench.metrics.EndpointMetrics;
import com.mk.fx.qa.bench.metrics.GlobalSummary;
import com.mk.fx.qa.bench.metrics.MetricsAggregator;
import com.mk.fx.qa.bench.metrics.RunMerger;
import com.mk.fx.qa.bench.metrics.RunSummary;
import com.mk.fx.qa.bench.model.RequestOutcome;
import com.mk.fx.qa.bench.model.SelectionMode;
import com.mk.fx.qa.bench.recorder.HttpRequestSender;
import com.mk.fx.qa.bench.recorder.RequestRecorder;
import com.mk.fx.qa.bench.recorder.RequestSender;
import com.mk.fx.qa.bench.report.BenchmarkReport;
import com.mk.fx.qa.bench.report.ConsoleReporter;
import com.mk.fx.qa.bench.report.JsonReportWriter;
import com.mk.fx.qa.bench.rest.LoadHttpClient;
import com.mk.fx.qa.bench.selector.EndpointMethodTable;
import com.mk.fx.qa.bench.selector.EndpointSelector;
import com.mk.fx.qa.bench.selector.RandomEndpointSelector;
import com.mk.fx.qa.bench.selector.SequentialEndpointSelector;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Random;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Runs a benchmark: the configured number of runs, each one a batched dispatch of the request
 * budget, followed by aggregation, cross-run merging and reporting.
 *
 * <p>In {@link SelectionMode#RANDOM} a run spends the whole budget on uniformly picked endpoints
 * and every endpoint shares the run's duration. In {@link SelectionMode#SEQUENTIAL} a run sends one
 * concurrency-sized batch to each endpoint in pool order and each endpoint is measured against its
 * own batch time.
 */
@Slf4j
@RequiredArgsConstructor
public class BenchmarkRunner {

  private final ConsoleReporter reporter;
  private final JsonReportWriter reportWriter;

  /** Runs the benchmark against the configured base URL over HTTP. */
  public BenchmarkReport run(RunConfig config) throws InterruptedException {
    Objects.requireNonNull(config, "config");
    try (LoadHttpClient client =
        new LoadHttpClient(
            config.baseUrl(), config.connectTimeout(), config.timeout(), config.headers())) {
      return run(config, new HttpRequestSender(client));
    }
  }

  @VisibleForTesting
  public BenchmarkReport run(RunConfig config, RequestSender sender) throws InterruptedException {
    Objects.requireNonNull(config, "config");
    Objects.requireNonNull(sender, "sender");

    var startedAt = Instant.now();
    var random =
        config.seedValue().isPresent() ? new Random(config.seedValue().getAsLong()) : new Random();
    var methodTable = new EndpointMethodTable(config.mutatingEndpoints());
    var recorder = new RequestRecorder(sender, config.timeout());
    RequestLauncher launcher = endpoint -> recorder.record(methodTable.resolve(endpoint));

    log.info(
        "Benchmark starting: target={}, mode={}, concurrency={}, timeout={}ms, requestsPerRun={},"
            + " repeat={}, endpoints={}",
        config.baseUrl(),
        config.mode(),
        config.concurrency(),
        config.timeout().toMillis(),
        config.requestsPerRun(),
        config.repeat(),
        config.endpoints());
    reporter.printHeader(config);

    List<RunSummary> runs = new ArrayList<>(config.repeat());
    for (int runIndex = 1; runIndex <= config.repeat(); runIndex++) {
      var summary = executeRun(runIndex, config, selectorFor(config, random), launcher);
      reporter.printRun(summary, config.repeat());
      runs.add(summary);
    }

    GlobalSummary global = RunMerger.merge(runs, config.endpoints(), config.latencyMerge());
    reporter.printSummary(global);
    logSummary(global);

    var report = new BenchmarkReport(startedAt, Instant.now(), config, runs, global);
    config.reportPath().ifPresent(path -> reportWriter.write(report, path));
    return report;
  }

  private EndpointSelector selectorFor(RunConfig config, Random random) {
    return config.mode() == SelectionMode.SEQUENTIAL
        ? new SequentialEndpointSelector(config.endpoints(), config.concurrency())
        : new RandomEndpointSelector(config.endpoints(), random);
  }

  private RunSummary executeRun(
      int runIndex, RunConfig config, EndpointSelector selector, RequestLauncher launcher)
      throws InterruptedException {
    var label = "Run " + runIndex + "/" + config.repeat();
    var parameters = new BatchLoadParameters(config.concurrency(), config.requestsPerRun());
    BatchLoadResult result = BatchLoadExecutor.execute(label, parameters, selector, launcher);

    List<EndpointMetrics> metrics =
        config.mode() == SelectionMode.SEQUENTIAL
            ? perBatchMetrics(result, config.endpoints())
            : MetricsAggregator.aggregate(
                result.outcomes(), result.durationMs(), config.endpoints());

    var summary =
        new RunSummary(
            runIndex,
            result.durationMs(),
            metrics,
            MetricsAggregator.latencySamples(result.outcomes()));
    long failures = metrics.stream().mapToLong(EndpointMetrics::failures).sum();
    log.info(
        "{} finished in {} ms: requests={}, failures={}",
        label,
        result.durationMs(),
        result.outcomes().size(),
        failures);
    return summary;
  }

  /**
   * Aggregates a sequential run endpoint by endpoint, each against the time its own batches took.
   * An endpoint listed twice in the pool has its batches combined.
   */
  private List<EndpointMetrics> perBatchMetrics(BatchLoadResult result, List<String> pool) {
    Map<String, List<RequestOutcome>> outcomes = new LinkedHashMap<>();
    Map<String, Long> durations = new LinkedHashMap<>();
    for (BatchRecord batch : result.batches()) {
      var batchOutcomes = result.outcomesOf(batch);
      if (batchOutcomes.isEmpty()) {
        continue;
      }
      var endpoint = batchOutcomes.get(0).endpoint();
      outcomes.computeIfAbsent(endpoint, k -> new ArrayList<>()).addAll(batchOutcomes);
      durations.merge(endpoint, batch.durationMs(), Long::sum);
    }

    List<EndpointMetrics> metrics = new ArrayList<>();
    for (String endpoint : pool.stream().distinct().toList()) {
      var endpointOutcomes = outcomes.getOrDefault(endpoint, List.of());
      metrics.addAll(
          MetricsAggregator.aggregate(
              endpointOutcomes, durations.getOrDefault(endpoint, 0L), List.of(endpoint)));
    }
    metrics.sort(EndpointMetrics.BY_ENDPOINT);
    return metrics;
  }

  private void logSummary(GlobalSummary global) {
    long total = 0;
    long failures = 0;
    for (EndpointMetrics m : global.metrics()) {
      total += m.totalRequests();
      failures += m.failures();
    }
    log.info(
        "Benchmark finished: runs={}, totalDuration={}ms, requests={}, failures={}",
        global.runCount(),
        global.totalDurationMs(),
        total,
        failures);
  }
}
