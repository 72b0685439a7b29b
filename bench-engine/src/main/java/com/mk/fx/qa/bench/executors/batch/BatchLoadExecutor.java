package com.mk.fx.qa.bench.executors.batch;

import com.google.common.base.Stopwatch;
import com.google.common.base.Ticker;
import com.mk.fx.qa.bench.model.ErrorKind;
import com.mk.fx.qa.bench.model.RequestOutcome;
import com.mk.fx.qa.bench.selector.EndpointSelector;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import lombok.extern.slf4j.Slf4j;

/**
 * Executes a batched load run: the request budget is cut into batches of at most {@code
 * concurrency} requests, every request of a batch is started before any is awaited, and the next
 * batch starts only once all requests of the current one have settled.
 *
 * <p>A slow request therefore holds back the whole next batch. Per-request failures never abort
 * the run; they arrive as failed {@link RequestOutcome}s.
 *
 * <p>Threading: the calling thread starts the requests and blocks at each batch barrier. Requests
 * complete on whatever threads the {@link RequestLauncher} uses.
 */
@Slf4j
public final class BatchLoadExecutor {

  private BatchLoadExecutor() {
    throw new UnsupportedOperationException("BatchLoadExecutor cannot be instantiated");
  }

  /**
   * Runs a batched execution.
   *
   * @param runLabel label used in logs
   * @param parameters concurrency limit and request budget
   * @param selector picks the endpoint of each request
   * @param launcher starts one request and reports its outcome
   * @return outcomes in dispatch order, total duration and per-batch timing
   * @throws InterruptedException if the calling thread is interrupted while waiting on a batch
   */
  public static BatchLoadResult execute(
      String runLabel,
      BatchLoadParameters parameters,
      EndpointSelector selector,
      RequestLauncher launcher)
      throws InterruptedException {
    return execute(runLabel, parameters, selector, launcher, Ticker.systemTicker());
  }

  static BatchLoadResult execute(
      String runLabel,
      BatchLoadParameters parameters,
      EndpointSelector selector,
      RequestLauncher launcher,
      Ticker ticker)
      throws InterruptedException {
    validateRun(runLabel, parameters, selector, launcher);
    if (parameters.concurrency() <= 0) {
      throw new IllegalArgumentException(
          "concurrency must be > 0 but was " + parameters.concurrency());
    }

    int totalRequests = Math.max(0, parameters.totalRequests());
    if (totalRequests == 0) {
      log.info("{} has an empty request budget, nothing to dispatch", runLabel);
      return new BatchLoadResult(List.of(), 0, List.of());
    }

    List<RequestOutcome> outcomes = new ArrayList<>(totalRequests);
    List<BatchRecord> batches = new ArrayList<>();
    int dispatched = 0;

    var runWatch = Stopwatch.createStarted(ticker);
    while (dispatched < totalRequests) {
      int batchSize = Math.min(parameters.concurrency(), totalRequests - dispatched);
      int batchIndex = batches.size();
      var batchWatch = Stopwatch.createStarted(ticker);

      List<CompletableFuture<RequestOutcome>> inFlight = new ArrayList<>(batchSize);
      for (int i = 0; i < batchSize; i++) {
        var endpoint = selector.select(dispatched + i);
        inFlight.add(launchSafely(launcher, endpoint));
      }

      awaitBatch(inFlight);
      for (CompletableFuture<RequestOutcome> future : inFlight) {
        outcomes.add(future.getNow(null));
      }

      var batchMs = batchWatch.elapsed(TimeUnit.MILLISECONDS);
      batches.add(new BatchRecord(batchIndex, dispatched, batchSize, batchMs));
      dispatched += batchSize;
      log.debug(
          "{} batch {} settled: size={} took={}ms dispatched={}/{}",
          runLabel,
          batchIndex + 1,
          batchSize,
          batchMs,
          dispatched,
          totalRequests);
    }
    var durationMs = runWatch.elapsed(TimeUnit.MILLISECONDS);

    log.info(
        "{} dispatched {} requests in {} batches over {} ms",
        runLabel,
        dispatched,
        batches.size(),
        durationMs);
    return new BatchLoadResult(outcomes, durationMs, batches);
  }

  /** Validates mandatory inputs for a batched run. */
  private static void validateRun(
      String runLabel,
      BatchLoadParameters parameters,
      EndpointSelector selector,
      RequestLauncher launcher) {
    Objects.requireNonNull(runLabel, "runLabel");
    Objects.requireNonNull(parameters, "parameters");
    Objects.requireNonNull(selector, "selector");
    Objects.requireNonNull(launcher, "launcher");
  }

  /**
   * Starts one request, turning a launcher that throws, returns null or fails its future into an
   * {@link ErrorKind#UNKNOWN_ERROR} outcome.
   */
  private static CompletableFuture<RequestOutcome> launchSafely(
      RequestLauncher launcher, String endpoint) {
    CompletableFuture<RequestOutcome> future;
    try {
      future = launcher.launch(endpoint);
    } catch (RuntimeException ex) {
      log.warn("Launching request to {} failed: {}", endpoint, ex.toString());
      return CompletableFuture.completedFuture(unknownFailure(endpoint, ex));
    }
    if (future == null) {
      return CompletableFuture.completedFuture(
          RequestOutcome.failure(endpoint, ErrorKind.UNKNOWN_ERROR, "no outcome produced", 0));
    }
    return future.handle(
        (outcome, error) -> {
          if (error != null) {
            return unknownFailure(endpoint, error);
          }
          return outcome != null
              ? outcome
              : RequestOutcome.failure(endpoint, ErrorKind.UNKNOWN_ERROR, "no outcome produced", 0);
        });
  }

  private static RequestOutcome unknownFailure(String endpoint, Throwable error) {
    var message =
        error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
    return RequestOutcome.failure(endpoint, ErrorKind.UNKNOWN_ERROR, message, 0);
  }

  /** Blocks until every request of the batch has settled. */
  private static void awaitBatch(List<CompletableFuture<RequestOutcome>> inFlight)
      throws InterruptedException {
    try {
      CompletableFuture.allOf(inFlight.toArray(new CompletableFuture<?>[0])).get();
    } catch (ExecutionException ex) {
      // launchSafely maps every failure to an outcome, so the barrier itself cannot fail
      throw new IllegalStateException("Batch barrier failed unexpectedly", ex);
    }
  }
}
