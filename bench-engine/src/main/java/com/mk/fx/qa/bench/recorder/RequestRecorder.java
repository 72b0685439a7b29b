package com.mk.fx.qa.bench.recorder;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Stopwatch;
import com.google.common.base.Ticker;
import com.mk.fx.qa.bench.model.ErrorKind;
import com.mk.fx.qa.bench.model.RequestOutcome;
import com.mk.fx.qa.bench.rest.RestResponseData;
import com.mk.fx.qa.bench.selector.EndpointCall;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import lombok.extern.slf4j.Slf4j;

/**
 * Times one request from send to settle and turns whatever happened into exactly one {@link
 * RequestOutcome}. The returned future never completes exceptionally.
 *
 * <p>The timeout is enforced here as well as in the transport: once it expires the request is
 * abandoned and reported as {@link ErrorKind#TIMEOUT} with the elapsed time as latency.
 */
@Slf4j
public class RequestRecorder {

  private final RequestSender sender;
  private final Duration timeout;
  private final Ticker ticker;

  public RequestRecorder(RequestSender sender, Duration timeout) {
    this(sender, timeout, Ticker.systemTicker());
  }

  @VisibleForTesting
  RequestRecorder(RequestSender sender, Duration timeout, Ticker ticker) {
    this.sender = Objects.requireNonNull(sender, "sender");
    this.timeout = Objects.requireNonNull(timeout, "timeout");
    this.ticker = Objects.requireNonNull(ticker, "ticker");
    if (timeout.isZero() || timeout.isNegative()) {
      throw new IllegalArgumentException("timeout must be > 0 but was " + timeout);
    }
  }

  public CompletableFuture<RequestOutcome> record(EndpointCall call) {
    Objects.requireNonNull(call, "call");
    var watch = Stopwatch.createStarted(ticker);

    CompletableFuture<RestResponseData> response;
    try {
      response = sender.send(call, timeout);
    } catch (RuntimeException ex) {
      return CompletableFuture.completedFuture(failure(call, ex, watch));
    }
    if (response == null) {
      return CompletableFuture.completedFuture(
          RequestOutcome.failure(
              call.endpoint(), ErrorKind.UNKNOWN_ERROR, "no response future", elapsed(watch)));
    }

    return response
        .orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS)
        .handle(
            (data, error) -> {
              if (error != null) {
                return failure(call, error, watch);
              }
              if (data == null) {
                return RequestOutcome.failure(
                    call.endpoint(), ErrorKind.UNKNOWN_ERROR, "empty response", elapsed(watch));
              }
              var latencyMs = elapsed(watch);
              if (data.isSuccessful()) {
                log.debug(
                    "{} {} -> {} in {} ms",
                    call.method(),
                    call.endpoint(),
                    data.getStatusCode(),
                    latencyMs);
                return RequestOutcome.success(call.endpoint(), data.getStatusCode(), latencyMs);
              }
              log.debug(
                  "{} {} failed with HTTP {} in {} ms",
                  call.method(),
                  call.endpoint(),
                  data.getStatusCode(),
                  latencyMs);
              return RequestOutcome.httpError(call.endpoint(), data.getStatusCode(), latencyMs);
            });
  }

  private RequestOutcome failure(EndpointCall call, Throwable error, Stopwatch watch) {
    var latencyMs = elapsed(watch);
    var kind = FailureClassifier.classify(error);
    var message = FailureClassifier.describe(error);
    log.debug(
        "{} {} failed after {} ms: {} ({})",
        call.method(),
        call.endpoint(),
        latencyMs,
        kind,
        message);
    return RequestOutcome.failure(call.endpoint(), kind, message, latencyMs);
  }

  private static long elapsed(Stopwatch watch) {
    return watch.elapsed(TimeUnit.MILLISECONDS);
  }
}
