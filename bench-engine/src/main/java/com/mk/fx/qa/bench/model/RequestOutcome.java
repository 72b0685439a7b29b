package com.mk.fx.qa.bench.model;

import java.util.Objects;

/**
 * Result of one dispatched request.
 *
 * @param endpoint endpoint identifier the request was sent to
 * @param success true only for a 2xx response received before the timeout
 * @param httpStatus status code when a response was received, otherwise null
 * @param latencyMs elapsed time from send to settle, never negative
 * @param errorKind failure classification, null on success
 * @param errorMessage best-effort failure description, null on success
 */
public record RequestOutcome(
    String endpoint,
    boolean success,
    Integer httpStatus,
    long latencyMs,
    ErrorKind errorKind,
    String errorMessage) {

  public RequestOutcome {
    Objects.requireNonNull(endpoint, "endpoint");
    latencyMs = Math.max(0, latencyMs);
  }

  public static RequestOutcome success(String endpoint, int httpStatus, long latencyMs) {
    return new RequestOutcome(endpoint, true, httpStatus, latencyMs, null, null);
  }

  public static RequestOutcome httpError(String endpoint, int httpStatus, long latencyMs) {
    return new RequestOutcome(
        endpoint, false, httpStatus, latencyMs, ErrorKind.HTTP_ERROR, "HTTP " + httpStatus);
  }

  public static RequestOutcome failure(
      String endpoint, ErrorKind errorKind, String errorMessage, long latencyMs) {
    return new RequestOutcome(endpoint, false, null, latencyMs, errorKind, errorMessage);
  }
}
