package com.mk.fx.qa.bench.executors.batch;

import com.mk.fx.qa.bench.model.RequestOutcome;
import java.util.concurrent.CompletableFuture;

/**
 * Callback used by {@link BatchLoadExecutor} to start one request. Implementations return without
 * waiting for the exchange; the future settles once the response, error or timeout arrives.
 */
@FunctionalInterface
public interface RequestLauncher {
  /**
   * Starts a request against the given endpoint.
   *
   * @param endpoint endpoint chosen by the selector
   * @return future completed with the request's outcome
   */
  CompletableFuture<RequestOutcome> launch(String endpoint);
}
