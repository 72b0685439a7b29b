package com.mk.fx.qa.bench.recorder;

import com.mk.fx.qa.bench.rest.RestResponseData;
import com.mk.fx.qa.bench.selector.EndpointCall;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;

/** Transport seam of the {@link RequestRecorder}. */
@FunctionalInterface
public interface RequestSender {

  /**
   * Sends the call without blocking. Any HTTP status completes the future normally; transport
   * failures complete it exceptionally.
   */
  CompletableFuture<RestResponseData> send(EndpointCall call, Duration timeout);
}
