package com.mk.fx.qa.bench.recorder;

import com.mk.fx.qa.bench.rest.LoadHttpClient;
import com.mk.fx.qa.bench.rest.Request;
import com.mk.fx.qa.bench.rest.RestResponseData;
import com.mk.fx.qa.bench.selector.EndpointCall;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/** Sends calls through a {@link LoadHttpClient}. */
public class HttpRequestSender implements RequestSender {

  private final LoadHttpClient client;

  public HttpRequestSender(LoadHttpClient client) {
    this.client = Objects.requireNonNull(client, "client");
  }

  @Override
  public CompletableFuture<RestResponseData> send(EndpointCall call, Duration timeout) {
    var request = new Request();
    request.setMethod(call.method());
    request.setPath(call.endpoint());
    request.setBody(call.body());
    request.setTimeout(timeout);
    return client.executeAsync(request);
  }
}
