package com.mk.fx.qa.bench.selector;

import com.mk.fx.qa.bench.rest.HttpMethod;
import java.util.Objects;

/**
 * A concrete request for one endpoint.
 *
 * @param endpoint endpoint identifier, also the aggregation key
 * @param method HTTP verb to use
 * @param body JSON body, null for bodiless requests
 */
public record EndpointCall(String endpoint, HttpMethod method, Object body) {

  public EndpointCall {
    Objects.requireNonNull(endpoint, "endpoint");
    Objects.requireNonNull(method, "method");
  }
}
