package com.mk.fx.qa.bench.selector;

import com.mk.fx.qa.bench.rest.HttpMethod;
import java.util.Collection;
import java.util.Map;
import java.util.Set;

/**
 * Maps endpoint identifiers to the request that exercises them. Mutating endpoints are sent as
 * POST with a fixed JSON payload; every other endpoint is a bodiless GET.
 */
public final class EndpointMethodTable {

  /** Payload sent to every mutating endpoint. */
  public static final Map<String, Object> MUTATION_PAYLOAD = Map.of("amount", 1);

  private final Set<String> mutatingEndpoints;

  public EndpointMethodTable(Collection<String> mutatingEndpoints) {
    this.mutatingEndpoints = mutatingEndpoints != null ? Set.copyOf(mutatingEndpoints) : Set.of();
  }

  public EndpointCall resolve(String endpoint) {
    if (mutatingEndpoints.contains(endpoint)) {
      return new EndpointCall(endpoint, HttpMethod.POST, MUTATION_PAYLOAD);
    }
    return new EndpointCall(endpoint, HttpMethod.GET, null);
  }
}
