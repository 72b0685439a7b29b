package com.mk.fx.qa.bench.selector;

/** Picks the endpoint for each request of a run. */
@FunctionalInterface
public interface EndpointSelector {

  /**
   * Returns the endpoint for the given request.
   *
   * @param requestIndex zero-based position of the request within the run
   * @return endpoint identifier taken from the configured pool
   */
  String select(int requestIndex);
}
