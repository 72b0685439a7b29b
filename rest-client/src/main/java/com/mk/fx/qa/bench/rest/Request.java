package com.mk.fx.qa.bench.rest;

import java.time.Duration;
import java.util.Map;
import lombok.Data;

@Data
public class Request {
  private HttpMethod method;
  private String path;
  private Map<String, String> headers;
  private Object body;

  /** Overrides the client-wide request timeout when set. */
  private Duration timeout;
}
