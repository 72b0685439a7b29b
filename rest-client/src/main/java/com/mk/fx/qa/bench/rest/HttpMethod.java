package com.mk.fx.qa.bench.rest;

/** HTTP verbs understood by {@link LoadHttpClient}. */
public enum HttpMethod {
  GET,
  POST
}
