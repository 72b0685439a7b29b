package com.mk.fx.qa.bench.model;

/** Classification of a request that did not end in a 2xx response. */
public enum ErrorKind {
  /** The per-request timeout expired before a response arrived. */
  TIMEOUT,
  /** The transport could not establish or complete the exchange; no status is available. */
  CONNECTION_ERROR,
  /** A response arrived with a non-2xx status. */
  HTTP_ERROR,
  UNKNOWN_ERROR
}
