package com.mk.fx.qa.bench.rest;

import com.fasterxml.jackson.core.JsonProcessingException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;

/**
 * Asynchronous HTTP client used to fire load requests. Requests are resolved against a base URL,
 * carry the global headers plus any request-specific ones, and are bounded by a per-request
 * timeout. This implementation does not include retry logic.
 *
 * <p>Threading: the underlying {@link HttpClient} completes exchanges on a private pool of daemon
 * threads which is released by {@link #close()}.
 */
@Slf4j
public class LoadHttpClient implements AutoCloseable {

  /** Default request timeout. */
  private static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(30);

  private static final AtomicInteger CLIENT_SEQUENCE = new AtomicInteger();

  /** The underlying Java HTTP client. */
  private final HttpClient httpClient;

  /** Pool completing asynchronous exchanges. */
  private final ExecutorService ioExecutor;

  /** Global headers to be included in all requests. */
  private final Map<String, String> headers;

  /** Base URL for all requests. */
  private final String baseUrl;

  /** Timeout applied to requests that do not carry their own. */
  private final Duration requestTimeout;

  /**
   * Constructs a client with the default request timeout.
   *
   * @param baseUrl the base URL for all requests
   * @param connectTimeout connection timeout
   * @param headers global headers to include in all requests
   */
  public LoadHttpClient(String baseUrl, Duration connectTimeout, Map<String, String> headers) {
    this(baseUrl, connectTimeout, DEFAULT_REQUEST_TIMEOUT, headers);
  }

  /**
   * Constructs a client with a specified request timeout.
   *
   * @param baseUrl the base URL for all requests
   * @param connectTimeout connection timeout
   * @param requestTimeout timeout applied to each request unless overridden
   * @param headers global headers to include in all requests
   */
  public LoadHttpClient(
      String baseUrl,
      Duration connectTimeout,
      Duration requestTimeout,
      Map<String, String> headers) {
    this.baseUrl = validateAndNormalizeBaseUrl(baseUrl);
    this.requestTimeout = Objects.requireNonNull(requestTimeout, "requestTimeout");

    int clientId = CLIENT_SEQUENCE.incrementAndGet();
    AtomicInteger threadSequence = new AtomicInteger();
    ThreadFactory threadFactory =
        runnable -> {
          Thread thread = new Thread(runnable);
          thread.setName("bench-http-" + clientId + "-" + threadSequence.incrementAndGet());
          thread.setDaemon(true);
          return thread;
        };
    this.ioExecutor = Executors.newCachedThreadPool(threadFactory);

    this.httpClient =
        HttpClient.newBuilder()
            .connectTimeout(Objects.requireNonNull(connectTimeout, "connectTimeout"))
            .executor(ioExecutor)
            .build();

    this.headers = headers != null ? Map.copyOf(headers) : Map.of();

    log.info(
        "LoadHttpClient initialised - Base URL: {}, Connection timeout: {}ms,"
            + " Request timeout: {}ms",
        this.baseUrl,
        connectTimeout.toMillis(),
        requestTimeout.toMillis());
  }

  public String getBaseUrl() {
    return baseUrl;
  }

  /**
   * Executes an asynchronous REST request. Transport failures, including the request timeout
   * expiring, complete the returned future exceptionally; any HTTP status completes it normally.
   *
   * @param request the REST request to execute
   * @return a CompletableFuture containing the response data
   */
  public CompletableFuture<RestResponseData> executeAsync(Request request) {
    Objects.requireNonNull(request, "Request cannot be null");

    var startTime = System.nanoTime();

    HttpRequest httpRequest;
    try {
      httpRequest = buildHttpRequest(request);
    } catch (RuntimeException e) {
      return CompletableFuture.failedFuture(e);
    }

    log.debug("Executing async {} request to {}", request.getMethod(), httpRequest.uri());

    return httpClient
        .sendAsync(httpRequest, HttpResponse.BodyHandlers.ofString())
        .thenApply(
            response -> {
              var duration = (System.nanoTime() - startTime) / 1_000_000;
              log.debug(
                  "Async request completed in {} ms with status {}",
                  duration,
                  response.statusCode());
              return buildResponseData(response, duration);
            });
  }

  /**
   * Builds an HTTP request from the given Request.
   *
   * @param request the Request to build
   * @return the constructed HttpRequest
   * @throws IllegalArgumentException if the request cannot be turned into a valid HTTP request
   */
  private HttpRequest buildHttpRequest(Request request) {
    if (request.getMethod() == null) {
      throw new IllegalArgumentException("Request method is required");
    }
    var url = baseUrl + (request.getPath() != null ? request.getPath() : "");

    var requestBuilder =
        HttpRequest.newBuilder()
            .uri(URI.create(url))
            .timeout(request.getTimeout() != null ? request.getTimeout() : requestTimeout);

    // global headers
    headers.forEach(requestBuilder::header);

    // request-specific headers override
    if (request.getHeaders() != null) {
      request.getHeaders().forEach(requestBuilder::setHeader);
    }

    if (request.getBody() != null) {
      try {
        var jsonBody = JsonUtil.toJson(request.getBody());
        requestBuilder
            .method(request.getMethod().name(), HttpRequest.BodyPublishers.ofString(jsonBody))
            .header("Content-Type", "application/json");
      } catch (JsonProcessingException e) {
        throw new IllegalArgumentException(
            "Failed to serialize request body: " + e.getMessage(), e);
      }
    } else {
      requestBuilder.method(request.getMethod().name(), HttpRequest.BodyPublishers.noBody());
    }

    return requestBuilder.build();
  }

  /**
   * Builds a RestResponseData object from the HTTP response.
   *
   * @param response the HTTP response
   * @param durationMs the duration of the request in milliseconds
   * @return the constructed RestResponseData
   */
  private RestResponseData buildResponseData(HttpResponse<String> response, long durationMs) {
    var result = new RestResponseData();
    result.setStatusCode(response.statusCode());
    result.setHeaders(
        response.headers().map().entrySet().stream()
            .collect(Collectors.toMap(Map.Entry::getKey, e -> String.join(",", e.getValue()))));
    result.setBody(response.body());
    result.setResponseTimeMs(durationMs);
    return result;
  }

  /**
   * Validates and normalizes the base URL.
   *
   * @param baseUrl the base URL to validate
   * @return the normalized base URL
   * @throws IllegalArgumentException if the base URL is empty
   */
  private String validateAndNormalizeBaseUrl(String baseUrl) {
    Objects.requireNonNull(baseUrl, "Base URL cannot be null");
    var trimmed = baseUrl.trim();
    if (trimmed.isEmpty()) {
      throw new IllegalArgumentException("Base URL cannot be empty");
    }
    return trimmed.endsWith("/") ? trimmed.substring(0, trimmed.length() - 1) : trimmed;
  }

  @Override
  public void close() {
    ioExecutor.shutdownNow();
    try {
      if (!ioExecutor.awaitTermination(2, TimeUnit.SECONDS)) {
        log.warn("HTTP I/O threads for {} did not stop within 2s", baseUrl);
      }
    } catch (InterruptedException interrupted) {
      Thread.currentThread().interrupt();
    }
  }
}
