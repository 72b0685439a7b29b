package com.mk.fx.qa.bench.cfg;

import static com.google.common.base.Preconditions.checkArgument;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.mk.fx.qa.bench.model.LatencyMergeStrategy;
import com.mk.fx.qa.bench.model.SelectionMode;
import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Fully resolved parameters of a benchmark. Construction fails with {@link
 * IllegalArgumentException} on any invalid value, so a RunConfig that exists is always runnable.
 *
 * @param baseUrl target base URL
 * @param concurrency maximum outstanding requests per batch
 * @param timeout per-request timeout
 * @param connectTimeout TCP connect timeout
 * @param totalRequests request budget of one random-mode run
 * @param repeat number of runs merged into the final summary
 * @param endpoints ordered endpoint pool
 * @param mutatingEndpoints endpoints sent as POST with a JSON body
 * @param headers headers added to every request
 * @param mode endpoint selection policy
 * @param seed optional seed of the random selector
 * @param latencyMerge how latency is merged across runs
 * @param reportFile optional JSON export target
 */
public record RunConfig(
    String baseUrl,
    int concurrency,
    Duration timeout,
    Duration connectTimeout,
    int totalRequests,
    int repeat,
    List<String> endpoints,
    Set<String> mutatingEndpoints,
    @JsonIgnore Map<String, String> headers,
    SelectionMode mode,
    Long seed,
    LatencyMergeStrategy latencyMerge,
    Path reportFile) {

  public RunConfig {
    checkArgument(baseUrl != null && !baseUrl.isBlank(), "baseUrl must be provided");
    checkArgument(concurrency > 0, "concurrency must be > 0 but was %s", concurrency);
    checkArgument(isPositive(timeout), "timeout must be > 0 but was %s", timeout);
    checkArgument(
        isPositive(connectTimeout), "connectTimeout must be > 0 but was %s", connectTimeout);
    checkArgument(totalRequests >= 0, "totalRequests must be >= 0 but was %s", totalRequests);
    checkArgument(repeat > 0, "repeat must be > 0 but was %s", repeat);
    checkArgument(endpoints != null && !endpoints.isEmpty(), "endpoint pool must not be empty");
    checkArgument(
        endpoints.stream().allMatch(e -> e != null && !e.isBlank()),
        "endpoint identifiers must not be blank: %s",
        endpoints);
    Objects.requireNonNull(mode, "mode");
    Objects.requireNonNull(latencyMerge, "latencyMerge");
    if (mode == SelectionMode.SEQUENTIAL) {
      sequentialBudget(concurrency, endpoints.size());
    }

    baseUrl = baseUrl.trim();
    endpoints = List.copyOf(endpoints);
    mutatingEndpoints = mutatingEndpoints != null ? Set.copyOf(mutatingEndpoints) : Set.of();
    headers = headers != null ? Map.copyOf(headers) : Map.of();
  }

  /** Resolves bound properties, trimming endpoint identifiers and ignoring empty entries. */
  public static RunConfig from(BenchProperties properties) {
    Objects.requireNonNull(properties, "properties");
    var reportFile = properties.getReportFile();
    return new RunConfig(
        properties.getBaseUrl(),
        properties.getConcurrency(),
        Duration.ofMillis(properties.getTimeoutMs()),
        Duration.ofMillis(properties.getConnectTimeoutMs()),
        properties.getTotalRequests(),
        properties.getRepeat(),
        cleanIdentifiers(properties.getEndpoints()),
        Set.copyOf(cleanIdentifiers(properties.getMutatingEndpoints())),
        properties.getHeaders() != null ? new LinkedHashMap<>(properties.getHeaders()) : Map.of(),
        properties.getMode(),
        properties.getSeed(),
        properties.getLatencyMerge(),
        reportFile == null || reportFile.isBlank() ? null : Path.of(reportFile.trim()));
  }

  /** Number of requests one run dispatches under the configured selection mode. */
  public int requestsPerRun() {
    return mode == SelectionMode.SEQUENTIAL
        ? sequentialBudget(concurrency, endpoints.size())
        : totalRequests;
  }

  public OptionalLong seedValue() {
    return seed == null ? OptionalLong.empty() : OptionalLong.of(seed);
  }

  public Optional<Path> reportPath() {
    return Optional.ofNullable(reportFile);
  }

  private static List<String> cleanIdentifiers(List<String> values) {
    if (values == null) {
      return List.of();
    }
    return values.stream()
        .filter(Objects::nonNull)
        .map(String::trim)
        .filter(v -> !v.isEmpty())
        .collect(Collectors.toList());
  }

  /** One concurrency-sized batch per pool entry; a budget beyond int range is rejected. */
  private static int sequentialBudget(int concurrency, int poolSize) {
    try {
      return Math.multiplyExact(concurrency, poolSize);
    } catch (ArithmeticException overflow) {
      throw new IllegalArgumentException(
          "sequential budget of "
              + concurrency
              + " requests for each of "
              + poolSize
              + " endpoints exceeds "
              + Integer.MAX_VALUE,
          overflow);
    }
  }

  private static boolean isPositive(Duration duration) {
    return duration != null && !duration.isNegative() && !duration.isZero();
  }
}
