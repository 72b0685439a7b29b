package com.mk.fx.qa.bench.cfg;

import com.mk.fx.qa.bench.model.LatencyMergeStrategy;
import com.mk.fx.qa.bench.model.SelectionMode;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/**
 * Benchmark settings bound from {@code bench.*}. Resolved into an immutable {@link RunConfig}
 * before any request is sent.
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "bench")
public class BenchProperties {

  public static final List<String> DEFAULT_ENDPOINTS =
      List.of(
          "/compute",
          "/counter",
          "/slow",
          "/factorial/10",
          "/fibonacci/10",
          "/deposit",
          "/withdraw",
          "/account");

  public static final List<String> DEFAULT_MUTATING_ENDPOINTS = List.of("/deposit", "/withdraw");

  @NotBlank private String baseUrl = "http://localhost:3000";

  /** Maximum number of requests outstanding within one batch. */
  @Positive private int concurrency = 10;

  /** Per-request abort threshold. */
  @Positive private long timeoutMs = 5_000;

  @Positive private long connectTimeoutMs = 5_000;

  /** Request budget of one run in random mode. */
  @PositiveOrZero private int totalRequests = 100;

  @Min(1)
  private int repeat = 1;

  @NotEmpty private List<String> endpoints = new ArrayList<>(DEFAULT_ENDPOINTS);

  /** Endpoints sent as POST with a JSON body; everything else is a GET. */
  private List<String> mutatingEndpoints = new ArrayList<>(DEFAULT_MUTATING_ENDPOINTS);

  private Map<String, String> headers = new LinkedHashMap<>();

  @NotNull private SelectionMode mode = SelectionMode.RANDOM;

  /** Seed for random endpoint selection; unseeded when absent. */
  private Long seed;

  @NotNull private LatencyMergeStrategy latencyMerge = LatencyMergeStrategy.AVERAGE_REPLAY;

  /** Optional path of a JSON export of the whole report. */
  private String reportFile;

  private boolean runOnStartup = true;
}
