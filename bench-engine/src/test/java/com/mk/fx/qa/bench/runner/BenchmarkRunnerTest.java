package com.mk.fx.qa.bench.runner;

import static org.assertj.core.api.Assertions.assertThat;

import com.mk.fx.qa.bench.cfg.RunConfig;
import com.mk.fx.qa.bench.metrics.EndpointMetrics;
import com.mk.fx.qa.bench.model.ErrorKind;
import com.mk.fx.qa.bench.model.LatencyMergeStrategy;
import com.mk.fx.qa.bench.model.SelectionMode;
import com.mk.fx.qa.bench.recorder.RequestSender;
import com.mk.fx.qa.bench.report.BenchmarkReport;
import com.mk.fx.qa.bench.report.ConsoleReporter;
import com.mk.fx.qa.bench.report.JsonReportWriter;
import com.mk.fx.qa.bench.rest.HttpMethod;
import com.mk.fx.qa.bench.rest.RestResponseData;
import com.mk.fx.qa.bench.selector.EndpointCall;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.io.PrintStream;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.stream.Collectors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class BenchmarkRunnerTest {

  @TempDir Path tempDir;

  private HttpServer server;
  private ExecutorService serverPool;
  private String baseUrl;
  private final Queue<String> depositBodies = new ConcurrentLinkedQueue<>();
  private final Queue<String> depositMethods = new ConcurrentLinkedQueue<>();

  private ByteArrayOutputStream console;
  private BenchmarkRunner runner;

  @BeforeEach
  void setUp() throws Exception {
    server = HttpServer.create(new InetSocketAddress(0), 0);
    serverPool = Executors.newCachedThreadPool();
    server.setExecutor(serverPool);
    server.createContext("/ok", exchange -> respond(exchange, 200, "{\"ok\":true}"));
    server.createContext("/err", exchange -> respond(exchange, 500, "{\"error\":\"boom\"}"));
    server.createContext(
        "/deposit",
        exchange -> {
          depositMethods.add(exchange.getRequestMethod());
          depositBodies.add(
              new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
          respond(exchange, 200, "{\"balance\":1001}");
        });
    server.createContext(
        "/slow",
        exchange -> {
          try {
            Thread.sleep(800);
          } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
          }
          respond(exchange, 200, "late");
        });
    server.start();
    baseUrl = "http://127.0.0.1:" + server.getAddress().getPort();

    console = new ByteArrayOutputStream();
    runner =
        new BenchmarkRunner(
            new ConsoleReporter(new PrintStream(console, true, StandardCharsets.UTF_8)),
            new JsonReportWriter());
  }

  @AfterEach
  void tearDown() {
    if (server != null) server.stop(0);
    if (serverPool != null) serverPool.shutdownNow();
  }

  private static void respond(HttpExchange exchange, int status, String text) throws IOException {
    byte[] body = text.getBytes(StandardCharsets.UTF_8);
    exchange.sendResponseHeaders(status, body.length);
    try (OutputStream os = exchange.getResponseBody()) {
      os.write(body);
    }
  }

  private static RunConfig config(
      String baseUrl,
      SelectionMode mode,
      int concurrency,
      int totalRequests,
      int repeat,
      List<String> endpoints,
      Long seed,
      Path reportFile) {
    return new RunConfig(
        baseUrl,
        concurrency,
        Duration.ofMillis(300),
        Duration.ofSeconds(1),
        totalRequests,
        repeat,
        endpoints,
        Set.of("/deposit"),
        Map.of(),
        mode,
        seed,
        LatencyMergeStrategy.AVERAGE_REPLAY,
        reportFile);
  }

  private static EndpointMetrics metricsOf(BenchmarkReport report, String endpoint) {
    return report.summary().metrics().stream()
        .filter(m -> m.endpoint().equals(endpoint))
        .findFirst()
        .orElseThrow();
  }

  private static RestResponseData status(int code) {
    var data = new RestResponseData();
    data.setStatusCode(code);
    return data;
  }

  @Test
  void randomMode_mergesRepeatedRunsOverHttp() throws Exception {
    var config =
        config(baseUrl, SelectionMode.RANDOM, 3, 10, 2, List.of("/ok", "/err"), 7L, null);

    BenchmarkReport report = runner.run(config);

    assertThat(report.runs()).hasSize(2);
    assertThat(report.summary().runCount()).isEqualTo(2);
    assertThat(report.summary().metrics())
        .extracting(EndpointMetrics::endpoint)
        .containsExactly("/err", "/ok");

    EndpointMetrics ok = metricsOf(report, "/ok");
    EndpointMetrics err = metricsOf(report, "/err");
    assertThat(ok.totalRequests() + err.totalRequests()).isEqualTo(20);
    assertThat(ok.successes()).isEqualTo(ok.totalRequests());
    assertThat(err.successes()).isZero();
    assertThat(err.errorBreakdown()).containsOnlyKeys(ErrorKind.HTTP_ERROR);
    assertThat(err.errorBreakdown().get(ErrorKind.HTTP_ERROR)).isEqualTo(err.totalRequests());
    assertThat(report.summary().totalDurationMs())
        .isEqualTo(report.runs().get(0).durationMs() + report.runs().get(1).durationMs());

    String out = console.toString(StandardCharsets.UTF_8);
    assertThat(out)
        .contains("--- Run 1/2")
        .contains("--- Run 2/2")
        .contains("=== Final summary (2 runs, latency merge: AVERAGE_REPLAY) ===");
  }

  @Test
  void sequentialMode_sendsOneBatchPerEndpoint() throws Exception {
    var config =
        config(
            baseUrl,
            SelectionMode.SEQUENTIAL,
            2,
            999,
            1,
            List.of("/ok", "/deposit", "/slow"),
            null,
            null);

    BenchmarkReport report = runner.run(config);

    assertThat(report.summary().metrics())
        .allSatisfy(m -> assertThat(m.totalRequests()).isEqualTo(2));
    assertThat(metricsOf(report, "/ok").successes()).isEqualTo(2);
    assertThat(metricsOf(report, "/deposit").successes()).isEqualTo(2);
    assertThat(depositMethods).containsOnly("POST");
    assertThat(depositBodies)
        .hasSize(2)
        .allSatisfy(body -> assertThat(body).isEqualTo("{\"amount\":1}"));

    EndpointMetrics slow = metricsOf(report, "/slow");
    assertThat(slow.failures()).isEqualTo(2);
    assertThat(slow.errorBreakdown()).containsEntry(ErrorKind.TIMEOUT, 2L);
    assertThat(slow.latency().min()).isGreaterThanOrEqualTo(250);
    assertThat(slow.runDurationMs()).isGreaterThanOrEqualTo(250);
    assertThat(slow.runDurationMs()).isLessThanOrEqualTo(report.runs().get(0).durationMs());
  }

  @Test
  void unreachableTarget_isReportedAsConnectionErrors() throws Exception {
    int closedPort;
    try (ServerSocket socket = new ServerSocket(0)) {
      closedPort = socket.getLocalPort();
    }
    var config =
        config(
            "http://127.0.0.1:" + closedPort,
            SelectionMode.RANDOM,
            2,
            4,
            1,
            List.of("/ok"),
            1L,
            null);

    EndpointMetrics ok = metricsOf(runner.run(config), "/ok");

    assertThat(ok.totalRequests()).isEqualTo(4);
    assertThat(ok.failures()).isEqualTo(4);
    assertThat(ok.throughputReqPerSec()).isZero();
    assertThat(ok.errorBreakdown()).containsEntry(ErrorKind.CONNECTION_ERROR, 4L);
  }

  @Test
  void reportFile_isWrittenWhenConfigured() throws Exception {
    Path target = tempDir.resolve("out/report.json");
    var config =
        config(baseUrl, SelectionMode.RANDOM, 2, 4, 1, List.of("/ok"), 3L, target);

    runner.run(config);

    assertThat(target).exists();
    assertThat(Files.readString(target)).contains("\"endpoint\" : \"/ok\"");
  }

  @Test
  void sameSeed_sameEndpointMix() throws Exception {
    RequestSender sender = (call, timeout) -> CompletableFuture.completedFuture(status(200));
    var config =
        config(
            "http://unused", SelectionMode.RANDOM, 5, 50, 1, List.of("/a", "/b", "/c"), 11L, null);

    var first = runner.run(config, sender).summary().metrics();
    var second = runner.run(config, sender).summary().metrics();

    assertThat(first)
        .extracting(EndpointMetrics::totalRequests)
        .containsExactlyElementsOf(
            second.stream().map(EndpointMetrics::totalRequests).collect(Collectors.toList()));
    assertThat(first.stream().mapToLong(EndpointMetrics::totalRequests).sum()).isEqualTo(50);
  }

  @Test
  void mutatingEndpoints_areSentAsPostWithPayload() throws Exception {
    Queue<EndpointCall> calls = new ConcurrentLinkedQueue<>();
    RequestSender sender =
        (call, timeout) -> {
          calls.add(call);
          return CompletableFuture.completedFuture(status(200));
        };
    var config =
        config(
            "http://unused",
            SelectionMode.SEQUENTIAL,
            1,
            0,
            1,
            List.of("/deposit", "/ok"),
            null,
            null);

    runner.run(config, sender);

    assertThat(calls)
        .containsExactly(
            new EndpointCall("/deposit", HttpMethod.POST, Map.of("amount", 1)),
            new EndpointCall("/ok", HttpMethod.GET, null));
  }

  @Test
  void emptyBudget_reportsZeroMetricsForEveryEndpoint() throws Exception {
    RequestSender sender = (call, timeout) -> CompletableFuture.completedFuture(status(200));
    var config =
        config("http://unused", SelectionMode.RANDOM, 4, 0, 1, List.of("/b", "/a"), null, null);

    BenchmarkReport report = runner.run(config, sender);

    assertThat(report.summary().metrics())
        .extracting(EndpointMetrics::endpoint)
        .containsExactly("/a", "/b");
    assertThat(report.summary().metrics())
        .allSatisfy(
            m -> {
              assertThat(m.totalRequests()).isZero();
              assertThat(m.throughputReqPerSec()).isZero();
            });
  }
}
