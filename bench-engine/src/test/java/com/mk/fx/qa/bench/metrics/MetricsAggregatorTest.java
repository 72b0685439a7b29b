package com.mk.fx.qa.bench.metrics;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.mk.fx.qa.bench.model.ErrorKind;
import com.mk.fx.qa.bench.model.RequestOutcome;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class MetricsAggregatorTest {

  private static List<RequestOutcome> successes(String endpoint, long... latencies) {
    List<RequestOutcome> outcomes = new ArrayList<>();
    for (long latency : latencies) {
      outcomes.add(RequestOutcome.success(endpoint, 200, latency));
    }
    return outcomes;
  }

  @Test
  void computesCountsThroughputAndLatencyPerEndpoint() {
    var outcomes = successes("/x", 10, 20, 30, 40, 50);

    List<EndpointMetrics> metrics = MetricsAggregator.aggregate(outcomes, 1_000, List.of("/x"));

    assertThat(metrics).hasSize(1);
    EndpointMetrics m = metrics.get(0);
    assertThat(m.totalRequests()).isEqualTo(5);
    assertThat(m.successes()).isEqualTo(5);
    assertThat(m.failures()).isZero();
    assertThat(m.runDurationMs()).isEqualTo(1_000);
    assertThat(m.throughputReqPerSec()).isEqualTo(5.0);
    assertThat(m.latency()).isEqualTo(new LatencyStats(10, 50, 30, 30, 50, 50));
  }

  @Test
  void endpointWithoutOutcomes_isReportedWithZeros() {
    List<EndpointMetrics> metrics =
        MetricsAggregator.aggregate(successes("/a", 5, 7), 500, List.of("/a", "/b"));

    assertThat(metrics).extracting(EndpointMetrics::endpoint).containsExactly("/a", "/b");
    EndpointMetrics b = metrics.get(1);
    assertThat(b.totalRequests()).isZero();
    assertThat(b.successes()).isZero();
    assertThat(b.failures()).isZero();
    assertThat(b.throughputReqPerSec()).isZero();
    assertThat(b.latency()).isEqualTo(LatencyStats.EMPTY);
    assertThat(b.errorBreakdown()).isEmpty();
  }

  @Test
  void failuresCountTowardsTotalsAndLatency_butNotThroughput() {
    List<RequestOutcome> outcomes = new ArrayList<>(successes("/x", 10, 30));
    outcomes.add(RequestOutcome.httpError("/x", 500, 80));
    outcomes.add(RequestOutcome.failure("/x", ErrorKind.TIMEOUT, "timed out", 100));
    outcomes.add(RequestOutcome.failure("/x", ErrorKind.TIMEOUT, "timed out", 100));

    EndpointMetrics m = MetricsAggregator.aggregate(outcomes, 2_000, List.of("/x")).get(0);

    assertThat(m.totalRequests()).isEqualTo(5);
    assertThat(m.successes()).isEqualTo(2);
    assertThat(m.failures()).isEqualTo(3);
    assertThat(m.successes() + m.failures()).isEqualTo(m.totalRequests());
    assertThat(m.throughputReqPerSec()).isEqualTo(1.0);
    assertThat(m.latency().max()).isEqualTo(100);
    assertThat(m.latency().avg()).isEqualTo(64.0);
    assertThat(m.errorBreakdown())
        .containsExactlyInAnyOrderEntriesOf(
            Map.of(ErrorKind.HTTP_ERROR, 1L, ErrorKind.TIMEOUT, 2L));
  }

  @Test
  void throughputSharesTheRunDuration_andIsRoundedToTwoDecimals() {
    List<RequestOutcome> outcomes = new ArrayList<>(successes("/a", 1, 1));
    outcomes.addAll(successes("/b", 1));

    List<EndpointMetrics> metrics =
        MetricsAggregator.aggregate(outcomes, 3_000, List.of("/a", "/b"));

    assertThat(metrics.get(0).throughputReqPerSec()).isEqualTo(0.67);
    assertThat(metrics.get(1).throughputReqPerSec()).isEqualTo(0.33);
    assertThat(metrics).allSatisfy(m -> assertThat(m.runDurationMs()).isEqualTo(3_000));
  }

  @Test
  void zeroDuration_givesZeroThroughput() {
    EndpointMetrics m = MetricsAggregator.aggregate(successes("/a", 0), 0, List.of("/a")).get(0);

    assertThat(m.throughputReqPerSec()).isZero();
  }

  @Test
  void resultIsSortedByCodePoint() {
    String fullwidthTilde = "/～";
    String emoji = "/😀";
    List<RequestOutcome> outcomes = new ArrayList<>();
    outcomes.addAll(successes(emoji, 1));
    outcomes.addAll(successes("/z", 1));
    outcomes.addAll(successes(fullwidthTilde, 1));

    List<EndpointMetrics> metrics =
        MetricsAggregator.aggregate(outcomes, 10, List.of("/z", "/a", emoji, fullwidthTilde));

    assertThat(metrics)
        .extracting(EndpointMetrics::endpoint)
        .containsExactly("/a", "/z", fullwidthTilde, emoji);
  }

  @Test
  void aggregationIsIdempotent() {
    List<RequestOutcome> outcomes = new ArrayList<>(successes("/a", 3, 9, 4));
    outcomes.add(RequestOutcome.failure("/b", ErrorKind.CONNECTION_ERROR, "refused", 1));

    var first = MetricsAggregator.aggregate(outcomes, 1_234, List.of("/a", "/b", "/c"));
    var second = MetricsAggregator.aggregate(outcomes, 1_234, List.of("/a", "/b", "/c"));

    assertThat(first).isEqualTo(second);
  }

  @Test
  void emptyRun_reportsEveryPoolEndpoint() {
    var metrics = MetricsAggregator.aggregate(List.of(), 0, List.of("/b", "/a"));

    assertThat(metrics).extracting(EndpointMetrics::endpoint).containsExactly("/a", "/b");
    assertThat(metrics).allSatisfy(m -> assertThat(m.totalRequests()).isZero());
  }

  @Test
  void latencySamples_keepDispatchOrderPerEndpoint() {
    List<RequestOutcome> outcomes = new ArrayList<>(successes("/a", 30, 10));
    outcomes.addAll(successes("/b", 5));
    outcomes.addAll(successes("/a", 20));

    assertThat(MetricsAggregator.latencySamples(outcomes))
        .containsEntry("/a", List.of(30L, 10L, 20L))
        .containsEntry("/b", List.of(5L));
  }

  @Test
  void inconsistentCounts_areRejected() {
    assertThatThrownBy(
            () -> new EndpointMetrics("/a", 3, 1, 1, 10, 0, LatencyStats.EMPTY, Map.of()))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
