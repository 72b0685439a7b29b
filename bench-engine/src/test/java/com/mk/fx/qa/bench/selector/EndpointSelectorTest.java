package com.mk.fx.qa.bench.selector;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.stream.IntStream;
import org.junit.jupiter.api.Test;

class EndpointSelectorTest {

  private static final List<String> POOL = List.of("/a", "/b", "/c");

  private static List<String> pick(EndpointSelector selector, int count) {
    List<String> picks = new ArrayList<>();
    IntStream.range(0, count).forEach(i -> picks.add(selector.select(i)));
    return picks;
  }

  @Test
  void random_sameSeedGivesSameSequence() {
    var first = pick(new RandomEndpointSelector(POOL, new Random(7)), 50);
    var second = pick(new RandomEndpointSelector(POOL, new Random(7)), 50);

    assertThat(first).isEqualTo(second);
  }

  @Test
  void random_picksOnlyFromPool_andRoughlyUniformly() {
    Map<String, Integer> counts = new HashMap<>();
    pick(new RandomEndpointSelector(POOL, new Random(11)), 3_000)
        .forEach(e -> counts.merge(e, 1, Integer::sum));

    assertThat(counts).containsOnlyKeys(POOL);
    counts.values().forEach(count -> assertThat(count).isBetween(850, 1150));
  }

  @Test
  void sequential_sendsOneBatchPerEndpointInPoolOrder() {
    var picks = pick(new SequentialEndpointSelector(POOL, 2), 8);

    assertThat(picks).containsExactly("/a", "/a", "/b", "/b", "/c", "/c", "/a", "/a");
  }

  @Test
  void emptyPoolOrBadBatchSize_isRejected() {
    assertThatThrownBy(() -> new RandomEndpointSelector(List.of(), new Random()))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> new SequentialEndpointSelector(List.of(), 1))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> new SequentialEndpointSelector(POOL, 0))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
