package com.mk.fx.qa.bench.executors.batch;

import com.mk.fx.qa.bench.model.RequestOutcome;
import java.util.List;

/**
 * Represents the result of a batched run.
 *
 * @param outcomes one outcome per dispatched request, in dispatch order
 * @param durationMs wall-clock time from the first batch's start to the last batch's completion
 * @param batches per-batch timing, in dispatch order
 */
public record BatchLoadResult(
    List<RequestOutcome> outcomes, long durationMs, List<BatchRecord> batches) {

  public BatchLoadResult {
    outcomes = List.copyOf(outcomes);
    batches = List.copyOf(batches);
  }

  public List<Integer> batchSizes() {
    return batches.stream().map(BatchRecord::size).toList();
  }

  public List<RequestOutcome> outcomesOf(BatchRecord batch) {
    return outcomes.subList(batch.firstRequestIndex(), batch.firstRequestIndex() + batch.size());
  }
}
