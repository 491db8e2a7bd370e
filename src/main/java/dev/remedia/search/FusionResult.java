package dev.remedia.search;

import java.util.List;
import java.util.Map;

/**
 * Output of a fusion: every scored candidate plus the ordered top selection.
 *
 * @param scores fused score of every candidate ranked by at least one list
 * @param top the highest-scoring candidates in fused order, fused ranks 1..n
 */
public record FusionResult(Map<String, Double> scores, List<FusedCandidate> top) {

  private static final FusionResult EMPTY = new FusionResult(Map.of(), List.of());

  public FusionResult {
    scores = Map.copyOf(scores);
    top = List.copyOf(top);
  }

  public static FusionResult empty() {
    return EMPTY;
  }

  public boolean isEmpty() {
    return top.isEmpty();
  }
}
