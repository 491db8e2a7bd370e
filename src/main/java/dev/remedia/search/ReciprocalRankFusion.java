package dev.remedia.search;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Pure static utility fusing backend rank lists with Reciprocal Rank Fusion.
 *
 * <p>Every candidate that appears in at least one list scores {@code sum(w_e / (rrfK + rank_e))}
 * over the lists that rank it; lists that do not rank it contribute nothing. Raw backend scores are
 * never looked at, only positions.
 *
 * <p>The fused ordering is a total order: score descending, then the smallest individual backend
 * rank, then candidate id. Contributions are summed in list order, so identical inputs give
 * bit-identical output.
 *
 * <p>This class has no Spring dependencies and no state -- all methods are pure functions.
 */
public final class ReciprocalRankFusion {

  /** Fused ordering: score desc, best backend rank asc, id asc. */
  static final Comparator<Scored> FUSED_ORDER =
      Comparator.comparingDouble(Scored::score)
          .reversed()
          .thenComparingInt(Scored::bestBackendRank)
          .thenComparing(Scored::candidateId);

  private ReciprocalRankFusion() {}

  /**
   * Fuses rank lists into one scored ranking.
   *
   * <p>Algorithm:
   *
   * <ol>
   *   <li>For each list (in order) and each 1-based rank r: add {@code weight / (rrfK + r)} to
   *       the candidate's score and remember the smallest rank seen
   *   <li>Sort by the fused ordering and keep the first {@code maxChunks}
   *   <li>Assign fused ranks 1..n in that order
   * </ol>
   *
   * @param lists backend rank lists; empty lists are allowed
   * @param rrfK damping constant, larger values flatten the influence of rank position
   * @param maxChunks maximum number of candidates in {@link FusionResult#top()}
   * @return scores of all ranked candidates and the ordered top selection
   */
  public static FusionResult fuse(List<RankList> lists, int rrfK, int maxChunks) {
    Map<String, Accumulator> accumulated = new LinkedHashMap<>();

    for (RankList list : lists) {
      for (RankEntry entry : list.entries()) {
        double contribution = list.weight() / (rrfK + entry.rank());
        accumulated
            .computeIfAbsent(entry.candidateId(), id -> new Accumulator())
            .add(contribution, entry.rank());
      }
    }

    if (accumulated.isEmpty()) {
      return FusionResult.empty();
    }

    List<Scored> scored = new ArrayList<>(accumulated.size());
    accumulated.forEach((id, acc) -> scored.add(new Scored(id, acc.score, acc.bestRank)));
    return select(scored, maxChunks);
  }

  /**
   * Merges independently fused per-query results of a batch into one ranking.
   *
   * <p>A candidate's merged score is the sum of its fused scores over the queries whose top
   * selection contains it; its tie-break rank is the smallest backend rank seen in any of them.
   * The merged list is ordered and truncated exactly like {@link #fuse}.
   *
   * @param perQuery fusion results, one per query, in query order
   * @param maxChunks maximum number of candidates kept after the merge
   * @return merged result; a single input is returned re-truncated but otherwise unchanged
   */
  public static FusionResult mergeBatch(List<FusionResult> perQuery, int maxChunks) {
    Map<String, Accumulator> accumulated = new LinkedHashMap<>();

    for (FusionResult result : perQuery) {
      for (FusedCandidate candidate : result.top()) {
        accumulated
            .computeIfAbsent(candidate.candidateId(), id -> new Accumulator())
            .add(candidate.score(), candidate.bestBackendRank());
      }
    }

    if (accumulated.isEmpty()) {
      return FusionResult.empty();
    }

    List<Scored> scored = new ArrayList<>(accumulated.size());
    accumulated.forEach((id, acc) -> scored.add(new Scored(id, acc.score, acc.bestRank)));
    return select(scored, maxChunks);
  }

  private static FusionResult select(List<Scored> scored, int maxChunks) {
    Map<String, Double> scores = new LinkedHashMap<>();
    for (Scored s : scored) {
      scores.put(s.candidateId(), s.score());
    }

    List<Scored> ordered = scored.stream().sorted(FUSED_ORDER).limit(maxChunks).toList();

    List<FusedCandidate> top = new ArrayList<>(ordered.size());
    for (int i = 0; i < ordered.size(); i++) {
      Scored s = ordered.get(i);
      top.add(new FusedCandidate(s.candidateId(), s.score(), s.bestBackendRank(), i + 1));
    }
    return new FusionResult(scores, top);
  }

  /** Mutable per-candidate running total, local to one fusion call. */
  private static final class Accumulator {
    private double score;
    private int bestRank = Integer.MAX_VALUE;

    void add(double contribution, int rank) {
      score += contribution;
      bestRank = Math.min(bestRank, rank);
    }
  }

  /** Internal holder for a scored candidate before fused ranks are assigned. */
  record Scored(String candidateId, double score, int bestBackendRank) {}
}
