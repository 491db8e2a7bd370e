package dev.remedia.search;

import dev.remedia.chunk.Candidate;
import java.util.List;
import java.util.Map;

/**
 * Everything the backend fan-out of one run produced.
 *
 * @param queries rank lists per query, in request order
 * @param failures backend calls that failed, in no particular order
 * @param candidates immutable snapshot of the content fetched for ranked ids
 * @param deadlineExceeded true when the fan-out was cut short by the deadline or by cancellation
 * @param attemptedCalls number of backend calls started (two per distinct query)
 */
public record DispatchResult(
    List<QueryRanks> queries,
    List<BackendFailure> failures,
    Map<String, Candidate> candidates,
    boolean deadlineExceeded,
    int attemptedCalls) {

  public DispatchResult {
    queries = List.copyOf(queries);
    failures = List.copyOf(failures);
    candidates = Map.copyOf(candidates);
  }

  /** True when every attempted backend call failed, leaving nothing to rank. */
  public boolean allBackendsFailed() {
    return attemptedCalls > 0 && failures.size() >= attemptedCalls;
  }

  /** All rank lists of all queries, text before vector within a query. */
  public List<RankList> allLists() {
    return queries.stream().flatMap(q -> q.lists().stream()).toList();
  }
}
