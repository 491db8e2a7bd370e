package dev.remedia.search;

import java.util.Collections;
import java.util.List;

/**
 * Domain request for one search run over a batch of queries.
 *
 * @param queries query texts, at least one, none blank
 * @param maxResults the maximum number of result units (sections) to emit (must be >= 1)
 */
public record SearchRequest(List<String> queries, int maxResults) {

  /** Default number of results when not specified. */
  private static final int DEFAULT_MAX_RESULTS = 10;

  /** Compact constructor validating input. */
  public SearchRequest {
    if (queries == null || queries.isEmpty()) {
      throw new IllegalArgumentException("At least one query is required");
    }
    for (String query : queries) {
      if (query == null || query.isBlank()) {
        throw new IllegalArgumentException("Query must not be blank");
      }
    }
    if (maxResults < 1) {
      throw new IllegalArgumentException("maxResults must be at least 1");
    }
    queries = List.copyOf(queries);
  }

  /** Convenience constructor for a single query, defaulting maxResults to 10. */
  public SearchRequest(String query) {
    this(Collections.singletonList(query), DEFAULT_MAX_RESULTS);
  }

  /** Convenience constructor for a single query. */
  public SearchRequest(String query, int maxResults) {
    this(Collections.singletonList(query), maxResults);
  }

  /** Convenience constructor for a batch, defaulting maxResults to 10. */
  public SearchRequest(List<String> queries) {
    this(queries, DEFAULT_MAX_RESULTS);
  }
}
