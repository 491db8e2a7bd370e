package dev.remedia.search;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Ordered result of one backend for one query, best first.
 *
 * <p>Duplicate ids are collapsed on construction (first occurrence wins) so every id has exactly
 * one rank. An id missing from the list is unranked by that backend.
 *
 * @param backend the backend that produced the list
 * @param weight fusion weight of the backend
 * @param ids candidate ids, best first
 */
public record RankList(Backend backend, double weight, List<String> ids) {

  /** Compact constructor validating input and removing duplicate ids. */
  public RankList {
    Objects.requireNonNull(backend, "backend");
    if (weight < 0.0) {
      throw new IllegalArgumentException("weight must not be negative");
    }
    Set<String> unique = new LinkedHashSet<>(Objects.requireNonNull(ids, "ids"));
    ids = List.copyOf(unique);
  }

  /** An empty list for a backend that failed or was not queried. */
  public static RankList empty(Backend backend, double weight) {
    return new RankList(backend, weight, List.of());
  }

  public boolean isEmpty() {
    return ids.isEmpty();
  }

  public int size() {
    return ids.size();
  }

  /** Returns the list as 1-based rank entries. */
  public List<RankEntry> entries() {
    List<RankEntry> entries = new ArrayList<>(ids.size());
    for (int i = 0; i < ids.size(); i++) {
      entries.add(new RankEntry(ids.get(i), i + 1));
    }
    return entries;
  }
}
