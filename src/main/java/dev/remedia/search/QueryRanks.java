package dev.remedia.search;

import java.util.List;

/**
 * Both backend rank lists gathered for one query.
 *
 * @param query the query text
 * @param text lexical ranking (empty if the backend failed or timed out)
 * @param vector vector ranking (empty if embedding or the backend failed or timed out)
 */
public record QueryRanks(String query, RankList text, RankList vector) {

  public List<RankList> lists() {
    return List.of(text, vector);
  }
}
