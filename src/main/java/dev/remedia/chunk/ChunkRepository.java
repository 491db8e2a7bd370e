package dev.remedia.chunk;

import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

/** Spring Data repository for {@link ChunkEntity} rows. */
public interface ChunkRepository extends JpaRepository<ChunkEntity, UUID> {

  /**
   * Ranks chunks by PostgreSQL full-text relevance. Ties on {@code ts_rank_cd} are broken by id so
   * the ranking is stable across calls.
   *
   * @param query free-text query, parsed with {@code websearch_to_tsquery}
   * @param limit maximum number of ids
   * @return embedding ids as text, best first
   */
  @Query(
      value =
          """
            SELECT CAST(embedding_id AS text)
            FROM document_chunks
            WHERE to_tsvector('english', text) @@ websearch_to_tsquery('english', :query)
            ORDER BY ts_rank_cd(to_tsvector('english', text),
                                websearch_to_tsquery('english', :query)) DESC,
                     embedding_id
            LIMIT :limit
            """,
      nativeQuery = true)
  List<String> fullTextSearch(@Param("query") String query, @Param("limit") int limit);
}
