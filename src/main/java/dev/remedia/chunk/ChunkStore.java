package dev.remedia.chunk;

import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Read-only view of the chunk index consumed by the search engine.
 *
 * <p>Both search methods return candidate ids ordered best-first without duplicates. Callers may
 * invoke all methods concurrently; implementations must be thread-safe and should respond to
 * thread interruption where the underlying client allows it.
 *
 * @see PgChunkStore
 */
public interface ChunkStore {

  /**
   * Lexical search over chunk text.
   *
   * @param query free-text query
   * @param limit maximum number of ids to return
   * @return ranked candidate ids, best first
   */
  List<String> termSearch(String query, int limit);

  /**
   * Nearest-neighbour search over chunk embeddings.
   *
   * @param vector query embedding
   * @param limit maximum number of ids to return
   * @return ranked candidate ids, best first
   */
  List<String> vectorSearch(float[] vector, int limit);

  /**
   * Batch content fetch. Ids unknown to the store are absent from the returned map.
   *
   * @param ids candidate ids to load
   * @return candidates keyed by id
   */
  Map<String, Candidate> fetchByIds(Collection<String> ids);
}
