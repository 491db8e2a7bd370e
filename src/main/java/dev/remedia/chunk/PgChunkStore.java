package dev.remedia.chunk;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.store.embedding.EmbeddingMatch;
import dev.langchain4j.store.embedding.EmbeddingSearchRequest;
import dev.langchain4j.store.embedding.EmbeddingStore;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

/**
 * {@link ChunkStore} backed by PostgreSQL: full-text search through {@link ChunkRepository},
 * vector search through the LangChain4j pgvector {@link EmbeddingStore}, content through JPA.
 *
 * <p>Metadata keys {@value #SECTION_ID}, {@value #WINDOW_INDEX}, {@value #TITLE} and {@value
 * #ATTRIBUTION} are lifted onto the {@link Candidate}; every other key is passed through as a
 * string. A row with unreadable metadata still yields a candidate (own section, unknown window).
 */
@Component
public class PgChunkStore implements ChunkStore {

  private static final Logger log = LoggerFactory.getLogger(PgChunkStore.class);

  static final String SECTION_ID = "section_id";
  static final String WINDOW_INDEX = "window_index";
  static final String TITLE = "title";
  static final String ATTRIBUTION = "attribution";

  private static final TypeReference<Map<String, Object>> METADATA_TYPE = new TypeReference<>() {};

  private final ChunkRepository chunkRepository;
  private final EmbeddingStore<TextSegment> embeddingStore;
  private final ObjectMapper objectMapper;

  public PgChunkStore(
      ChunkRepository chunkRepository,
      EmbeddingStore<TextSegment> embeddingStore,
      ObjectMapper objectMapper) {
    this.chunkRepository = chunkRepository;
    this.embeddingStore = embeddingStore;
    this.objectMapper = objectMapper;
  }

  @Override
  public List<String> termSearch(String query, int limit) {
    try {
      return chunkRepository.fullTextSearch(query, limit).stream().distinct().toList();
    } catch (DataAccessException e) {
      throw new ChunkStoreException("Full-text search failed: " + e.getMessage(), e);
    }
  }

  @Override
  public List<String> vectorSearch(float[] vector, int limit) {
    EmbeddingSearchRequest request =
        EmbeddingSearchRequest.builder()
            .queryEmbedding(Embedding.from(vector))
            .maxResults(limit)
            .minScore(0.0)
            .build();
    try {
      return embeddingStore.search(request).matches().stream()
          .map(EmbeddingMatch::embeddingId)
          .distinct()
          .toList();
    } catch (RuntimeException e) {
      throw new ChunkStoreException("Vector search failed: " + e.getMessage(), e);
    }
  }

  @Override
  public Map<String, Candidate> fetchByIds(Collection<String> ids) {
    List<UUID> uuids = new ArrayList<>(ids.size());
    for (String id : ids) {
      try {
        uuids.add(UUID.fromString(id));
      } catch (IllegalArgumentException e) {
        log.warn("Skipping candidate id that is not a UUID: {}", id);
      }
    }
    if (uuids.isEmpty()) {
      return Map.of();
    }

    List<ChunkEntity> rows;
    try {
      rows = chunkRepository.findAllById(uuids);
    } catch (DataAccessException e) {
      throw new ChunkStoreException("Chunk fetch failed: " + e.getMessage(), e);
    }

    Map<String, Candidate> candidates = new LinkedHashMap<>();
    for (ChunkEntity row : rows) {
      Candidate candidate = toCandidate(row);
      candidates.put(candidate.id(), candidate);
    }
    return candidates;
  }

  Candidate toCandidate(ChunkEntity row) {
    String id = row.getId().toString();
    Map<String, String> metadata = parseMetadata(id, row.getMetadata());

    String sectionId = metadata.remove(SECTION_ID);
    String window = metadata.remove(WINDOW_INDEX);
    String title = metadata.remove(TITLE);
    String attribution = metadata.remove(ATTRIBUTION);

    return new Candidate(
        id,
        sectionId != null && !sectionId.isBlank() ? sectionId : id,
        parseWindowIndex(id, window),
        row.getText(),
        metadata,
        title,
        attribution);
  }

  private Map<String, String> parseMetadata(String id, @Nullable String json) {
    Map<String, String> metadata = new LinkedHashMap<>();
    if (json == null || json.isBlank()) {
      return metadata;
    }
    try {
      Map<String, Object> raw = objectMapper.readValue(json, METADATA_TYPE);
      raw.forEach(
          (key, value) -> {
            if (value != null) {
              metadata.put(key, String.valueOf(value));
            }
          });
    } catch (JsonProcessingException e) {
      log.warn("Unreadable metadata on chunk {}: {}", id, e.getOriginalMessage());
    }
    return metadata;
  }

  private static int parseWindowIndex(String id, @Nullable String value) {
    if (value == null) {
      return Candidate.UNKNOWN_WINDOW;
    }
    try {
      return Integer.parseInt(value.trim());
    } catch (NumberFormatException e) {
      log.warn("Chunk {} has non-numeric window_index '{}'", id, value);
      return Candidate.UNKNOWN_WINDOW;
    }
  }
}
