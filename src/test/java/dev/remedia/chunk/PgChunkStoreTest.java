package dev.remedia.chunk;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.store.embedding.EmbeddingMatch;
import dev.langchain4j.store.embedding.EmbeddingSearchRequest;
import dev.langchain4j.store.embedding.EmbeddingSearchResult;
import dev.langchain4j.store.embedding.EmbeddingStore;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

@ExtendWith(MockitoExtension.class)
class PgChunkStoreTest {

  private static final UUID ID_1 = UUID.fromString("00000000-0000-0000-0000-000000000001");
  private static final UUID ID_2 = UUID.fromString("00000000-0000-0000-0000-000000000002");

  @Mock ChunkRepository chunkRepository;

  @Mock EmbeddingStore<TextSegment> embeddingStore;

  @Captor ArgumentCaptor<EmbeddingSearchRequest> searchRequestCaptor;

  PgChunkStore store;

  @BeforeEach
  void setUp() {
    store = new PgChunkStore(chunkRepository, embeddingStore, new ObjectMapper());
  }

  @Test
  void termSearchReturnsDistinctIdsInRankOrder() {
    given(chunkRepository.fullTextSearch("fear of death", 20))
        .willReturn(List.of(ID_2.toString(), ID_1.toString(), ID_2.toString()));

    assertThat(store.termSearch("fear of death", 20))
        .containsExactly(ID_2.toString(), ID_1.toString());
  }

  @Test
  void termSearchWrapsDataAccessFailures() {
    given(chunkRepository.fullTextSearch("fear", 5))
        .willThrow(new DataAccessResourceFailureException("connection refused"));

    assertThatThrownBy(() -> store.termSearch("fear", 5))
        .isInstanceOf(ChunkStoreException.class)
        .hasMessageContaining("Full-text search failed")
        .hasCauseInstanceOf(DataAccessResourceFailureException.class);
  }

  @Test
  void vectorSearchSendsEmbeddingAndLimit() {
    EmbeddingMatch<TextSegment> match =
        new EmbeddingMatch<>(0.91, ID_1.toString(), Embedding.from(new float[] {0.1f}), null);
    given(embeddingStore.search(any())).willReturn(new EmbeddingSearchResult<>(List.of(match)));

    List<String> ids = store.vectorSearch(new float[] {0.1f, 0.2f}, 7);

    assertThat(ids).containsExactly(ID_1.toString());
    verify(embeddingStore).search(searchRequestCaptor.capture());
    assertThat(searchRequestCaptor.getValue().maxResults()).isEqualTo(7);
    assertThat(searchRequestCaptor.getValue().queryEmbedding().vector())
        .containsExactly(0.1f, 0.2f);
  }

  @Test
  void vectorSearchWrapsStoreFailures() {
    given(embeddingStore.search(any())).willThrow(new IllegalStateException("pgvector down"));

    assertThatThrownBy(() -> store.vectorSearch(new float[] {0.1f}, 3))
        .isInstanceOf(ChunkStoreException.class)
        .hasMessageContaining("pgvector down");
  }

  @Test
  void fetchLiftsStructuralMetadataOntoCandidate() {
    String metadata =
        """
        {"section_id":"aconite-mind","window_index":2,"title":"Aconitum napellus",
         "attribution":"Boericke (1901)","chapter":"Mind"}
        """;
    given(chunkRepository.findAllById(List.of(ID_1)))
        .willReturn(List.of(new ChunkEntity(ID_1, "Great fear and anxiety.", metadata)));

    Map<String, Candidate> fetched = store.fetchByIds(List.of(ID_1.toString()));

    Candidate candidate = fetched.get(ID_1.toString());
    assertThat(candidate.sectionId()).isEqualTo("aconite-mind");
    assertThat(candidate.windowIndex()).isEqualTo(2);
    assertThat(candidate.title()).isEqualTo("Aconitum napellus");
    assertThat(candidate.attribution()).isEqualTo("Boericke (1901)");
    assertThat(candidate.content()).isEqualTo("Great fear and anxiety.");
    assertThat(candidate.metadata()).containsExactly(Map.entry("chapter", "Mind"));
  }

  @Test
  void unreadableMetadataDegradesToOwnSectionAndUnknownWindow() {
    Candidate candidate = store.toCandidate(new ChunkEntity(ID_1, "text", "{not json"));

    assertThat(candidate.sectionId()).isEqualTo(ID_1.toString());
    assertThat(candidate.windowIndex()).isEqualTo(Candidate.UNKNOWN_WINDOW);
    assertThat(candidate.metadata()).isEmpty();
  }

  @Test
  void nonNumericWindowIndexBecomesUnknown() {
    Candidate candidate =
        store.toCandidate(
            new ChunkEntity(ID_1, "text", "{\"section_id\":\"s\",\"window_index\":\"second\"}"));

    assertThat(candidate.sectionId()).isEqualTo("s");
    assertThat(candidate.hasWindowIndex()).isFalse();
  }

  @Test
  void nonUuidIdsAreSkippedWithoutQuerying() {
    assertThat(store.fetchByIds(List.of("not-a-uuid"))).isEmpty();
    verifyNoInteractions(chunkRepository);
  }

  @Test
  void fetchWrapsDataAccessFailures() {
    given(chunkRepository.findAllById(any()))
        .willThrow(new DataAccessResourceFailureException("timeout"));

    assertThatThrownBy(() -> store.fetchByIds(List.of(ID_2.toString())))
        .isInstanceOf(ChunkStoreException.class)
        .hasMessageContaining("Chunk fetch failed");
  }
}
