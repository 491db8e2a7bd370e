package dev.remedia.chunk;

import static org.assertj.core.api.Assertions.assertThat;

import dev.remedia.BaseIntegrationTest;
import dev.remedia.search.SearchProperties;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

class PgChunkStoreIT extends BaseIntegrationTest {

  @Autowired ChunkStore chunkStore;

  @Test
  void termSearchRanksMatchingChunks() {
    String aconite =
        seed("Great fear of death; anxiety and restlessness.", "aconite-mind", 0, "Aconite");
    seed("Healing of wounds and lacerations.", "calendula-skin", 0, "Calendula");

    List<String> ids = chunkStore.termSearch("fear death", 10);

    assertThat(ids).containsExactly(aconite);
  }

  @Test
  void termSearchWithoutMatchesIsEmpty() {
    seed("Healing of wounds and lacerations.", "calendula-skin", 0, "Calendula");

    assertThat(chunkStore.termSearch("insomnia", 10)).isEmpty();
  }

  @Test
  void vectorSearchFindsSemanticallyClosestChunkFirst() {
    String anxious =
        seed("Great fear of death; anxiety and restlessness.", "aconite-mind", 0, "Aconite");
    seed("Healing of wounds and lacerations.", "calendula-skin", 0, "Calendula");

    float[] query =
        embeddingModel
            .embed(SearchProperties.BGE_QUERY_PREFIX + "remedy for being afraid of dying")
            .content()
            .vector();

    List<String> ids = chunkStore.vectorSearch(query, 2);

    assertThat(ids).hasSize(2).first().isEqualTo(anxious);
  }

  @Test
  void fetchByIdsMapsStructuralMetadata() {
    String id =
        seed("Fear of death.", "aconite-mind", 3, "Aconite", Map.of("chapter", "Mind"));

    Candidate candidate = chunkStore.fetchByIds(List.of(id)).get(id);

    assertThat(candidate.sectionId()).isEqualTo("aconite-mind");
    assertThat(candidate.windowIndex()).isEqualTo(3);
    assertThat(candidate.title()).isEqualTo("Aconite");
    assertThat(candidate.attribution()).isEqualTo("Aconite, Boericke Materia Medica");
    assertThat(candidate.metadata()).containsEntry("chapter", "Mind");
  }
}
