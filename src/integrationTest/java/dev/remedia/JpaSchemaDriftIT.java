package dev.remedia;

import static org.assertj.core.api.Assertions.assertThat;

import dev.remedia.chunk.ChunkEntity;
import dev.remedia.chunk.ChunkRepository;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.transaction.annotation.Transactional;

/**
 * Verifies the read-only chunk entity maps the rows LangChain4j writes into the Flyway schema.
 * Catches entity and migration drift at test time rather than at the first search.
 */
@Transactional
class JpaSchemaDriftIT extends BaseIntegrationTest {

  @Autowired private ChunkRepository chunkRepository;

  @Test
  void chunkReadableViaJpaAfterLangchain4jInsert() {
    String storedId = seed("Schema drift test window", "drift-section", 0, "Drift");

    ChunkEntity found = chunkRepository.findById(UUID.fromString(storedId)).orElseThrow();

    assertThat(found.getText()).isEqualTo("Schema drift test window");
    assertThat(found.getMetadata()).contains("\"section_id\"").contains("drift-section");
  }
}
