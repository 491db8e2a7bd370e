package dev.remedia.config;

import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.embedding.onnx.bgesmallenv15q.BgeSmallEnV15QuantizedEmbeddingModel;
import dev.langchain4j.store.embedding.EmbeddingStore;
import dev.langchain4j.store.embedding.pgvector.PgVectorEmbeddingStore;
import javax.sql.DataSource;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configures the query embedding model and the vector store read by the chunk store adapter.
 *
 * <p>Uses the ONNX-based bge-small-en-v1.5 quantized model (384 dimensions) running in-process,
 * avoiding any external embedding API. The {@link PgVectorEmbeddingStore} shares the
 * application's HikariCP {@link DataSource} to avoid duplicate connection pools.
 *
 * @see dev.remedia.chunk.PgChunkStore
 */
@Configuration
public class EmbeddingConfig {

  /** Dimension of bge-small-en-v1.5 embeddings; must match the {@code embedding} column. */
  static final int EMBEDDING_DIMENSION = 384;

  /**
   * Provides the in-process ONNX embedding model (bge-small-en-v1.5 quantized, 384 dimensions).
   *
   * @return a ready-to-use embedding model requiring no external API
   */
  @Bean
  public EmbeddingModel embeddingModel() {
    return new BgeSmallEnV15QuantizedEmbeddingModel();
  }

  /**
   * Configures the pgvector embedding store over the existing {@code document_chunks} table.
   *
   * <p>Schema and HNSW index are managed by Flyway; {@code createTable} and {@code useIndex} are
   * disabled to avoid conflicts.
   *
   * @param dataSource the shared HikariCP data source (no duplicate pool)
   * @return a vector-search-capable embedding store backed by pgvector
   */
  @Bean
  public EmbeddingStore<TextSegment> embeddingStore(DataSource dataSource) {
    return PgVectorEmbeddingStore.datasourceBuilder()
        .datasource(dataSource)
        .table("document_chunks")
        .dimension(EMBEDDING_DIMENSION)
        .createTable(false) // Schema managed by Flyway migrations
        .useIndex(false) // HNSW index managed by Flyway V1
        .build();
  }
}
