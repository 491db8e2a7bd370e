package dev.remedia.chunk;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.util.UUID;
import org.hibernate.annotations.Immutable;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

/**
 * Read-only mapping of one row of the {@code document_chunks} table.
 *
 * <p>The table is laid out by LangChain4j's {@code PgVectorEmbeddingStore}; the embedding column
 * is searched through the store and is not mapped here. Structural attributes (section, window,
 * title, attribution) live inside the JSONB metadata.
 *
 * @see ChunkRepository
 */
@Entity
@Immutable
@Table(name = "document_chunks")
public class ChunkEntity {

  @Id
  @Column(name = "embedding_id")
  private UUID id;

  @Column(columnDefinition = "TEXT")
  private String text;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(columnDefinition = "JSONB")
  private String metadata;

  protected ChunkEntity() {
    // JPA requires no-arg constructor
  }

  public ChunkEntity(UUID id, String text, String metadata) {
    this.id = id;
    this.text = text;
    this.metadata = metadata;
  }

  public UUID getId() {
    return id;
  }

  public String getText() {
    return text;
  }

  public String getMetadata() {
    return metadata;
  }
}
