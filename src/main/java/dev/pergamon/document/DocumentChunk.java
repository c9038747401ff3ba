package dev.pergamon.document;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.util.UUID;
import org.hibernate.annotations.Immutable;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

/**
 * A single indexed chunk of a corpus document stored in pgvector.
 *
 * <p>Rows are written by the ingestion pipeline through LangChain4j's {@code
 * PgVectorEmbeddingStore}; this service maps them read-only. The embedding vector column is not
 * mapped.
 *
 * @see DocumentChunkRepository
 */
@Entity
@Immutable
@Table(name = "document_chunks")
public class DocumentChunk {

  @Id
  @Column(name = "embedding_id")
  private UUID id;

  @Column(columnDefinition = "TEXT")
  private String text;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(columnDefinition = "JSONB")
  private String metadata;

  protected DocumentChunk() {
    // JPA requires no-arg constructor
  }

  /**
   * Creates a detached chunk.
   *
   * @param id the embedding id shared with the vector store
   * @param text the chunk text
   * @param metadata JSON metadata object, or {@code null}
   */
  public DocumentChunk(UUID id, String text, String metadata) {
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
