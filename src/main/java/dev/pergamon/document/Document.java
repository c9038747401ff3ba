package dev.pergamon.document;

import dev.langchain4j.data.document.Metadata;

/**
 * A corpus document as produced by the external ingestion pipeline. Read-only to this service.
 *
 * @param id unique document identifier (the embedding id in the vector store)
 * @param content the document text
 * @param metadata string/number metadata such as {@code filename}, {@code category}, {@code
 *     domain}
 */
public record Document(String id, String content, Metadata metadata) {

  /** Compact constructor normalising absent content and metadata. */
  public Document {
    if (id == null || id.isBlank()) {
      throw new IllegalArgumentException("Document id must not be blank");
    }
    content = content == null ? "" : content;
    metadata = metadata == null ? new Metadata() : metadata;
  }
}
