package dev.pergamon.document;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.data.document.Metadata;
import dev.langchain4j.store.embedding.filter.Filter;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.jspecify.annotations.Nullable;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Component;

/**
 * {@link DocumentStore} backed by the {@code document_chunks} table through Spring Data JPA.
 *
 * <p>The JSONB metadata column is parsed with Jackson into a LangChain4j {@link Metadata} so the
 * same {@link Filter} that is pushed down to the vector store can be evaluated in memory here.
 * Values LangChain4j metadata cannot hold (booleans, arrays, nested objects) are kept as their
 * string rendering.
 */
@Component
public class JpaDocumentStore implements DocumentStore {

  private static final TypeReference<LinkedHashMap<String, Object>> METADATA_TYPE =
      new TypeReference<>() {};

  private static final Sort STABLE_ORDER = Sort.by("id");

  private final DocumentChunkRepository repository;
  private final ObjectMapper objectMapper;

  public JpaDocumentStore(DocumentChunkRepository repository, ObjectMapper objectMapper) {
    this.repository = repository;
    this.objectMapper = objectMapper;
  }

  @Override
  public List<Document> getAll(@Nullable Filter filter) {
    List<Document> documents = new ArrayList<>();
    for (DocumentChunk chunk : repository.findAll(STABLE_ORDER)) {
      Document document = toDocument(chunk);
      if (filter == null || filter.test(document.metadata())) {
        documents.add(document);
      }
    }
    return documents;
  }

  @Override
  public long count() {
    return repository.count();
  }

  @Override
  public List<Document> sample(int limit) {
    return repository.findAll(PageRequest.of(0, limit, STABLE_ORDER)).getContent().stream()
        .map(this::toDocument)
        .toList();
  }

  Document toDocument(DocumentChunk chunk) {
    return new Document(chunk.getId().toString(), chunk.getText(), toMetadata(chunk));
  }

  private Metadata toMetadata(DocumentChunk chunk) {
    String json = chunk.getMetadata();
    if (json == null || json.isBlank()) {
      return new Metadata();
    }
    Map<String, Object> raw;
    try {
      raw = objectMapper.readValue(json, METADATA_TYPE);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Malformed metadata JSON for chunk " + chunk.getId(), e);
    }
    Map<String, Object> supported = new LinkedHashMap<>();
    raw.forEach(
        (key, value) -> {
          if (value != null) {
            supported.put(key, toSupportedValue(value));
          }
        });
    return Metadata.from(supported);
  }

  private static Object toSupportedValue(Object value) {
    if (value instanceof String
        || value instanceof Integer
        || value instanceof Long
        || value instanceof Double) {
      return value;
    }
    if (value instanceof BigInteger big) {
      return big.longValue();
    }
    if (value instanceof BigDecimal decimal) {
      return decimal.doubleValue();
    }
    return value.toString();
  }
}
