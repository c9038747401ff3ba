package dev.pergamon.search;

import static dev.langchain4j.store.embedding.filter.MetadataFilterBuilder.metadataKey;

import dev.langchain4j.store.embedding.filter.Filter;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.jspecify.annotations.Nullable;

/**
 * Converts caller metadata filters into a single LangChain4j {@link Filter}. The same filter is
 * pushed down to the vector store and evaluated in memory by the corpus scans.
 */
public final class SearchFilters {

  private SearchFilters() {}

  /**
   * Builds an equality filter per entry, combined with AND logic.
   *
   * @param filters metadata key to expected value
   * @return combined filter, or null if {@code filters} is empty
   * @throws InvalidQueryException if a key is blank or a value has an unsupported type
   */
  public static @Nullable Filter toFilter(Map<String, Object> filters) {
    List<Filter> clauses = new ArrayList<>();
    for (Map.Entry<String, Object> entry : filters.entrySet()) {
      clauses.add(equalTo(entry.getKey(), entry.getValue()));
    }
    return clauses.stream().reduce((a, b) -> a.and(b)).orElse(null);
  }

  private static Filter equalTo(String key, @Nullable Object value) {
    if (key == null || key.isBlank()) {
      throw new InvalidQueryException("Filter key must not be blank");
    }
    if (value instanceof String s) {
      return metadataKey(key).isEqualTo(s);
    }
    if (value instanceof Integer i) {
      return metadataKey(key).isEqualTo(i);
    }
    if (value instanceof Long l) {
      return metadataKey(key).isEqualTo(l);
    }
    if (value instanceof Float f) {
      return metadataKey(key).isEqualTo(f);
    }
    if (value instanceof Double d) {
      return metadataKey(key).isEqualTo(d);
    }
    if (value instanceof UUID uuid) {
      return metadataKey(key).isEqualTo(uuid);
    }
    throw new InvalidQueryException(
        "Unsupported filter value for '"
            + key
            + "': "
            + (value == null ? "null" : value.getClass().getSimpleName()));
  }
}
