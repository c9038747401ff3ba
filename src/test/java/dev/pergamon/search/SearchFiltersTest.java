package dev.pergamon.search;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import dev.langchain4j.data.document.Metadata;
import dev.langchain4j.store.embedding.filter.Filter;
import dev.langchain4j.store.embedding.filter.comparison.IsEqualTo;
import dev.langchain4j.store.embedding.filter.logical.And;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class SearchFiltersTest {

  @Test
  void empty_filters_produce_no_filter() {
    assertThat(SearchFilters.toFilter(Map.of())).isNull();
  }

  @Test
  void single_entry_produces_equality_filter() {
    Filter filter = SearchFilters.toFilter(Map.of("category", "guide"));

    assertThat(filter).isInstanceOf(IsEqualTo.class);
    IsEqualTo eq = (IsEqualTo) filter;
    assertThat(eq.key()).isEqualTo("category");
    assertThat(eq.comparisonValue()).isEqualTo("guide");
  }

  @Test
  void multiple_entries_are_combined_with_and() {
    Map<String, Object> filters = new LinkedHashMap<>();
    filters.put("category", "guide");
    filters.put("year", 2024);

    Filter filter = SearchFilters.toFilter(filters);

    assertThat(filter).isInstanceOf(And.class);
    assertThat(filter.test(Metadata.from("category", "guide").put("year", 2024))).isTrue();
    assertThat(filter.test(Metadata.from("category", "guide").put("year", 2023))).isFalse();
  }

  @Test
  void three_entries_fold_into_one_conjunction() {
    Map<String, Object> filters = new LinkedHashMap<>();
    filters.put("category", "guide");
    filters.put("year", 2024);
    filters.put("domain", "cloud");

    Filter filter = SearchFilters.toFilter(filters);

    Metadata matching =
        Metadata.from("category", "guide").put("year", 2024).put("domain", "cloud");
    Metadata otherDomain =
        Metadata.from("category", "guide").put("year", 2024).put("domain", "network");
    assertThat(filter).isInstanceOf(And.class);
    assertThat(filter.test(matching)).isTrue();
    assertThat(filter.test(otherDomain)).isFalse();
  }

  @Test
  void unsupported_value_type_is_rejected() {
    assertThatThrownBy(() -> SearchFilters.toFilter(Map.of("tags", List.of("a"))))
        .isInstanceOf(InvalidQueryException.class)
        .hasMessageContaining("'tags'");
  }

  @Test
  void null_value_is_rejected() {
    Map<String, Object> filters = new LinkedHashMap<>();
    filters.put("category", null);

    assertThatThrownBy(() -> SearchFilters.toFilter(filters))
        .isInstanceOf(InvalidQueryException.class)
        .hasMessageContaining("null");
  }

  @Test
  void blank_key_is_rejected() {
    assertThatThrownBy(() -> SearchFilters.toFilter(Map.of(" ", "x")))
        .isInstanceOf(InvalidQueryException.class);
  }
}
