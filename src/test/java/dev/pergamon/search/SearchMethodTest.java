package dev.pergamon.search;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class SearchMethodTest {

  @ParameterizedTest
  @CsvSource({
    "vector_only, VECTOR_ONLY",
    "KEYWORD_ONLY, KEYWORD_ONLY",
    "Hybrid, HYBRID",
    "multi_modal, MULTI_MODAL",
    "adaptive, ADAPTIVE"
  })
  void parses_method_names_case_insensitively(String value, SearchMethod expected) {
    assertThat(SearchMethod.fromValue(value)).isEqualTo(expected);
  }

  @Test
  void unknown_method_is_rejected_with_its_name() {
    assertThatThrownBy(() -> SearchMethod.fromValue("semantic"))
        .isInstanceOf(UnknownMethodException.class)
        .hasMessage("Unknown search method: semantic");
  }

  @Test
  void null_method_is_rejected() {
    assertThatThrownBy(() -> SearchMethod.fromValue(null))
        .isInstanceOf(UnknownMethodException.class);
  }

  @Test
  void methods_fan_out_to_their_sub_searches() {
    assertThat(SearchMethod.VECTOR_ONLY.subSearches()).containsExactly(SubSearch.VECTOR);
    assertThat(SearchMethod.KEYWORD_ONLY.subSearches()).containsExactly(SubSearch.KEYWORD);
    assertThat(SearchMethod.HYBRID.subSearches())
        .containsExactly(SubSearch.VECTOR, SubSearch.KEYWORD);
    assertThat(SearchMethod.MULTI_MODAL.subSearches())
        .containsExactly(SubSearch.VECTOR, SubSearch.KEYWORD, SubSearch.METADATA);
  }

  @Test
  void adaptive_has_no_sub_searches_until_resolved() {
    assertThatThrownBy(SearchMethod.ADAPTIVE::subSearches)
        .isInstanceOf(IllegalStateException.class);
  }
}
