package dev.pergamon.search;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.EnumSet;
import java.util.Set;
import org.jspecify.annotations.Nullable;

/** Retrieval strategy requested by the caller or chosen by adaptive selection. */
public enum SearchMethod {
  VECTOR_ONLY("vector_only"),
  KEYWORD_ONLY("keyword_only"),
  HYBRID("hybrid"),
  MULTI_MODAL("multi_modal"),
  ADAPTIVE("adaptive");

  private final String value;

  SearchMethod(String value) {
    this.value = value;
  }

  @JsonValue
  public String value() {
    return value;
  }

  /**
   * Parses a method name, case-insensitively.
   *
   * @throws UnknownMethodException if {@code value} names no method
   */
  @JsonCreator
  public static SearchMethod fromValue(@Nullable String value) {
    for (SearchMethod method : values()) {
      if (method.value.equalsIgnoreCase(value)) {
        return method;
      }
    }
    throw new UnknownMethodException(String.valueOf(value));
  }

  /**
   * Sub-searches this method fans out to.
   *
   * @throws IllegalStateException for {@link #ADAPTIVE}, which must be resolved first
   */
  public Set<SubSearch> subSearches() {
    return switch (this) {
      case VECTOR_ONLY -> EnumSet.of(SubSearch.VECTOR);
      case KEYWORD_ONLY -> EnumSet.of(SubSearch.KEYWORD);
      case HYBRID -> EnumSet.of(SubSearch.VECTOR, SubSearch.KEYWORD);
      case MULTI_MODAL -> EnumSet.allOf(SubSearch.class);
      case ADAPTIVE ->
          throw new IllegalStateException("ADAPTIVE must be resolved to a concrete method");
    };
  }
}
