package dev.pergamon.search;

import com.fasterxml.jackson.annotation.JsonValue;

/** Which branch of the tiered selection policy produced a result list. */
public enum SelectionStrategy {
  HIGH_RELEVANCE_PRIORITY("high_relevance_priority"),
  MIXED_RELEVANCE("mixed_relevance"),
  ALL_LEVELS("all_levels");

  private final String value;

  SelectionStrategy(String value) {
    this.value = value;
  }

  @JsonValue
  public String value() {
    return value;
  }
}
