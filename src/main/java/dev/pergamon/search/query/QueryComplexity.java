package dev.pergamon.search.query;

import com.fasterxml.jackson.annotation.JsonValue;

/** Complexity tier of a query, driving the candidate budget and the selection quota. */
public enum QueryComplexity {
  LOW("low"),
  MEDIUM("medium"),
  HIGH("high");

  private final String value;

  QueryComplexity(String value) {
    this.value = value;
  }

  @JsonValue
  public String value() {
    return value;
  }
}
