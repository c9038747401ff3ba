package dev.pergamon.search;

import com.fasterxml.jackson.annotation.JsonValue;

/** One of the independent candidate sources fanned out by a search. */
public enum SubSearch {
  VECTOR("vector"),
  KEYWORD("keyword"),
  METADATA("metadata");

  private final String value;

  SubSearch(String value) {
    this.value = value;
  }

  @JsonValue
  public String value() {
    return value;
  }
}
