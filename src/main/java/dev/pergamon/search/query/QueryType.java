package dev.pergamon.search.query;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.List;

/**
 * Intent classification of a query. Term families are checked in declaration order and the first
 * family with a hit wins; {@link #GENERAL} is the fallback.
 */
public enum QueryType {
  INFORMATION_RETRIEVAL("information_retrieval", List.of("무엇", "어떤", "어떻게", "what", "how")),
  COMPLIANCE_CHECK("compliance_check", List.of("규정", "준수", "인증", "compliance")),
  PROBLEM_SOLVING("problem_solving", List.of("문제", "오류", "해결", "error", "problem")),
  COMPARISON("comparison", List.of("비교", "차이", "구분", "compare", "difference")),
  GENERAL("general", List.of());

  private final String value;
  private final List<String> terms;

  QueryType(String value, List<String> terms) {
    this.value = value;
    this.terms = terms;
  }

  @JsonValue
  public String value() {
    return value;
  }

  /**
   * Classifies a lower-cased query.
   *
   * @param lowerQuery the query, already lower-cased
   * @return the first matching type, or {@link #GENERAL}
   */
  public static QueryType classify(String lowerQuery) {
    for (QueryType type : values()) {
      if (type.terms.stream().anyMatch(lowerQuery::contains)) {
        return type;
      }
    }
    return GENERAL;
  }
}
