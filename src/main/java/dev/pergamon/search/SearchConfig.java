package dev.pergamon.search;

import dev.pergamon.search.query.QueryComplexity;
import java.time.Duration;

/**
 * Immutable, process-wide tuning for the search pipeline, built once from {@link
 * SearchProperties}.
 *
 * <p>Weights are independently tunable and need not sum to 1; the relevance score is clamped to
 * [0, 1] after summation, so it can saturate.
 */
public record SearchConfig(
    FusionWeights fusionWeights,
    double exactMatchWeight,
    double partialMatchWeight,
    double domainKeywordWeight,
    double metadataMatchWeight,
    double contentQualityWeight,
    double recencyWeight,
    double authorityWeight,
    int simpleQueryResults,
    int mediumQueryResults,
    int complexQueryResults,
    Duration subSearchTimeout) {

  /** The stock configuration. */
  public static SearchConfig defaults() {
    return new SearchProperties().toSearchConfig();
  }

  /** Candidate budget requested from each sub-search for a query of the given complexity. */
  public int resultBudget(QueryComplexity complexity) {
    return switch (complexity) {
      case HIGH -> complexQueryResults;
      case MEDIUM -> mediumQueryResults;
      case LOW -> simpleQueryResults;
    };
  }
}
