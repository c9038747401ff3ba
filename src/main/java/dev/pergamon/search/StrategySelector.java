package dev.pergamon.search;

import dev.pergamon.search.query.QueryAnalysis;
import dev.pergamon.search.query.QueryComplexity;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Maps a {@link QueryAnalysis} and the requested method to a {@link SearchStrategy}.
 *
 * <p>Adaptive selection always resolves to {@link SearchMethod#HYBRID}: pure vector or pure
 * keyword retrieval under-retrieves relative to hybrid, so those methods run only on explicit
 * request.
 */
@Component
public class StrategySelector {

  private static final Logger log = LoggerFactory.getLogger(StrategySelector.class);

  private final SearchConfig config;

  public StrategySelector(SearchConfig config) {
    this.config = config;
  }

  /**
   * Resolves the method and candidate budget for a query.
   *
   * @param analysis the query analysis
   * @param requested the caller's method
   * @param maxResults caller budget override, or null to budget by complexity
   * @return the strategy to execute
   */
  public SearchStrategy select(
      QueryAnalysis analysis, SearchMethod requested, @Nullable Integer maxResults) {
    SearchMethod method = resolveMethod(analysis, requested);
    int budget = maxResults != null ? maxResults : config.resultBudget(analysis.complexity());
    return new SearchStrategy(method, budget);
  }

  SearchMethod resolveMethod(QueryAnalysis analysis, SearchMethod requested) {
    if (requested != SearchMethod.ADAPTIVE) {
      return requested;
    }
    if (analysis.hasTechnicalTerms()
        || analysis.complexity() == QueryComplexity.HIGH
        || analysis.domainMatches().size() > 2) {
      log.debug(
          "Adaptive selection: hybrid (technical={}, complexity={}, domains={})",
          analysis.hasTechnicalTerms(),
          analysis.complexity(),
          analysis.domainMatches().size());
    } else {
      log.debug("Adaptive selection: hybrid (default)");
    }
    return SearchMethod.HYBRID;
  }
}
