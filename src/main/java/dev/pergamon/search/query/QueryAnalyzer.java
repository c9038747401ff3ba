package dev.pergamon.search.query;

import dev.pergamon.search.InvalidQueryException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.jspecify.annotations.Nullable;
import org.springframework.stereotype.Component;

/**
 * Classifies a raw query into a complexity tier, domain keyword matches and a query type.
 *
 * <p>Complexity: every indicator term found in the lower-cased query scores one point for its
 * tier. The tier with the highest non-zero score wins, ties going to HIGH, then MEDIUM, then LOW.
 * A query with no indicator defaults to MEDIUM.
 */
@Component
public class QueryAnalyzer {

  /** Indicator terms per tier, iterated in tie-break precedence order. */
  private static final Map<QueryComplexity, List<String>> COMPLEXITY_INDICATORS =
      indicators();

  private final DomainLexicon lexicon;

  public QueryAnalyzer(DomainLexicon lexicon) {
    this.lexicon = lexicon;
  }

  /**
   * Analyses a query.
   *
   * @param query the raw query text
   * @return the analysis
   * @throws InvalidQueryException if the query is null or blank
   */
  public QueryAnalysis analyze(@Nullable String query) {
    if (query == null) {
      throw new InvalidQueryException("Query must not be blank");
    }
    List<String> words = QueryTokens.split(query);
    if (words.isEmpty()) {
      throw new InvalidQueryException("Query must not be blank");
    }
    String lowerQuery = query.toLowerCase(Locale.ROOT);
    Map<String, List<String>> domainMatches = matchDomains(lowerQuery);

    return new QueryAnalysis(
        classifyComplexity(lowerQuery),
        words.size(),
        query.codePointCount(0, query.length()),
        domainMatches,
        !domainMatches.isEmpty(),
        QueryType.classify(lowerQuery));
  }

  static QueryComplexity classifyComplexity(String lowerQuery) {
    QueryComplexity best = QueryComplexity.MEDIUM;
    int bestScore = 0;
    for (Map.Entry<QueryComplexity, List<String>> tier : COMPLEXITY_INDICATORS.entrySet()) {
      int score = (int) tier.getValue().stream().filter(lowerQuery::contains).count();
      // strictly greater keeps the earlier (higher precedence) tier on ties
      if (score > bestScore) {
        best = tier.getKey();
        bestScore = score;
      }
    }
    return best;
  }

  private Map<String, List<String>> matchDomains(String lowerQuery) {
    Map<String, List<String>> matches = new LinkedHashMap<>();
    lexicon
        .domainKeywords()
        .forEach(
            (domain, keywords) -> {
              List<String> found = keywords.stream().filter(lowerQuery::contains).toList();
              if (!found.isEmpty()) {
                matches.put(domain, found);
              }
            });
    return Collections.unmodifiableMap(matches);
  }

  private static Map<QueryComplexity, List<String>> indicators() {
    Map<QueryComplexity, List<String>> map = new LinkedHashMap<>();
    map.put(
        QueryComplexity.HIGH,
        List.of("거버넌스", "자동화", "종합", "체계", "프레임워크", "로드맵", "구현", "설계", "아키텍처"));
    map.put(
        QueryComplexity.MEDIUM,
        List.of("요구사항", "규정", "준수", "보안", "인증", "가이드라인", "분석", "평가"));
    map.put(QueryComplexity.LOW, List.of("무엇", "어떤", "언제", "어디서", "누가", "왜", "어떻게"));
    return Collections.unmodifiableMap(map);
  }
}
