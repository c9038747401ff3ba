package dev.pergamon.search.query;

import java.util.List;
import java.util.Map;

/**
 * Per-query classification computed by {@link QueryAnalyzer}. Not persisted.
 *
 * @param complexity the complexity tier
 * @param wordCount number of whitespace-separated words
 * @param charCount number of characters (code points)
 * @param domainMatches domain name to the domain keywords found in the query, in lexicon order
 * @param hasTechnicalTerms true iff {@code domainMatches} is non-empty
 * @param queryType intent classification
 */
public record QueryAnalysis(
    QueryComplexity complexity,
    int wordCount,
    int charCount,
    Map<String, List<String>> domainMatches,
    boolean hasTechnicalTerms,
    QueryType queryType) {}
