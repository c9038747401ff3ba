package dev.pergamon.search;

import dev.pergamon.document.MetadataValues;
import dev.pergamon.search.query.DomainLexicon;
import dev.pergamon.search.query.QueryTokens;
import java.time.Clock;
import java.time.Year;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.IntStream;
import org.springframework.stereotype.Component;

/**
 * Recomputes a domain-aware relevance score for each fused candidate, independently of the fusion
 * score.
 *
 * <p>Seven additive signals, summed and then clamped to [0, 1]:
 *
 * <ol>
 *   <li>exact: size of the query/content word-set intersection times the exact-match weight
 *   <li>partial: each distinct query word longer than two characters found as a substring of the
 *       content adds the partial-match weight
 *   <li>domain: for each lexicon domain with a keyword in the query, the first of its keywords
 *       found in the content adds the domain-keyword weight (once per domain)
 *   <li>metadata: each query word longer than two characters found in the filename adds the
 *       metadata-match weight
 *   <li>content quality: content longer than 2000 characters adds the full weight, longer than
 *       1000 adds half
 *   <li>recency: a filename mentioning the current year or one of the two before it adds the
 *       recency weight
 *   <li>authority: a filename naming an authoritative source adds the authority weight
 * </ol>
 *
 * <p>The result list is re-sorted by relevance descending; ties keep their fusion order.
 */
@Component
public class RelevanceEnhancer {

  static final List<String> AUTHORITY_SOURCES = List.of("금융보안원", "금융위원회", "kisa", "한국인터넷진흥원");

  static final int RECENCY_WINDOW_YEARS = 3;

  private final SearchConfig config;
  private final DomainLexicon lexicon;
  private final Clock clock;

  public RelevanceEnhancer(SearchConfig config, DomainLexicon lexicon, Clock clock) {
    this.config = config;
    this.lexicon = lexicon;
    this.clock = clock;
  }

  /**
   * Scores and re-sorts candidates.
   *
   * @param query the raw query text
   * @param candidates fused candidates in fusion order
   * @return candidates with relevance score set, sorted by relevance descending
   */
  public List<SearchResult> enhance(String query, List<SearchResult> candidates) {
    if (candidates.isEmpty()) {
      return List.of();
    }
    QueryContext context = queryContext(query);
    return candidates.stream()
        .map(c -> c.withRelevanceScore(relevance(context, c)))
        .sorted(Comparator.comparingDouble(SearchResult::relevanceScore).reversed())
        .toList();
  }

  double relevance(QueryContext context, SearchResult candidate) {
    String lowerContent = candidate.content().toLowerCase(Locale.ROOT);
    Set<String> contentWords = words(lowerContent);
    String filename =
        MetadataValues.text(candidate.metadata(), "filename", "source").toLowerCase(Locale.ROOT);

    double score = 0.0;

    long exactMatches = context.words().stream().filter(contentWords::contains).count();
    score += exactMatches * config.exactMatchWeight();

    for (String word : context.words()) {
      if (isSignificant(word) && lowerContent.contains(word)) {
        score += config.partialMatchWeight();
      }
    }

    for (List<String> keywords : context.activeDomains()) {
      if (keywords.stream().anyMatch(lowerContent::contains)) {
        score += config.domainKeywordWeight();
      }
    }

    for (String word : context.words()) {
      if (isSignificant(word) && filename.contains(word)) {
        score += config.metadataMatchWeight();
      }
    }

    String content = candidate.content();
    int length = content.codePointCount(0, content.length());
    if (length > 2000) {
      score += config.contentQualityWeight();
    } else if (length > 1000) {
      score += config.contentQualityWeight() * 0.5;
    }

    if (context.recentYears().stream().anyMatch(filename::contains)) {
      score += config.recencyWeight();
    }

    if (AUTHORITY_SOURCES.stream().anyMatch(filename::contains)) {
      score += config.authorityWeight();
    }

    return Math.min(score, 1.0);
  }

  QueryContext queryContext(String query) {
    String lowerQuery = query.toLowerCase(Locale.ROOT);
    List<List<String>> activeDomains =
        lexicon.domainKeywords().values().stream()
            .filter(keywords -> keywords.stream().anyMatch(lowerQuery::contains))
            .toList();
    return new QueryContext(words(lowerQuery), activeDomains, recentYears());
  }

  private List<String> recentYears() {
    int current = Year.now(clock).getValue();
    return IntStream.range(0, RECENCY_WINDOW_YEARS)
        .mapToObj(offset -> Integer.toString(current - offset))
        .toList();
  }

  private static Set<String> words(String lowerText) {
    return new LinkedHashSet<>(QueryTokens.split(lowerText));
  }

  private static boolean isSignificant(String word) {
    return word.codePointCount(0, word.length()) > 2;
  }

  /**
   * Query-derived inputs shared by every candidate of one search.
   *
   * @param words distinct lower-cased query words
   * @param activeDomains keyword lists of the domains mentioned by the query
   * @param recentYears year tokens inside the recency window
   */
  record QueryContext(
      Set<String> words, List<List<String>> activeDomains, List<String> recentYears) {}
}
