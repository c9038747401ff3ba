package dev.pergamon.search.retrieval;

import dev.langchain4j.store.embedding.filter.Filter;
import dev.pergamon.document.Document;
import dev.pergamon.document.DocumentStore;
import dev.pergamon.search.SearchCancelledException;
import dev.pergamon.search.SearchResult;
import dev.pergamon.search.UpstreamException;
import dev.pergamon.search.query.DomainLexicon;
import dev.pergamon.search.query.QueryTokens;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;
import org.jspecify.annotations.Nullable;
import org.springframework.stereotype.Component;

/**
 * Lexical retrieval with synonym expansion over the full (or metadata-filtered) corpus.
 *
 * <p>Scoring: each expanded keyword contributes 1.0 for a whole-word match in the content, 0.5
 * for a substring-only match, 0 otherwise; the sum is divided by the number of expanded keywords
 * and capped at 1.0. Zero-score documents are dropped.
 *
 * <p>This is a full scan and the most expensive sub-search. The scan stops with {@link
 * SearchCancelledException} when its thread is interrupted.
 */
@Component
public class KeywordSearchEngine {

  static final Set<String> STOP_WORDS =
      Set.of(
          "이", "그", "저", "것", "수", "등", "및", "또는", "그리고", "하는", "있는", "되는", "the", "a", "an",
          "and", "or", "but", "in", "on", "at", "to", "for", "is", "are");

  private static final Pattern PUNCTUATION =
      Pattern.compile("[^\\w\\s]", Pattern.UNICODE_CHARACTER_CLASS);

  private final DocumentStore documentStore;
  private final DomainLexicon lexicon;

  public KeywordSearchEngine(DocumentStore documentStore, DomainLexicon lexicon) {
    this.documentStore = documentStore;
    this.lexicon = lexicon;
  }

  /**
   * Returns up to {@code n} documents ordered by descending keyword score.
   *
   * @param query the query text
   * @param n maximum number of candidates
   * @param filter metadata predicate restricting the scanned corpus, or null
   * @return candidates with keyword score set
   * @throws UpstreamException if the document store fails
   */
  public List<SearchResult> search(String query, int n, @Nullable Filter filter) {
    List<KeywordPattern> keywords =
        expandKeywords(extractKeywords(query)).stream().map(KeywordPattern::of).toList();
    if (keywords.isEmpty()) {
      return List.of();
    }

    List<SearchResult> scored = new ArrayList<>();
    for (Document document : loadCorpus(filter)) {
      if (Thread.currentThread().isInterrupted()) {
        throw new SearchCancelledException("Keyword scan interrupted");
      }
      double score = score(document.content(), keywords);
      if (score > 0.0) {
        scored.add(SearchResult.of(document).withKeywordScore(score));
      }
    }
    return scored.stream()
        .sorted(Comparator.comparingDouble(SearchResult::keywordScore).reversed())
        .limit(n)
        .toList();
  }

  /**
   * Splits a query into keywords: punctuation becomes whitespace, tokens shorter than two
   * characters and stop words are dropped.
   */
  static List<String> extractKeywords(String query) {
    String cleaned = PUNCTUATION.matcher(query).replaceAll(" ");
    List<String> keywords = new ArrayList<>();
    for (String token : QueryTokens.split(cleaned)) {
      if (token.codePointCount(0, token.length()) >= 2 && !STOP_WORDS.contains(token)) {
        keywords.add(token);
      }
    }
    return keywords;
  }

  /** Adds lexicon synonyms to the keywords; lower-cased, de-duplicated, first-seen order. */
  List<String> expandKeywords(List<String> keywords) {
    Set<String> expanded = new LinkedHashSet<>();
    for (String keyword : keywords) {
      expanded.add(keyword.toLowerCase(Locale.ROOT));
    }
    for (String keyword : keywords) {
      for (String synonym : lexicon.synonymsOf(keyword)) {
        expanded.add(synonym.toLowerCase(Locale.ROOT));
      }
    }
    return List.copyOf(expanded);
  }

  /** Scores content against an already expanded keyword list. */
  static double keywordScore(String content, List<String> keywords) {
    return score(content, keywords.stream().map(KeywordPattern::of).toList());
  }

  private static double score(String content, List<KeywordPattern> keywords) {
    if (content.isEmpty() || keywords.isEmpty()) {
      return 0.0;
    }
    String lowerContent = content.toLowerCase(Locale.ROOT);
    double total = 0.0;
    for (KeywordPattern keyword : keywords) {
      if (lowerContent.contains(keyword.text())) {
        total += keyword.wholeWord().matcher(lowerContent).find() ? 1.0 : 0.5;
      }
    }
    return Math.min(total / keywords.size(), 1.0);
  }

  private List<Document> loadCorpus(@Nullable Filter filter) {
    try {
      return documentStore.getAll(filter);
    } catch (RuntimeException e) {
      throw new UpstreamException("Document store scan failed: " + e.getMessage(), e);
    }
  }

  /** A lower-cased keyword with its precompiled word-boundary pattern. */
  private record KeywordPattern(String text, Pattern wholeWord) {

    static KeywordPattern of(String keyword) {
      String lower = keyword.toLowerCase(Locale.ROOT);
      return new KeywordPattern(
          lower,
          Pattern.compile(
              "\\b" + Pattern.quote(lower) + "\\b", Pattern.UNICODE_CHARACTER_CLASS));
    }
  }
}
