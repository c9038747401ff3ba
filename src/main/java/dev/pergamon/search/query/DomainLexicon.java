package dev.pergamon.search.query;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.InputStream;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Static domain keyword and synonym tables, loaded once at startup and read-only thereafter.
 *
 * <p>Domain order is significant: {@link QueryAnalyzer} reports matches and {@code
 * RelevanceEnhancer} awards domain boosts in table order. Synonym lookup is case-insensitive.
 */
public final class DomainLexicon {

  private final Map<String, List<String>> domainKeywords;
  private final Map<String, List<String>> synonyms;
  private final Map<String, List<String>> synonymsByLowerTerm;

  public DomainLexicon(
      Map<String, List<String>> domainKeywords, Map<String, List<String>> synonyms) {
    this.domainKeywords = copyOf(domainKeywords);
    this.synonyms = copyOf(synonyms);
    Map<String, List<String>> lowered = new LinkedHashMap<>();
    this.synonyms.forEach(
        (term, values) -> lowered.putIfAbsent(term.toLowerCase(Locale.ROOT), values));
    this.synonymsByLowerTerm = Collections.unmodifiableMap(lowered);
  }

  /**
   * Reads a lexicon from JSON of the form {@code {"domains": {name: [keyword...]}, "synonyms":
   * {term: [synonym...]}}}.
   *
   * @throws IOException if the stream cannot be read or parsed
   */
  public static DomainLexicon fromJson(ObjectMapper objectMapper, InputStream json)
      throws IOException {
    LexiconFile file = objectMapper.readValue(json, LexiconFile.class);
    return new DomainLexicon(
        file.domains() == null ? Map.of() : file.domains(),
        file.synonyms() == null ? Map.of() : file.synonyms());
  }

  /** Domain name to its lower-case keywords, in table order. */
  public Map<String, List<String>> domainKeywords() {
    return domainKeywords;
  }

  public Map<String, List<String>> synonyms() {
    return synonyms;
  }

  /** Returns the synonyms registered for {@code term}, ignoring case, or an empty list. */
  public List<String> synonymsOf(String term) {
    return synonymsByLowerTerm.getOrDefault(term.toLowerCase(Locale.ROOT), List.of());
  }

  public int domainKeywordCount() {
    return domainKeywords.values().stream().mapToInt(List::size).sum();
  }

  public int synonymCount() {
    return synonyms.size();
  }

  private static Map<String, List<String>> copyOf(Map<String, List<String>> source) {
    Map<String, List<String>> copy = new LinkedHashMap<>();
    source.forEach((key, values) -> copy.put(key, List.copyOf(values)));
    return Collections.unmodifiableMap(copy);
  }

  private record LexiconFile(
      Map<String, List<String>> domains, Map<String, List<String>> synonyms) {}
}
