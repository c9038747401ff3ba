package dev.pergamon.search.retrieval;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import dev.langchain4j.store.embedding.filter.comparison.IsEqualTo;
import dev.pergamon.document.DocumentStore;
import dev.pergamon.fixture.DocumentBuilder;
import dev.pergamon.fixture.InMemoryDocumentStore;
import dev.pergamon.fixture.Lexicons;
import dev.pergamon.search.SearchCancelledException;
import dev.pergamon.search.SearchResult;
import dev.pergamon.search.UpstreamException;
import java.util.List;
import org.junit.jupiter.api.Test;

class KeywordSearchEngineTest {

  private static KeywordSearchEngine engine(DocumentStore store) {
    return new KeywordSearchEngine(store, Lexicons.bundled());
  }

  // --- Keyword extraction ---

  @Test
  void extraction_drops_punctuation_stop_words_and_short_tokens() {
    assertThat(KeywordSearchEngine.extractKeywords("What is the ISMS-P 인증, and 및 a 그 것?"))
        .containsExactly("What", "ISMS", "인증");
  }

  @Test
  void extraction_splits_on_unicode_whitespace() {
    assertThat(KeywordSearchEngine.extractKeywords("클라우드\u3000보안"))
        .containsExactly("클라우드", "보안");
    assertThat(KeywordSearchEngine.extractKeywords("cloud\u00A0security"))
        .containsExactly("cloud", "security");
  }

  @Test
  void extraction_of_punctuation_only_is_empty() {
    assertThat(KeywordSearchEngine.extractKeywords("?!")).isEmpty();
  }

  @Test
  void expansion_appends_synonyms_lower_cased_without_duplicates() {
    KeywordSearchEngine engine = engine(new InMemoryDocumentStore());

    List<String> expanded = engine.expandKeywords(List.of("API", "웹서비스"));

    assertThat(expanded).containsExactly("api", "웹서비스", "application programming interface");
  }

  // --- Scoring ---

  @Test
  void whole_word_match_scores_full_and_missing_keyword_scores_nothing() {
    assertThat(KeywordSearchEngine.keywordScore("Cloud adoption guide", List.of("cloud", "보안")))
        .isCloseTo(0.5, within(1e-9));
  }

  @Test
  void substring_only_match_scores_half() {
    assertThat(KeywordSearchEngine.keywordScore("cloudnative stack", List.of("cloud")))
        .isCloseTo(0.5, within(1e-9));
  }

  @Test
  void empty_content_scores_zero() {
    assertThat(KeywordSearchEngine.keywordScore("", List.of("cloud"))).isZero();
  }

  @Test
  void keywords_with_regex_metacharacters_are_matched_literally() {
    assertThat(KeywordSearchEngine.keywordScore("our ci/cd pipeline", List.of("ci/cd")))
        .isCloseTo(1.0, within(1e-9));
  }

  // --- Search ---

  @Test
  void search_ranks_by_score_and_drops_non_matches() {
    InMemoryDocumentStore store =
        new InMemoryDocumentStore(
            new DocumentBuilder().id("partial").content("cloudnative platform").build(),
            new DocumentBuilder().id("full").content("cloud platform").build(),
            new DocumentBuilder().id("none").content("nothing relevant").build());

    List<SearchResult> results = engine(store).search("cloud", 10, null);

    assertThat(results).extracting(SearchResult::id).containsExactly("full", "partial");
    assertThat(results.get(0).keywordScore()).isCloseTo(1.0, within(1e-9));
    assertThat(results.get(0).vectorScore()).isZero();
  }

  @Test
  void synonyms_expand_recall() {
    InMemoryDocumentStore store =
        new InMemoryDocumentStore(
            new DocumentBuilder().id("en").content("encryption at rest").build());

    List<SearchResult> results = engine(store).search("암호화", 10, null);

    assertThat(results).extracting(SearchResult::id).containsExactly("en");
  }

  @Test
  void search_respects_budget_and_filter() {
    InMemoryDocumentStore store =
        new InMemoryDocumentStore(
            new DocumentBuilder().id("a").content("cloud").meta("category", "x").build(),
            new DocumentBuilder().id("b").content("cloud").meta("category", "y").build(),
            new DocumentBuilder().id("c").content("cloud").meta("category", "y").build());

    List<SearchResult> results =
        engine(store).search("cloud", 1, new IsEqualTo("category", "y"));

    assertThat(results).extracting(SearchResult::id).containsExactly("b");
  }

  @Test
  void query_without_keywords_returns_nothing_without_scanning() {
    DocumentStore store = mock(DocumentStore.class);

    assertThat(engine(store).search("the a 이", 10, null)).isEmpty();
  }

  @Test
  void store_failure_is_raised_as_upstream_exception() {
    DocumentStore store = mock(DocumentStore.class);
    when(store.getAll(any())).thenThrow(new IllegalStateException("db down"));

    assertThatThrownBy(() -> engine(store).search("cloud", 10, null))
        .isInstanceOf(UpstreamException.class)
        .hasMessageContaining("db down");
  }

  @Test
  void interrupted_scan_is_cancelled() {
    InMemoryDocumentStore store =
        new InMemoryDocumentStore(new DocumentBuilder().content("cloud").build());

    Thread.currentThread().interrupt();
    try {
      assertThatThrownBy(() -> engine(store).search("cloud", 10, null))
          .isInstanceOf(SearchCancelledException.class);
    } finally {
      Thread.interrupted();
    }
  }
}
