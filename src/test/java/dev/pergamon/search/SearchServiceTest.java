package dev.pergamon.search;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import dev.langchain4j.data.document.Metadata;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import dev.langchain4j.store.embedding.EmbeddingMatch;
import dev.langchain4j.store.embedding.EmbeddingSearchResult;
import dev.langchain4j.store.embedding.EmbeddingStore;
import dev.pergamon.document.DocumentStore;
import dev.pergamon.fixture.DocumentBuilder;
import dev.pergamon.fixture.InMemoryDocumentStore;
import dev.pergamon.fixture.Lexicons;
import dev.pergamon.search.query.DomainLexicon;
import dev.pergamon.search.query.QueryAnalyzer;
import dev.pergamon.search.retrieval.KeywordSearchEngine;
import dev.pergamon.search.retrieval.MetadataSearchEngine;
import dev.pergamon.search.retrieval.VectorSearchAdapter;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class SearchServiceTest {

  private static final Embedding DUMMY_EMBEDDING = Embedding.from(new float[] {0.1f, 0.2f, 0.3f});

  private static final String QUERY = "클라우드 보안";

  @Mock EmbeddingStore<TextSegment> embeddingStore;

  @Mock EmbeddingModel embeddingModel;

  private final DomainLexicon lexicon = Lexicons.bundled();
  private final ExecutorService executor = Executors.newFixedThreadPool(3);

  private final DocumentStore corpus =
      new InMemoryDocumentStore(
          new DocumentBuilder()
              .id("d1")
              .content("클라우드 보안 가이드라인 문서입니다")
              .filename("클라우드_보안_2025.pdf")
              .meta("category", "security")
              .build(),
          new DocumentBuilder()
              .id("d2")
              .content("ISMS 인증 기준 안내")
              .filename("isms.pdf")
              .meta("category", "compliance")
              .build(),
          new DocumentBuilder().id("d3").content("unrelated text").filename("misc.txt").build());

  SearchService searchService;

  @BeforeEach
  void setUp() {
    searchService = service(corpus);
  }

  @AfterEach
  void tearDown() {
    executor.shutdownNow();
  }

  // --- Helpers ---

  private SearchService service(DocumentStore documentStore) {
    SearchConfig config = SearchConfig.defaults();
    Clock clock = Clock.fixed(Instant.parse("2025-06-01T00:00:00Z"), ZoneOffset.UTC);
    return new SearchService(
        new QueryAnalyzer(lexicon),
        new StrategySelector(config),
        new VectorSearchAdapter(embeddingStore, embeddingModel),
        new KeywordSearchEngine(documentStore, lexicon),
        new MetadataSearchEngine(documentStore),
        new RelevanceEnhancer(config, lexicon, clock),
        new SubSearchRunner(executor),
        new SearchStatistics(),
        config,
        lexicon,
        documentStore);
  }

  private void stubVectorStoreWithMatchForD1() {
    when(embeddingModel.embed(QUERY)).thenReturn(Response.from(DUMMY_EMBEDDING));
    TextSegment segment =
        TextSegment.from(
            "클라우드 보안 가이드라인 문서입니다",
            Metadata.from("filename", "클라우드_보안_2025.pdf").put("category", "security"));
    when(embeddingStore.search(any()))
        .thenReturn(
            new EmbeddingSearchResult<>(
                List.of(new EmbeddingMatch<>(0.9, "d1", DUMMY_EMBEDDING, segment))));
  }

  // --- Pipeline ---

  @Test
  void adaptive_search_runs_hybrid_and_fuses_vector_with_keyword() {
    stubVectorStoreWithMatchForD1();

    SearchResponse response = searchService.search(QUERY);

    assertThat(response.success()).isTrue();
    assertThat(response.method()).isEqualTo(SearchMethod.HYBRID);
    assertThat(response.results()).extracting(RankedResult::id).containsExactly("d1");
    RankedResult d1 = response.results().get(0);
    assertThat(d1.scores().vector()).isCloseTo(0.8, within(1e-9));
    assertThat(d1.distance()).isCloseTo(0.2, within(1e-9));
    assertThat(d1.scores().keyword()).isCloseTo(2.0 / 9.0, within(1e-9));
    assertThat(d1.scores().finalScore()).isCloseTo(0.8 * 0.6 + 2.0 / 9.0 * 0.4, within(1e-9));
    assertThat(d1.scores().relevance()).isEqualTo(1.0);
    assertThat(d1.rank()).isEqualTo(1);
    assertThat(response.stats().degradedSources()).isEmpty();
  }

  @Test
  void failing_vector_store_degrades_to_keyword_and_metadata() {
    when(embeddingModel.embed(anyString())).thenThrow(new RuntimeException("model offline"));

    SearchResponse response = searchService.search(QUERY, SearchOptions.of("multi_modal"));

    assertThat(response.success()).isTrue();
    assertThat(response.results()).isNotEmpty();
    assertThat(response.results()).allMatch(r -> r.scores().vector() == 0.0);
    assertThat(response.stats().degradedSources()).containsExactly(SubSearch.VECTOR);
  }

  @Test
  void multi_modal_normalises_the_top_final_score_to_one() {
    stubVectorStoreWithMatchForD1();

    SearchResponse response = searchService.search(QUERY, SearchOptions.of("multi_modal"));

    assertThat(response.results().get(0).scores().finalScore()).isCloseTo(1.0, within(1e-9));
    assertThat(response.results().get(0).scores().metadata()).isCloseTo(0.4, within(1e-9));
  }

  @Test
  void identical_searches_return_identical_results() {
    SearchOptions options = SearchOptions.of("keyword_only");

    SearchResponse first = searchService.search("ISMS 인증", options);
    SearchResponse second = searchService.search("ISMS 인증", options);

    assertThat(second.results()).isEqualTo(first.results());
  }

  @Test
  void filters_restrict_the_scanned_corpus() {
    SearchResponse response =
        searchService.search(
            "클라우드 ISMS",
            SearchOptions.of("keyword_only").withFilters(Map.of("category", "compliance")));

    assertThat(response.success()).isTrue();
    assertThat(response.results()).extracting(RankedResult::id).containsExactly("d2");
  }

  @Test
  void unmatched_query_succeeds_with_no_results() {
    SearchResponse response =
        searchService.search("kubernetes operators", SearchOptions.of("keyword_only"));

    assertThat(response.success()).isTrue();
    assertThat(response.results()).isEmpty();
  }

  // --- Error envelopes ---

  @Test
  void blank_query_yields_error_envelope_before_any_sub_search() {
    SearchResponse response = searchService.search("   ");

    assertThat(response.success()).isFalse();
    assertThat(response.error()).contains("blank");
    assertThat(response.results()).isEmpty();
    verifyNoInteractions(embeddingModel, embeddingStore);
  }

  @Test
  void null_query_yields_error_envelope() {
    SearchResponse response = searchService.search(null);

    assertThat(response.success()).isFalse();
    assertThat(response.query()).isEmpty();
  }

  @Test
  void unknown_method_yields_error_envelope() {
    SearchResponse response = searchService.search(QUERY, SearchOptions.of("semantic"));

    assertThat(response.success()).isFalse();
    assertThat(response.error()).isEqualTo("Unknown search method: semantic");
    verifyNoInteractions(embeddingModel, embeddingStore);
  }

  @Test
  void non_positive_max_results_yields_error_envelope() {
    SearchResponse response =
        searchService.search(QUERY, SearchOptions.of("hybrid").withMaxResults(0));

    assertThat(response.success()).isFalse();
    assertThat(response.error()).contains("maxResults");
  }

  @Test
  void unsupported_filter_yields_error_envelope() {
    SearchResponse response =
        searchService.search(
            QUERY, SearchOptions.of("hybrid").withFilters(Map.of("tags", List.of("a"))));

    assertThat(response.success()).isFalse();
    assertThat(response.error()).contains("Unsupported filter value");
  }

  @Test
  void failure_of_every_sub_search_yields_error_envelope() {
    when(embeddingModel.embed(anyString())).thenThrow(new RuntimeException("model offline"));
    DocumentStore broken = mock(DocumentStore.class);
    when(broken.getAll(any())).thenThrow(new IllegalStateException("connection refused"));

    SearchResponse response = service(broken).search(QUERY, SearchOptions.of("multi_modal"));

    assertThat(response.success()).isFalse();
    assertThat(response.error()).startsWith("All sub-searches failed");
    assertThat(response.results()).isEmpty();
  }

  // --- Introspection ---

  @Test
  void statistics_count_only_successful_searches() {
    searchService.search("ISMS 인증", SearchOptions.of("keyword_only"));
    searchService.search("ISMS 인증", SearchOptions.of("metadata_only"));

    EngineStatistics statistics = searchService.statistics();

    assertThat(statistics.totalSearches()).isEqualTo(1);
    assertThat(statistics.averageSearchTimeSeconds()).isGreaterThanOrEqualTo(0.0);
    assertThat(statistics.supportedMethods())
        .containsExactly("vector_only", "keyword_only", "hybrid", "multi_modal", "adaptive");
    assertThat(statistics.fusionWeights()).isEqualTo(new FusionWeights(0.6, 0.4, 0.2));
    assertThat(statistics.domainKeywordCount()).isEqualTo(36);
    assertThat(statistics.synonymCount()).isEqualTo(7);
  }

  @Test
  void corpus_info_reports_size_and_sample_keys() {
    CorpusInfo info = searchService.corpusInfo();

    assertThat(info.totalDocuments()).isEqualTo(3);
    assertThat(info.sampleMetadataKeys()).containsExactlyInAnyOrder("filename", "category");
    assertThat(info.error()).isNull();
  }

  @Test
  void corpus_info_reports_store_failure() {
    DocumentStore broken = mock(DocumentStore.class);
    when(broken.count()).thenThrow(new IllegalStateException("connection refused"));

    CorpusInfo info = service(broken).corpusInfo();

    assertThat(info.totalDocuments()).isZero();
    assertThat(info.sampleMetadataKeys()).isEmpty();
    assertThat(info.error()).isEqualTo("connection refused");
  }
}
