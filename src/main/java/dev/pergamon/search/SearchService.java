package dev.pergamon.search;

import dev.langchain4j.store.embedding.filter.Filter;
import dev.pergamon.document.Document;
import dev.pergamon.document.DocumentStore;
import dev.pergamon.search.DocumentSelector.Selection;
import dev.pergamon.search.query.DomainLexicon;
import dev.pergamon.search.query.QueryAnalysis;
import dev.pergamon.search.query.QueryAnalyzer;
import dev.pergamon.search.retrieval.KeywordSearchEngine;
import dev.pergamon.search.retrieval.MetadataSearchEngine;
import dev.pergamon.search.retrieval.VectorSearchAdapter;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.stream.Collectors;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Search orchestration: analyse the query, select a strategy, fan the sub-searches out
 * concurrently, fuse their candidates, re-score relevance, select the final documents and compose
 * the response.
 *
 * <p>Pipeline: validate options -> {@link QueryAnalyzer} -> {@link StrategySelector} -> {@link
 * SubSearchRunner} (vector, keyword, metadata in parallel) -> {@link ResultFusion} -> {@link
 * RelevanceEnhancer} -> {@link DocumentSelector} -> {@link ResultComposer}.
 *
 * <p>{@link #search(String, SearchOptions)} never throws: invalid input, an unknown method, or the
 * failure of every launched sub-search produce an error envelope with {@code success=false}. A
 * single failed sub-search only contributes no candidates.
 */
@Service
public class SearchService {

  private static final Logger log = LoggerFactory.getLogger(SearchService.class);

  /** Number of leading documents whose metadata keys are reported by {@link #corpusInfo()}. */
  static final int CORPUS_SAMPLE_SIZE = 5;

  private final QueryAnalyzer queryAnalyzer;
  private final StrategySelector strategySelector;
  private final VectorSearchAdapter vectorSearch;
  private final KeywordSearchEngine keywordSearch;
  private final MetadataSearchEngine metadataSearch;
  private final RelevanceEnhancer relevanceEnhancer;
  private final SubSearchRunner subSearchRunner;
  private final SearchStatistics statistics;
  private final SearchConfig config;
  private final DomainLexicon lexicon;
  private final DocumentStore documentStore;

  public SearchService(
      QueryAnalyzer queryAnalyzer,
      StrategySelector strategySelector,
      VectorSearchAdapter vectorSearch,
      KeywordSearchEngine keywordSearch,
      MetadataSearchEngine metadataSearch,
      RelevanceEnhancer relevanceEnhancer,
      SubSearchRunner subSearchRunner,
      SearchStatistics statistics,
      SearchConfig config,
      DomainLexicon lexicon,
      DocumentStore documentStore) {
    this.queryAnalyzer = queryAnalyzer;
    this.strategySelector = strategySelector;
    this.vectorSearch = vectorSearch;
    this.keywordSearch = keywordSearch;
    this.metadataSearch = metadataSearch;
    this.relevanceEnhancer = relevanceEnhancer;
    this.subSearchRunner = subSearchRunner;
    this.statistics = statistics;
    this.config = config;
    this.lexicon = lexicon;
    this.documentStore = documentStore;
  }

  /** Searches with adaptive strategy selection and default options. */
  public SearchResponse search(@Nullable String query) {
    return search(query, SearchOptions.defaults());
  }

  /**
   * Runs the full retrieval and ranking pipeline.
   *
   * @param query the raw query text
   * @param options method, budget, filters and deadline
   * @return a success envelope with ranked results, or an error envelope; never null
   */
  public SearchResponse search(@Nullable String query, SearchOptions options) {
    long start = System.nanoTime();
    String echoedQuery = query == null ? "" : query;
    try {
      SearchResponse response = execute(echoedQuery, options, start);
      statistics.record(elapsedSince(start));
      return response;
    } catch (SearchException e) {
      log.warn("Search failed for query '{}': {}", echoedQuery, e.getMessage());
      return ResultComposer.error(
          echoedQuery, e.getMessage(), elapsedSince(start), config.fusionWeights());
    } catch (RuntimeException e) {
      log.error("Unexpected search failure for query '{}'", echoedQuery, e);
      return ResultComposer.error(
          echoedQuery,
          "Internal search error: " + e.getMessage(),
          elapsedSince(start),
          config.fusionWeights());
    }
  }

  /** Counters and configuration of the engine. */
  public EngineStatistics statistics() {
    SearchStatistics.Snapshot snapshot = statistics.snapshot();
    return new EngineStatistics(
        snapshot.totalSearches(),
        snapshot.averageSearchTimeSeconds(),
        Arrays.stream(SearchMethod.values()).map(SearchMethod::value).toList(),
        config.fusionWeights(),
        lexicon.domainKeywordCount(),
        lexicon.synonymCount());
  }

  /** Size of the corpus and the metadata keys of a small sample; store failures are reported. */
  public CorpusInfo corpusInfo() {
    try {
      long total = documentStore.count();
      Set<String> keys = new LinkedHashSet<>();
      for (Document document : documentStore.sample(CORPUS_SAMPLE_SIZE)) {
        keys.addAll(document.metadata().toMap().keySet());
      }
      return new CorpusInfo(total, List.copyOf(keys), null);
    } catch (RuntimeException e) {
      log.warn("Corpus info unavailable: {}", e.getMessage());
      return new CorpusInfo(0, List.of(), e.getMessage());
    }
  }

  private SearchResponse execute(String query, SearchOptions options, long start) {
    SearchMethod requested = SearchMethod.fromValue(options.method());
    if (options.maxResults() != null && options.maxResults() < 1) {
      throw new InvalidQueryException("maxResults must be >= 1, got: " + options.maxResults());
    }
    Filter filter = SearchFilters.toFilter(options.filters());
    QueryAnalysis analysis = queryAnalyzer.analyze(query);
    SearchStrategy strategy = strategySelector.select(analysis, requested, options.maxResults());
    SearchMethod method = strategy.method();
    int budget = strategy.resultBudget();

    log.info(
        "Search started: query='{}', method={}, complexity={}, type={}, budget={}",
        query,
        method.value(),
        analysis.complexity().value(),
        analysis.queryType(),
        budget);

    Map<SubSearch, SubSearchOutcome> outcomes =
        subSearchRunner.runAll(
            tasks(query, method, budget, filter), config.subSearchTimeout(), options.timeout());

    List<SubSearch> degraded = new ArrayList<>();
    for (SubSearchOutcome outcome : outcomes.values()) {
      if (outcome.isDegraded()) {
        degraded.add(outcome.source());
      }
    }
    if (degraded.size() == outcomes.size()) {
      throw new UpstreamException(
          "All sub-searches failed: "
              + outcomes.values().stream()
                  .map(o -> o.source().value() + " (" + o.failure() + ")")
                  .collect(Collectors.joining(", ")));
    }

    List<SearchResult> fused =
        ResultFusion.fuse(
            resultsOf(outcomes, SubSearch.VECTOR),
            resultsOf(outcomes, SubSearch.KEYWORD),
            resultsOf(outcomes, SubSearch.METADATA),
            config.fusionWeights(),
            method == SearchMethod.MULTI_MODAL,
            budget);
    log.debug(
        "Candidates: vector={}, keyword={}, metadata={}, fused={}",
        resultsOf(outcomes, SubSearch.VECTOR).size(),
        resultsOf(outcomes, SubSearch.KEYWORD).size(),
        resultsOf(outcomes, SubSearch.METADATA).size(),
        fused.size());
    List<SearchResult> enhanced = relevanceEnhancer.enhance(query, fused);
    Selection selection = DocumentSelector.select(enhanced, analysis.complexity());

    Duration elapsed = elapsedSince(start);
    log.info(
        "Search completed: query='{}', {} results, strategy={}, degraded={}, {} s",
        query,
        selection.results().size(),
        selection.strategy().value(),
        degraded,
        elapsed.toMillis() / 1000.0);

    return ResultComposer.compose(
        query, method, analysis, selection, elapsed, config.fusionWeights(), degraded);
  }

  private Map<SubSearch, Callable<List<SearchResult>>> tasks(
      String query, SearchMethod method, int budget, @Nullable Filter filter) {
    Map<SubSearch, Callable<List<SearchResult>>> tasks = new EnumMap<>(SubSearch.class);
    for (SubSearch source : method.subSearches()) {
      tasks.put(
          source,
          switch (source) {
            case VECTOR -> () -> vectorSearch.search(query, budget, filter);
            case KEYWORD -> () -> keywordSearch.search(query, budget, filter);
            case METADATA -> () -> metadataSearch.search(query, budget, filter);
          });
    }
    return tasks;
  }

  private static List<SearchResult> resultsOf(
      Map<SubSearch, SubSearchOutcome> outcomes, SubSearch source) {
    SubSearchOutcome outcome = outcomes.get(source);
    return outcome == null ? List.of() : outcome.results();
  }

  private static Duration elapsedSince(long startNanos) {
    return Duration.ofNanos(System.nanoTime() - startNanos);
  }
}
