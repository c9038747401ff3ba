package dev.pergamon.search;

import dev.pergamon.document.MetadataValues;
import dev.pergamon.search.DocumentSelector.Selection;
import dev.pergamon.search.query.QueryAnalysis;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Pure static utility assembling {@link SearchResponse} envelopes. */
public final class ResultComposer {

  static final String UNKNOWN_SOURCE = "unknown";

  private ResultComposer() {}

  /** Builds a success envelope from the final selection. */
  public static SearchResponse compose(
      String query,
      SearchMethod method,
      QueryAnalysis analysis,
      Selection selection,
      Duration elapsed,
      FusionWeights weights,
      List<SubSearch> degraded) {
    List<SearchResult> results = selection.results();
    List<RankedResult> ranked = results.stream().map(ResultComposer::toRankedResult).toList();

    ResponseStats stats =
        new ResponseStats(
            results.size(),
            seconds(elapsed),
            sourceDistribution(results),
            results.stream().mapToDouble(SearchResult::relevanceScore).average().orElse(0.0),
            results.stream().mapToDouble(SearchResult::relevanceScore).max().orElse(0.0),
            results.stream().mapToDouble(SearchResult::relevanceScore).min().orElse(0.0),
            weights,
            selection.strategy(),
            List.copyOf(degraded));

    return new SearchResponse(query, method, analysis, ranked, stats, true, null);
  }

  /** Builds an error envelope with no results. */
  public static SearchResponse error(
      String query, String message, Duration elapsed, FusionWeights weights) {
    ResponseStats stats =
        new ResponseStats(0, seconds(elapsed), Map.of(), 0.0, 0.0, 0.0, weights, null, List.of());
    return new SearchResponse(query, null, null, List.of(), stats, false, message);
  }

  static Map<String, Integer> sourceDistribution(List<SearchResult> results) {
    Map<String, Integer> distribution = new LinkedHashMap<>();
    for (SearchResult result : results) {
      String source = MetadataValues.text(result.metadata(), "source_file", "source", "filename");
      distribution.merge(source.isEmpty() ? UNKNOWN_SOURCE : source, 1, Integer::sum);
    }
    return distribution;
  }

  private static RankedResult toRankedResult(SearchResult result) {
    return new RankedResult(
        result.id(),
        result.content(),
        result.metadata().toMap(),
        new RankedResult.Scores(
            result.vectorScore(),
            result.keywordScore(),
            result.metadataScore(),
            result.relevanceScore(),
            result.finalScore()),
        result.rank(),
        result.distance());
  }

  private static double seconds(Duration elapsed) {
    return elapsed.toNanos() / 1_000_000_000.0;
  }
}
