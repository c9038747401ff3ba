package dev.pergamon.search;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Pure static utility merging the sub-search candidate sets by document id and computing the
 * weighted fusion score.
 *
 * <p>This class has no Spring dependencies and no state; all methods are pure functions.
 */
public final class ResultFusion {

  private ResultFusion() {}

  /**
   * Fuses vector, keyword and metadata candidates.
   *
   * <p>Algorithm:
   *
   * <ol>
   *   <li>Union the ids in insertion order vector, keyword, metadata. The first record seen for an
   *       id supplies content and metadata, so vector records win over the others.
   *   <li>Copy the other sources' scores onto that record; a source that did not return the id
   *       leaves its score at 0.0
   *   <li>{@code final = vector * wV + keyword * wK}, plus {@code metadata * wM} when {@code
   *       multiSignal}
   *   <li>When {@code multiSignal}, divide every final score by the batch maximum so the top
   *       candidate scores exactly 1.0 (skipped when the maximum is 0)
   *   <li>Stable sort by final score descending, limit to {@code maxResults}
   * </ol>
   *
   * <p>Multi-signal normalisation is batch-relative: final scores are not comparable across
   * separate searches.
   *
   * @param vectorResults candidates from vector search
   * @param keywordResults candidates from keyword search
   * @param metadataResults candidates from metadata search
   * @param weights fusion weights
   * @param multiSignal whether the metadata signal takes part (multi-modal searches)
   * @param maxResults maximum number of results to return
   * @return fused candidates sorted by final score descending
   */
  public static List<SearchResult> fuse(
      List<SearchResult> vectorResults,
      List<SearchResult> keywordResults,
      List<SearchResult> metadataResults,
      FusionWeights weights,
      boolean multiSignal,
      int maxResults) {
    Map<String, SearchResult> merged = new LinkedHashMap<>();

    for (SearchResult vector : vectorResults) {
      merged.putIfAbsent(vector.id(), vector);
    }
    for (SearchResult keyword : keywordResults) {
      merged.merge(
          keyword.id(),
          keyword,
          (existing, incoming) -> existing.withKeywordScore(incoming.keywordScore()));
    }
    for (SearchResult metadata : metadataResults) {
      merged.merge(
          metadata.id(),
          metadata,
          (existing, incoming) -> existing.withMetadataScore(incoming.metadataScore()));
    }

    List<SearchResult> fused = new ArrayList<>(merged.size());
    for (SearchResult candidate : merged.values()) {
      double score =
          candidate.vectorScore() * weights.vector()
              + candidate.keywordScore() * weights.keyword();
      if (multiSignal) {
        score += candidate.metadataScore() * weights.metadata();
      }
      fused.add(candidate.withFinalScore(score));
    }

    if (multiSignal) {
      fused = normaliseByMax(fused);
    }

    return fused.stream()
        .sorted(Comparator.comparingDouble(SearchResult::finalScore).reversed())
        .limit(maxResults)
        .toList();
  }

  private static List<SearchResult> normaliseByMax(List<SearchResult> candidates) {
    double max = candidates.stream().mapToDouble(SearchResult::finalScore).max().orElse(0.0);
    if (max <= 0.0) {
      return candidates;
    }
    return candidates.stream().map(c -> c.withFinalScore(c.finalScore() / max)).toList();
  }
}
