package dev.pergamon.search;

import java.util.Map;

/**
 * One entry of the response result list.
 *
 * @param id document id
 * @param content document text
 * @param metadata document metadata as a plain map
 * @param scores per-signal score breakdown
 * @param rank 1-based rank
 * @param distance vector store distance, 0.0 when not retrieved by vector search
 */
public record RankedResult(
    String id,
    String content,
    Map<String, Object> metadata,
    Scores scores,
    int rank,
    double distance) {

  /** Signal breakdown of a ranked result. */
  public record Scores(
      double vector, double keyword, double metadata, double relevance, double finalScore) {}
}
