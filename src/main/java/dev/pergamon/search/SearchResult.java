package dev.pergamon.search;

import dev.langchain4j.data.document.Metadata;
import dev.pergamon.document.Document;

/**
 * A candidate document carrying its independent signal scores through fusion, relevance
 * enhancement and selection. Each stage returns updated copies.
 *
 * @param id document id
 * @param content document text
 * @param metadata document metadata
 * @param vectorScore similarity from vector search, {@code 1 - distance}; 0.0 if not retrieved
 * @param keywordScore lexical score in [0, 1]; 0.0 if not retrieved
 * @param metadataScore metadata field match score in [0, 1]; 0.0 if not retrieved
 * @param relevanceScore domain-aware relevance in [0, 1]
 * @param finalScore weighted fusion score
 * @param rank 1-based position once selected; 0 before selection
 * @param distance cosine distance reported by the vector store; 0.0 if not retrieved
 */
public record SearchResult(
    String id,
    String content,
    Metadata metadata,
    double vectorScore,
    double keywordScore,
    double metadataScore,
    double relevanceScore,
    double finalScore,
    int rank,
    double distance) {

  /** Creates an unscored candidate for a document. */
  public static SearchResult of(Document document) {
    return new SearchResult(
        document.id(), document.content(), document.metadata(), 0.0, 0.0, 0.0, 0.0, 0.0, 0, 0.0);
  }

  public SearchResult withVectorScore(double vectorScore, double distance) {
    return new SearchResult(
        id, content, metadata, vectorScore, keywordScore, metadataScore, relevanceScore,
        finalScore, rank, distance);
  }

  public SearchResult withKeywordScore(double keywordScore) {
    return new SearchResult(
        id, content, metadata, vectorScore, keywordScore, metadataScore, relevanceScore,
        finalScore, rank, distance);
  }

  public SearchResult withMetadataScore(double metadataScore) {
    return new SearchResult(
        id, content, metadata, vectorScore, keywordScore, metadataScore, relevanceScore,
        finalScore, rank, distance);
  }

  public SearchResult withRelevanceScore(double relevanceScore) {
    return new SearchResult(
        id, content, metadata, vectorScore, keywordScore, metadataScore, relevanceScore,
        finalScore, rank, distance);
  }

  public SearchResult withFinalScore(double finalScore) {
    return new SearchResult(
        id, content, metadata, vectorScore, keywordScore, metadataScore, relevanceScore,
        finalScore, rank, distance);
  }

  public SearchResult withRank(int rank) {
    return new SearchResult(
        id, content, metadata, vectorScore, keywordScore, metadataScore, relevanceScore,
        finalScore, rank, distance);
  }
}
