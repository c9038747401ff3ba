package dev.pergamon.search.retrieval;

import dev.langchain4j.data.document.Metadata;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.store.embedding.CosineSimilarity;
import dev.langchain4j.store.embedding.EmbeddingMatch;
import dev.langchain4j.store.embedding.EmbeddingSearchRequest;
import dev.langchain4j.store.embedding.EmbeddingStore;
import dev.langchain4j.store.embedding.filter.Filter;
import dev.pergamon.document.Document;
import dev.pergamon.search.SearchResult;
import dev.pergamon.search.UpstreamException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import org.jspecify.annotations.Nullable;
import org.springframework.stereotype.Component;

/**
 * Nearest-neighbour retrieval over the external vector store.
 *
 * <p>Embeds the query with the configured {@link EmbeddingModel}, queries the {@link
 * EmbeddingStore} and converts each match into a candidate with {@code vectorScore = 1 -
 * distance}. LangChain4j reports a relevance score {@code r} in [0, 1]; the cosine distance is
 * {@code 1 - (2r - 1)}, which lies in [0, 2] for a well-behaved store.
 *
 * <p>Embedding and store failures, and negative distances, are raised as {@link UpstreamException}
 * so the caller can degrade this sub-search to an empty contribution.
 */
@Component
public class VectorSearchAdapter {

  private final EmbeddingStore<TextSegment> embeddingStore;
  private final EmbeddingModel embeddingModel;

  public VectorSearchAdapter(
      EmbeddingStore<TextSegment> embeddingStore, EmbeddingModel embeddingModel) {
    this.embeddingStore = embeddingStore;
    this.embeddingModel = embeddingModel;
  }

  /**
   * Returns up to {@code n} nearest candidates ordered by ascending distance.
   *
   * @param query the query text
   * @param n maximum number of candidates
   * @param filter metadata predicate pushed down to the store, or null
   * @return candidates with vector score and distance set
   * @throws UpstreamException if the embedding model or the store fails or violates its contract
   */
  public List<SearchResult> search(String query, int n, @Nullable Filter filter) {
    Embedding queryEmbedding = embed(query);

    EmbeddingSearchRequest.EmbeddingSearchRequestBuilder builder =
        EmbeddingSearchRequest.builder().queryEmbedding(queryEmbedding).maxResults(n).minScore(0.0);
    if (filter != null) {
      builder.filter(filter);
    }

    List<EmbeddingMatch<TextSegment>> matches;
    try {
      matches = embeddingStore.search(builder.build()).matches();
    } catch (RuntimeException e) {
      throw new UpstreamException("Vector store query failed: " + e.getMessage(), e);
    }

    List<SearchResult> results = new ArrayList<>(matches.size());
    for (EmbeddingMatch<TextSegment> match : matches) {
      double distance = cosineDistance(match.score());
      if (distance < 0.0) {
        throw new UpstreamException(
            "Vector store returned negative distance " + distance + " for " + match.embeddingId());
      }
      results.add(SearchResult.of(toDocument(match)).withVectorScore(1.0 - distance, distance));
    }
    results.sort(Comparator.comparingDouble(SearchResult::distance));
    return results;
  }

  /** Converts a LangChain4j relevance score into cosine distance. */
  static double cosineDistance(double relevanceScore) {
    return 1.0 - CosineSimilarity.fromRelevanceScore(relevanceScore);
  }

  private Embedding embed(String query) {
    try {
      return embeddingModel.embed(query).content();
    } catch (RuntimeException e) {
      throw new UpstreamException("Query embedding failed: " + e.getMessage(), e);
    }
  }

  private static Document toDocument(EmbeddingMatch<TextSegment> match) {
    TextSegment segment = match.embedded();
    if (segment == null) {
      return new Document(match.embeddingId(), "", new Metadata());
    }
    return new Document(match.embeddingId(), segment.text(), segment.metadata());
  }
}
