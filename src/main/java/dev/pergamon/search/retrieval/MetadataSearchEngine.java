package dev.pergamon.search.retrieval;

import dev.langchain4j.data.document.Metadata;
import dev.langchain4j.store.embedding.filter.Filter;
import dev.pergamon.document.Document;
import dev.pergamon.document.DocumentStore;
import dev.pergamon.document.MetadataValues;
import dev.pergamon.search.SearchCancelledException;
import dev.pergamon.search.SearchResult;
import dev.pergamon.search.UpstreamException;
import dev.pergamon.search.query.QueryTokens;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import org.jspecify.annotations.Nullable;
import org.springframework.stereotype.Component;

/**
 * Scores documents by matching query terms against structured metadata fields.
 *
 * <p>A field earns its full weight when any query term is a substring of its lower-cased value:
 * filename 0.4 (falling back to {@code source}), category 0.3, document type 0.2, domain 0.1. The
 * total is capped at 1.0 and zero-score documents are dropped.
 */
@Component
public class MetadataSearchEngine {

  private static final List<MetadataField> FIELDS =
      List.of(
          new MetadataField(0.4, "filename", "source"),
          new MetadataField(0.3, "category"),
          new MetadataField(0.2, "document_type"),
          new MetadataField(0.1, "domain"));

  private final DocumentStore documentStore;

  public MetadataSearchEngine(DocumentStore documentStore) {
    this.documentStore = documentStore;
  }

  /**
   * Returns up to {@code n} documents ordered by descending metadata score.
   *
   * @param query the query text
   * @param n maximum number of candidates
   * @param filter metadata predicate restricting the scanned corpus, or null
   * @return candidates with metadata score set
   * @throws UpstreamException if the document store fails
   */
  public List<SearchResult> search(String query, int n, @Nullable Filter filter) {
    List<String> terms = queryTerms(query);
    if (terms.isEmpty()) {
      return List.of();
    }

    List<Document> corpus;
    try {
      corpus = documentStore.getAll(filter);
    } catch (RuntimeException e) {
      throw new UpstreamException("Document store scan failed: " + e.getMessage(), e);
    }

    List<SearchResult> scored = new ArrayList<>();
    for (Document document : corpus) {
      if (Thread.currentThread().isInterrupted()) {
        throw new SearchCancelledException("Metadata scan interrupted");
      }
      double score = metadataScore(terms, document.metadata());
      if (score > 0.0) {
        scored.add(SearchResult.of(document).withMetadataScore(score));
      }
    }
    return scored.stream()
        .sorted(Comparator.comparingDouble(SearchResult::metadataScore).reversed())
        .limit(n)
        .toList();
  }

  static List<String> queryTerms(String query) {
    return QueryTokens.split(query.toLowerCase(Locale.ROOT));
  }

  static double metadataScore(List<String> terms, Metadata metadata) {
    double score = 0.0;
    for (MetadataField field : FIELDS) {
      String value = MetadataValues.text(metadata, field.keys()).toLowerCase(Locale.ROOT);
      if (!value.isEmpty() && terms.stream().anyMatch(value::contains)) {
        score += field.weight();
      }
    }
    return Math.min(score, 1.0);
  }

  private record MetadataField(double weight, String... keys) {}
}
