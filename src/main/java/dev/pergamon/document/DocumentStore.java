package dev.pergamon.document;

import dev.langchain4j.store.embedding.filter.Filter;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Read access to the full document corpus, used by the lexical and metadata scans.
 *
 * <p>Implementations signal store failures with unchecked exceptions; callers decide how to
 * degrade.
 */
public interface DocumentStore {

  /**
   * Returns every document whose metadata satisfies {@code filter}, in a stable order.
   *
   * @param filter metadata predicate, or {@code null} for the whole corpus
   */
  List<Document> getAll(@Nullable Filter filter);

  /** Returns the total number of documents in the corpus. */
  long count();

  /** Returns up to {@code limit} documents from the head of the corpus. */
  List<Document> sample(int limit);
}
