package dev.pergamon.search;

import dev.pergamon.search.query.QueryComplexity;
import java.util.ArrayList;
import java.util.List;

/**
 * Pure static utility selecting a bounded, tiered subset of relevance-sorted candidates.
 *
 * <p>Tiers: high {@code >= 0.6}, medium {@code [0.4, 0.6)}, low {@code [0.2, 0.4)}; anything below
 * 0.2 is discarded. The quota is 15 / 10 / 5 for HIGH / MEDIUM / LOW complexity. Branches, in
 * order:
 *
 * <ol>
 *   <li>at least {@code quota / 2} high candidates: the top {@code quota} high candidates
 *   <li>at least {@code quota / 2} high and medium candidates together: all high, then medium up
 *       to the quota
 *   <li>otherwise: all high, all medium, then low up to the quota
 * </ol>
 *
 * <p>The selection is re-ranked 1..k.
 */
public final class DocumentSelector {

  static final double HIGH_THRESHOLD = 0.6;
  static final double MEDIUM_THRESHOLD = 0.4;
  static final double LOW_THRESHOLD = 0.2;

  private DocumentSelector() {}

  /**
   * The outcome of selection.
   *
   * @param results selected candidates ranked 1..k
   * @param strategy the branch that produced them
   */
  public record Selection(List<SearchResult> results, SelectionStrategy strategy) {}

  /** Maximum number of documents returned for a query of the given complexity. */
  public static int quota(QueryComplexity complexity) {
    return switch (complexity) {
      case HIGH -> 15;
      case MEDIUM -> 10;
      case LOW -> 5;
    };
  }

  /**
   * Selects documents from a relevance-sorted list.
   *
   * @param ranked candidates sorted by relevance score descending
   * @param complexity the query complexity
   * @return the selection
   */
  public static Selection select(List<SearchResult> ranked, QueryComplexity complexity) {
    List<SearchResult> high = new ArrayList<>();
    List<SearchResult> medium = new ArrayList<>();
    List<SearchResult> low = new ArrayList<>();
    for (SearchResult candidate : ranked) {
      double score = candidate.relevanceScore();
      if (score >= HIGH_THRESHOLD) {
        high.add(candidate);
      } else if (score >= MEDIUM_THRESHOLD) {
        medium.add(candidate);
      } else if (score >= LOW_THRESHOLD) {
        low.add(candidate);
      }
    }

    int quota = quota(complexity);
    int half = quota / 2;
    List<SearchResult> selected = new ArrayList<>();
    SelectionStrategy strategy;

    if (high.size() >= half) {
      selected.addAll(head(high, quota));
      strategy = SelectionStrategy.HIGH_RELEVANCE_PRIORITY;
    } else if (high.size() + medium.size() >= half) {
      selected.addAll(high);
      selected.addAll(head(medium, quota - high.size()));
      strategy = SelectionStrategy.MIXED_RELEVANCE;
    } else {
      selected.addAll(high);
      selected.addAll(medium);
      selected.addAll(head(low, quota - high.size() - medium.size()));
      strategy = SelectionStrategy.ALL_LEVELS;
    }

    List<SearchResult> reranked = new ArrayList<>(selected.size());
    for (int i = 0; i < selected.size(); i++) {
      reranked.add(selected.get(i).withRank(i + 1));
    }
    return new Selection(List.copyOf(reranked), strategy);
  }

  private static List<SearchResult> head(List<SearchResult> list, int limit) {
    return list.subList(0, Math.max(0, Math.min(limit, list.size())));
  }
}
