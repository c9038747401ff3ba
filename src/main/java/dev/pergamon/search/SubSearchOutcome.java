package dev.pergamon.search;

import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Result of one sub-search task after the fan-out barrier.
 *
 * @param source the sub-search that produced this outcome
 * @param results candidates, empty when degraded
 * @param failure why the sub-search degraded, null when it completed
 */
public record SubSearchOutcome(
    SubSearch source, List<SearchResult> results, @Nullable String failure) {

  public SubSearchOutcome {
    results = List.copyOf(results);
  }

  static SubSearchOutcome completed(SubSearch source, List<SearchResult> results) {
    return new SubSearchOutcome(source, results, null);
  }

  static SubSearchOutcome degraded(SubSearch source, String failure) {
    return new SubSearchOutcome(source, List.of(), failure);
  }

  public boolean isDegraded() {
    return failure != null;
  }
}
