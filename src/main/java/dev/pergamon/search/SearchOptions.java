package dev.pergamon.search;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * Caller options for {@link SearchService#search(String, SearchOptions)}.
 *
 * <p>Values are validated when the search starts, not here, so that bad input yields an error
 * envelope rather than an exception.
 *
 * @param method method name ({@code vector_only}, {@code keyword_only}, {@code hybrid}, {@code
 *     multi_modal}, {@code adaptive}); defaults to {@code adaptive}
 * @param maxResults per-sub-search candidate budget; null means budget by query complexity
 * @param filters metadata equality filters combined with AND; values must be String, Integer,
 *     Long, Float, Double or UUID
 * @param timeout overall deadline for the sub-search phase; null means only the configured
 *     per-sub-search timeout applies
 */
public record SearchOptions(
    String method,
    @Nullable Integer maxResults,
    Map<String, Object> filters,
    @Nullable Duration timeout) {

  private static final String DEFAULT_METHOD = "adaptive";

  /** Compact constructor applying defaults. */
  public SearchOptions {
    method = method == null ? DEFAULT_METHOD : method;
    filters =
        filters == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(filters));
  }

  /** Adaptive method, complexity-based budget, no filters, no caller deadline. */
  public static SearchOptions defaults() {
    return new SearchOptions(DEFAULT_METHOD, null, Map.of(), null);
  }

  /** Options for an explicit method with all other values defaulted. */
  public static SearchOptions of(String method) {
    return new SearchOptions(method, null, Map.of(), null);
  }

  public SearchOptions withMaxResults(@Nullable Integer maxResults) {
    return new SearchOptions(method, maxResults, filters, timeout);
  }

  public SearchOptions withFilters(Map<String, Object> filters) {
    return new SearchOptions(method, maxResults, filters, timeout);
  }

  public SearchOptions withTimeout(@Nullable Duration timeout) {
    return new SearchOptions(method, maxResults, filters, timeout);
  }
}
