package dev.pergamon.search;

import dev.pergamon.search.query.QueryAnalysis;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Response envelope of {@link SearchService#search(String, SearchOptions)}. Always well formed:
 * failures are reported with {@code success=false}, an empty result list and an error message.
 *
 * @param query the query as received
 * @param method the executed method, null when the search failed before it was resolved
 * @param queryAnalysis the query analysis, null when the search failed before analysis
 * @param results ranked results
 * @param stats execution metadata
 * @param success whether the search completed
 * @param error failure description, null on success
 */
public record SearchResponse(
    String query,
    @Nullable SearchMethod method,
    @Nullable QueryAnalysis queryAnalysis,
    List<RankedResult> results,
    ResponseStats stats,
    boolean success,
    @Nullable String error) {}
