package dev.pergamon.search;

import java.util.List;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * Execution metadata and aggregate statistics of one search.
 *
 * @param totalResults number of returned results
 * @param executionTimeSeconds wall-clock time of the search
 * @param sourceDistribution result count per document source
 * @param avgRelevance mean relevance score of the results, 0.0 when empty
 * @param maxRelevance highest relevance score, 0.0 when empty
 * @param minRelevance lowest relevance score, 0.0 when empty
 * @param weights fusion weights in force
 * @param selectionStrategy selection branch used, null for error envelopes
 * @param degradedSources sub-searches that failed or timed out
 */
public record ResponseStats(
    int totalResults,
    double executionTimeSeconds,
    Map<String, Integer> sourceDistribution,
    double avgRelevance,
    double maxRelevance,
    double minRelevance,
    FusionWeights weights,
    @Nullable SelectionStrategy selectionStrategy,
    List<SubSearch> degradedSources) {}
