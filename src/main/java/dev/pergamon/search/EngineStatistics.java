package dev.pergamon.search;

import java.util.List;

/**
 * Introspection view of the engine.
 *
 * @param totalSearches searches completed successfully
 * @param averageSearchTimeSeconds mean execution time of those searches
 * @param supportedMethods method names accepted by {@link SearchService#search(String,
 *     SearchOptions)}
 * @param fusionWeights fusion weights in force
 * @param domainKeywordCount number of lexicon domains
 * @param synonymCount number of lexicon synonym entries
 */
public record EngineStatistics(
    long totalSearches,
    double averageSearchTimeSeconds,
    List<String> supportedMethods,
    FusionWeights fusionWeights,
    int domainKeywordCount,
    int synonymCount) {}
