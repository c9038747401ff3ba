package dev.pergamon.search;

/**
 * Weights applied to each signal by {@link ResultFusion}. Not required to sum to 1.
 *
 * @param vector weight of the vector score
 * @param keyword weight of the keyword score
 * @param metadata weight of the metadata score (multi-modal only)
 */
public record FusionWeights(double vector, double keyword, double metadata) {}
