package dev.pergamon.search;

/**
 * Concrete plan for one search.
 *
 * @param method the resolved method, never {@link SearchMethod#ADAPTIVE}
 * @param resultBudget candidates requested from each sub-search, and kept after fusion
 */
public record SearchStrategy(SearchMethod method, int resultBudget) {}
