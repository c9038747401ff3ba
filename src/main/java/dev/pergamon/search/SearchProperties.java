package dev.pergamon.search;

import jakarta.annotation.PostConstruct;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Externalised configuration for the search pipeline.
 *
 * <p>Properties are bound from {@code pergamon.search.*} in application.yml and frozen into a
 * {@link SearchConfig} at startup.
 *
 * <ul>
 *   <li>{@code vector-weight}, {@code keyword-weight}, {@code metadata-weight} - fusion weights
 *       (defaults 0.6 / 0.4 / 0.2)
 *   <li>{@code exact-match-weight} ... {@code authority-weight} - the seven relevance signal
 *       weights
 *   <li>{@code simple-query-results}, {@code medium-query-results}, {@code
 *       complex-query-results} - per-sub-search candidate budgets by complexity (30 / 50 / 80)
 *   <li>{@code sub-search-timeout} - deadline for each concurrently running sub-search (default
 *       5s)
 *   <li>{@code sub-search-threads} - size of the sub-search worker pool (default 3)
 * </ul>
 *
 * <p>Validated at startup via {@link #validate()}; the application fails to start if values are out
 * of range.
 */
@ConfigurationProperties(prefix = "pergamon.search")
public class SearchProperties {

  private double vectorWeight = 0.6;
  private double keywordWeight = 0.4;
  private double metadataWeight = 0.2;

  private double exactMatchWeight = 0.3;
  private double partialMatchWeight = 0.2;
  private double domainKeywordWeight = 0.4;
  private double metadataMatchWeight = 0.3;
  private double contentQualityWeight = 0.1;
  private double recencyWeight = 0.05;
  private double authorityWeight = 0.1;

  private int simpleQueryResults = 30;
  private int mediumQueryResults = 50;
  private int complexQueryResults = 80;

  private Duration subSearchTimeout = Duration.ofSeconds(5);
  private int subSearchThreads = 3;

  /** Validates configuration at startup. Throws if values are out of allowed range. */
  @PostConstruct
  public void validate() {
    requireNonNegative("vector-weight", vectorWeight);
    requireNonNegative("keyword-weight", keywordWeight);
    requireNonNegative("metadata-weight", metadataWeight);
    requireNonNegative("exact-match-weight", exactMatchWeight);
    requireNonNegative("partial-match-weight", partialMatchWeight);
    requireNonNegative("domain-keyword-weight", domainKeywordWeight);
    requireNonNegative("metadata-match-weight", metadataMatchWeight);
    requireNonNegative("content-quality-weight", contentQualityWeight);
    requireNonNegative("recency-weight", recencyWeight);
    requireNonNegative("authority-weight", authorityWeight);
    requirePositive("simple-query-results", simpleQueryResults);
    requirePositive("medium-query-results", mediumQueryResults);
    requirePositive("complex-query-results", complexQueryResults);
    requirePositive("sub-search-threads", subSearchThreads);
    if (subSearchTimeout == null || subSearchTimeout.isZero() || subSearchTimeout.isNegative()) {
      throw new IllegalStateException(
          "pergamon.search.sub-search-timeout must be positive, got: " + subSearchTimeout);
    }
  }

  /** Freezes the bound values into the immutable runtime configuration. */
  public SearchConfig toSearchConfig() {
    return new SearchConfig(
        new FusionWeights(vectorWeight, keywordWeight, metadataWeight),
        exactMatchWeight,
        partialMatchWeight,
        domainKeywordWeight,
        metadataMatchWeight,
        contentQualityWeight,
        recencyWeight,
        authorityWeight,
        simpleQueryResults,
        mediumQueryResults,
        complexQueryResults,
        subSearchTimeout);
  }

  private static void requireNonNegative(String name, double value) {
    if (value < 0.0 || Double.isNaN(value)) {
      throw new IllegalStateException(
          "pergamon.search." + name + " must be >= 0.0, got: " + value);
    }
  }

  private static void requirePositive(String name, int value) {
    if (value < 1) {
      throw new IllegalStateException("pergamon.search." + name + " must be >= 1, got: " + value);
    }
  }

  public double getVectorWeight() {
    return vectorWeight;
  }

  public void setVectorWeight(double vectorWeight) {
    this.vectorWeight = vectorWeight;
  }

  public double getKeywordWeight() {
    return keywordWeight;
  }

  public void setKeywordWeight(double keywordWeight) {
    this.keywordWeight = keywordWeight;
  }

  public double getMetadataWeight() {
    return metadataWeight;
  }

  public void setMetadataWeight(double metadataWeight) {
    this.metadataWeight = metadataWeight;
  }

  public double getExactMatchWeight() {
    return exactMatchWeight;
  }

  public void setExactMatchWeight(double exactMatchWeight) {
    this.exactMatchWeight = exactMatchWeight;
  }

  public double getPartialMatchWeight() {
    return partialMatchWeight;
  }

  public void setPartialMatchWeight(double partialMatchWeight) {
    this.partialMatchWeight = partialMatchWeight;
  }

  public double getDomainKeywordWeight() {
    return domainKeywordWeight;
  }

  public void setDomainKeywordWeight(double domainKeywordWeight) {
    this.domainKeywordWeight = domainKeywordWeight;
  }

  public double getMetadataMatchWeight() {
    return metadataMatchWeight;
  }

  public void setMetadataMatchWeight(double metadataMatchWeight) {
    this.metadataMatchWeight = metadataMatchWeight;
  }

  public double getContentQualityWeight() {
    return contentQualityWeight;
  }

  public void setContentQualityWeight(double contentQualityWeight) {
    this.contentQualityWeight = contentQualityWeight;
  }

  public double getRecencyWeight() {
    return recencyWeight;
  }

  public void setRecencyWeight(double recencyWeight) {
    this.recencyWeight = recencyWeight;
  }

  public double getAuthorityWeight() {
    return authorityWeight;
  }

  public void setAuthorityWeight(double authorityWeight) {
    this.authorityWeight = authorityWeight;
  }

  public int getSimpleQueryResults() {
    return simpleQueryResults;
  }

  public void setSimpleQueryResults(int simpleQueryResults) {
    this.simpleQueryResults = simpleQueryResults;
  }

  public int getMediumQueryResults() {
    return mediumQueryResults;
  }

  public void setMediumQueryResults(int mediumQueryResults) {
    this.mediumQueryResults = mediumQueryResults;
  }

  public int getComplexQueryResults() {
    return complexQueryResults;
  }

  public void setComplexQueryResults(int complexQueryResults) {
    this.complexQueryResults = complexQueryResults;
  }

  public Duration getSubSearchTimeout() {
    return subSearchTimeout;
  }

  public void setSubSearchTimeout(Duration subSearchTimeout) {
    this.subSearchTimeout = subSearchTimeout;
  }

  public int getSubSearchThreads() {
    return subSearchThreads;
  }

  public void setSubSearchThreads(int subSearchThreads) {
    this.subSearchThreads = subSearchThreads;
  }
}
