package dev.scholar.search;

import jakarta.annotation.PostConstruct;
import java.time.Duration;
import java.util.List;
import org.jspecify.annotations.Nullable;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Process-wide search defaults, bound from {@code scholar.search.*}.
 *
 * <ul>
 *   <li>{@code dense-weight}, {@code sparse-weight}, {@code web-weight} - default method weights
 *       (0.4 / 0.3 / 0.3)
 *   <li>{@code include-web}, {@code include-news} - default web and news inclusion (true / true)
 *   <li>{@code max-documents}, {@code max-web-results} - default result caps (5 / 5)
 *   <li>{@code similarity-threshold} - minimum dense similarity (0.6)
 *   <li>{@code location} - optional default location hint for web search
 *   <li>{@code strategy-timeout-ms} - per-strategy deadline inside one search (15000)
 * </ul>
 *
 * <p>Validated at startup via {@link #validate()}. Callers never mutate these values; each request
 * derives its own {@link SearchConfig} through {@link #toDefaultConfig()}.
 */
@Configuration
@ConfigurationProperties(prefix = "scholar.search")
public class SearchProperties {

  private double denseWeight = 0.4;
  private double sparseWeight = 0.3;
  private double webWeight = 0.3;
  private boolean includeWeb = true;
  private boolean includeNews = true;
  private int maxDocuments = 5;
  private int maxWebResults = 5;
  private double similarityThreshold = 0.6;
  private @Nullable String location;
  private long strategyTimeoutMs = 15_000;

  /** Validates configuration at startup. Throws if values are out of allowed range. */
  @PostConstruct
  void validate() {
    if (denseWeight < 0.0 || sparseWeight < 0.0 || webWeight < 0.0) {
      throw new IllegalStateException(
          "scholar.search weights must not be negative, got: dense="
              + denseWeight
              + ", sparse="
              + sparseWeight
              + ", web="
              + webWeight);
    }
    if (maxDocuments < 0 || maxWebResults < 0) {
      throw new IllegalStateException(
          "scholar.search.max-documents and max-web-results must not be negative");
    }
    if (similarityThreshold < 0.0 || similarityThreshold > 1.0) {
      throw new IllegalStateException(
          "scholar.search.similarity-threshold must be in [0.0, 1.0], got: "
              + similarityThreshold);
    }
    if (strategyTimeoutMs < 1) {
      throw new IllegalStateException(
          "scholar.search.strategy-timeout-ms must be positive, got: " + strategyTimeoutMs);
    }
  }

  /** Builds a fresh default configuration from the current property values. */
  public SearchConfig toDefaultConfig() {
    return new SearchConfig(
        List.of(
            RetrievalMethod.enabled(MethodKind.DENSE, denseWeight),
            RetrievalMethod.enabled(MethodKind.SPARSE, sparseWeight),
            RetrievalMethod.enabled(MethodKind.WEB_ONLY, webWeight)),
        includeWeb,
        includeNews,
        maxDocuments,
        maxWebResults,
        similarityThreshold,
        location);
  }

  public Duration strategyTimeout() {
    return Duration.ofMillis(strategyTimeoutMs);
  }

  public double getDenseWeight() {
    return denseWeight;
  }

  public void setDenseWeight(double denseWeight) {
    this.denseWeight = denseWeight;
  }

  public double getSparseWeight() {
    return sparseWeight;
  }

  public void setSparseWeight(double sparseWeight) {
    this.sparseWeight = sparseWeight;
  }

  public double getWebWeight() {
    return webWeight;
  }

  public void setWebWeight(double webWeight) {
    this.webWeight = webWeight;
  }

  public boolean isIncludeWeb() {
    return includeWeb;
  }

  public void setIncludeWeb(boolean includeWeb) {
    this.includeWeb = includeWeb;
  }

  public boolean isIncludeNews() {
    return includeNews;
  }

  public void setIncludeNews(boolean includeNews) {
    this.includeNews = includeNews;
  }

  public int getMaxDocuments() {
    return maxDocuments;
  }

  public void setMaxDocuments(int maxDocuments) {
    this.maxDocuments = maxDocuments;
  }

  public int getMaxWebResults() {
    return maxWebResults;
  }

  public void setMaxWebResults(int maxWebResults) {
    this.maxWebResults = maxWebResults;
  }

  public double getSimilarityThreshold() {
    return similarityThreshold;
  }

  public void setSimilarityThreshold(double similarityThreshold) {
    this.similarityThreshold = similarityThreshold;
  }

  public @Nullable String getLocation() {
    return location;
  }

  public void setLocation(@Nullable String location) {
    this.location = location;
  }

  public long getStrategyTimeoutMs() {
    return strategyTimeoutMs;
  }

  public void setStrategyTimeoutMs(long strategyTimeoutMs) {
    this.strategyTimeoutMs = strategyTimeoutMs;
  }
}
