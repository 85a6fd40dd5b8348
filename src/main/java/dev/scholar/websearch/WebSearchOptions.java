package dev.scholar.websearch;

import org.jspecify.annotations.Nullable;

/**
 * Per-call options for {@link WebSearchClient#search}.
 *
 * @param includeNews also run a news query and merge its results
 * @param location optional location hint forwarded to the provider
 * @param maxResults result cap; null requests {@value #DEFAULT_REQUEST_COUNT} results from the
 *     provider and keeps at most {@value #DEFAULT_RESULT_LIMIT}
 */
public record WebSearchOptions(
    boolean includeNews, @Nullable String location, @Nullable Integer maxResults) {

  static final int DEFAULT_REQUEST_COUNT = 8;
  static final int DEFAULT_RESULT_LIMIT = 10;

  public static WebSearchOptions defaults() {
    return new WebSearchOptions(false, null, null);
  }

  int requestCount() {
    return maxResults == null || maxResults == 0 ? DEFAULT_REQUEST_COUNT : maxResults;
  }

  int resultLimit() {
    return maxResults == null || maxResults == 0 ? DEFAULT_RESULT_LIMIT : maxResults;
  }
}
