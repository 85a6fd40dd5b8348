package dev.scholar.websearch;

import org.jspecify.annotations.Nullable;

/**
 * A scored web search hit in provider-independent form.
 *
 * @param id identifier unique within one response ({@code organic_0}, {@code news_2}, ...)
 * @param title result title
 * @param url result URL
 * @param snippet text excerpt (empty when the provider sent none)
 * @param domain host name of {@code url}
 * @param kind result category
 * @param credibilityScore domain trust heuristic in [0, 1]
 * @param relevanceScore query-term overlap heuristic in [0, 1]
 * @param publishDate publication timestamp as sent by the provider (news only)
 * @param sourceName publisher name (news only)
 */
public record WebSearchResult(
    String id,
    String title,
    String url,
    String snippet,
    String domain,
    WebResultKind kind,
    double credibilityScore,
    double relevanceScore,
    @Nullable String publishDate,
    @Nullable String sourceName) {

  /** Ranking key used to order web results: {@code 0.6 * relevance + 0.4 * credibility}. */
  public double rankingScore() {
    return relevanceScore * 0.6 + credibilityScore * 0.4;
  }
}
