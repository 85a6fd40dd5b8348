package dev.scholar.websearch;

import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Outcome of a web search.
 *
 * @param results scored results, best first
 * @param totalResults provider's estimate of total matches
 * @param searchTimeMs wall time spent in the client
 * @param relatedQueries up to five related searches suggested by the provider
 * @param knowledgeGraph knowledge graph panel, when the provider returned one
 */
public record WebSearchResponse(
    List<WebSearchResult> results,
    long totalResults,
    long searchTimeMs,
    List<String> relatedQueries,
    @Nullable KnowledgeGraph knowledgeGraph) {

  private static final WebSearchResponse EMPTY =
      new WebSearchResponse(List.of(), 0, 0, List.of(), null);

  public WebSearchResponse {
    results = results == null ? List.of() : List.copyOf(results);
    relatedQueries = relatedQueries == null ? List.of() : List.copyOf(relatedQueries);
  }

  /** The canonical response returned when a search could not be performed. */
  public static WebSearchResponse empty() {
    return EMPTY;
  }
}
