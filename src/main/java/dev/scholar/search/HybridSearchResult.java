package dev.scholar.search;

import dev.scholar.retrieval.SearchResult;
import dev.scholar.websearch.WebSearchResult;
import java.util.List;

/**
 * Final output of a hybrid search.
 *
 * @param documentResults fused document hits, best first
 * @param webResults web hits, best first
 * @param combinedScore unweighted mean of the mean document score and the mean web relevance
 * @param sources citation-numbered sources, documents first
 * @param searchTimeMs wall time of the whole search
 * @param totalResults {@code documentResults.size() + webResults.size()}
 */
public record HybridSearchResult(
    List<SearchResult> documentResults,
    List<WebSearchResult> webResults,
    double combinedScore,
    List<Source> sources,
    long searchTimeMs,
    int totalResults) {

  public HybridSearchResult {
    documentResults = documentResults == null ? List.of() : List.copyOf(documentResults);
    webResults = webResults == null ? List.of() : List.copyOf(webResults);
    sources = sources == null ? List.of() : List.copyOf(sources);
  }

  /** A result with nothing found, used when the search itself fails. */
  public static HybridSearchResult empty(long searchTimeMs) {
    return new HybridSearchResult(List.of(), List.of(), 0.0, List.of(), searchTimeMs, 0);
  }
}
