package dev.scholar.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import dev.scholar.websearch.KnowledgeGraph;
import dev.scholar.websearch.WebSearchResponse;
import dev.scholar.websearch.WebSearchResult;
import java.util.List;
import org.jspecify.annotations.Nullable;

/** JSON shape of {@code /api/web-search}: the provider response flagged with {@code success}. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record WebSearchApiResponse(
    boolean success,
    List<WebSearchResult> results,
    long totalResults,
    long searchTimeMs,
    List<String> relatedQueries,
    @Nullable KnowledgeGraph knowledgeGraph) {

  static WebSearchApiResponse from(WebSearchResponse response) {
    return new WebSearchApiResponse(
        true,
        response.results(),
        response.totalResults(),
        response.searchTimeMs(),
        response.relatedQueries(),
        response.knowledgeGraph());
  }
}
