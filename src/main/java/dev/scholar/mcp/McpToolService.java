package dev.scholar.mcp;

import dev.scholar.search.HybridSearchResult;
import dev.scholar.search.HybridSearchService;
import dev.scholar.search.SearchConfigOverrides;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.tool.annotation.Tool;
import org.springframework.ai.tool.annotation.ToolParam;
import org.springframework.stereotype.Service;

/**
 * MCP adapter exposing the hybrid research search as tool methods.
 *
 * <p>Tools never throw: invalid arguments and unexpected failures come back as {@code Error: ...}
 * strings so the calling agent can correct itself.
 *
 * @see SourceContextFormatter
 * @see McpToolConfig
 */
@Service
public class McpToolService {

  private static final Logger log = LoggerFactory.getLogger(McpToolService.class);

  static final int MAX_RESULTS_CAP = 50;
  static final String EMPTY_QUERY_ERROR =
      "Error: Query must not be empty. Provide a search query string.";

  private final HybridSearchService searchService;
  private final SourceContextFormatter formatter;

  public McpToolService(HybridSearchService searchService, SourceContextFormatter formatter) {
    this.searchService = searchService;
    this.formatter = formatter;
  }

  @Tool(
      name = "hybrid_search",
      description =
          "Search uploaded documents and the web together. "
              + "Returns numbered citation blocks with source type, credibility, title, URL "
              + "and content.")
  public String hybridSearch(
      @ToolParam(description = "Search query text") @Nullable String query,
      @ToolParam(description = "Maximum number of document results (0-50)", required = false)
          @Nullable Integer maxDocuments,
      @ToolParam(description = "Maximum number of web results (0-50)", required = false)
          @Nullable Integer maxWebResults,
      @ToolParam(description = "Whether to search the web (default true)", required = false)
          @Nullable Boolean includeWeb,
      @ToolParam(description = "Whether to add news results (default true)", required = false)
          @Nullable Boolean includeNews) {
    try {
      if (query == null || query.isBlank()) {
        return EMPTY_QUERY_ERROR;
      }
      SearchConfigOverrides overrides =
          new SearchConfigOverrides(
              null,
              includeWeb,
              includeNews,
              clampOrNull(maxDocuments),
              clampOrNull(maxWebResults),
              null,
              null);
      return formatter.format(searchService.search(query, overrides));
    } catch (Exception e) {
      log.warn("hybrid_search failed for '{}': {}", query, e.getMessage());
      return "Error running hybrid search: " + e.getMessage();
    }
  }

  @Tool(
      name = "search_documents",
      description = "Search only the uploaded documents, fusing semantic and keyword matches.")
  public String searchDocuments(
      @ToolParam(description = "Search query text") @Nullable String query,
      @ToolParam(description = "Maximum number of results (1-50, default 5)", required = false)
          @Nullable Integer maxResults) {
    try {
      if (query == null || query.isBlank()) {
        return EMPTY_QUERY_ERROR;
      }
      HybridSearchResult result =
          maxResults != null
              ? searchService.searchDocuments(query, clamp(maxResults))
              : searchService.searchDocuments(query);
      return formatter.format(result);
    } catch (Exception e) {
      log.warn("search_documents failed for '{}': {}", query, e.getMessage());
      return "Error searching documents: " + e.getMessage();
    }
  }

  @Tool(
      name = "search_web",
      description = "Search only the web, including news, ranked by relevance and credibility.")
  public String searchWeb(
      @ToolParam(description = "Search query text") @Nullable String query,
      @ToolParam(description = "Maximum number of results (1-50, default 8)", required = false)
          @Nullable Integer maxResults) {
    try {
      if (query == null || query.isBlank()) {
        return EMPTY_QUERY_ERROR;
      }
      HybridSearchResult result =
          maxResults != null
              ? searchService.searchWeb(query, clamp(maxResults))
              : searchService.searchWeb(query);
      return formatter.format(result);
    } catch (Exception e) {
      log.warn("search_web failed for '{}': {}", query, e.getMessage());
      return "Error searching the web: " + e.getMessage();
    }
  }

  static int clamp(int value) {
    return Math.max(1, Math.min(value, MAX_RESULTS_CAP));
  }

  private static @Nullable Integer clampOrNull(@Nullable Integer value) {
    return value == null ? null : Math.max(0, Math.min(value, MAX_RESULTS_CAP));
  }
}
