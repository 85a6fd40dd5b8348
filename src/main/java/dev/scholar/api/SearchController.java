package dev.scholar.api;

import dev.scholar.search.HybridSearchResult;
import dev.scholar.search.HybridSearchService;
import dev.scholar.websearch.ProbeResult;
import dev.scholar.websearch.WebSearchClient;
import dev.scholar.websearch.WebSearchOptions;
import jakarta.validation.Valid;
import java.time.Clock;
import java.time.Instant;
import org.jspecify.annotations.Nullable;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST adapter over {@link HybridSearchService} and {@link WebSearchClient}.
 *
 * <p>Blank queries are rejected with 400 before any retrieval runs; everything past validation
 * degrades to empty results rather than failing the request.
 */
@RestController
@RequestMapping("/api")
public class SearchController {

  static final int DEFAULT_WEB_SEARCH_RESULTS = 8;
  static final int MAX_WEB_SEARCH_RESULTS = 50;

  private final HybridSearchService searchService;
  private final WebSearchClient webSearchClient;
  private final Clock clock;

  public SearchController(
      HybridSearchService searchService, WebSearchClient webSearchClient, Clock clock) {
    this.searchService = searchService;
    this.webSearchClient = webSearchClient;
    this.clock = clock;
  }

  @PostMapping("/search")
  public HybridSearchResult search(@Valid @RequestBody HybridSearchRequest request) {
    return searchService.search(request.query(), request.config());
  }

  @PostMapping("/search/documents")
  public HybridSearchResult searchDocuments(@Valid @RequestBody ScopedSearchRequest request) {
    return request.maxResults() != null
        ? searchService.searchDocuments(request.query(), request.maxResults())
        : searchService.searchDocuments(request.query());
  }

  @PostMapping("/search/web")
  public HybridSearchResult searchWeb(@Valid @RequestBody ScopedSearchRequest request) {
    return request.maxResults() != null
        ? searchService.searchWeb(request.query(), request.maxResults())
        : searchService.searchWeb(request.query());
  }

  /** Query-string variant of the raw web search; news is opt-in here. */
  @GetMapping("/web-search")
  public WebSearchApiResponse webSearchByQuery(
      @RequestParam(required = false) @Nullable String query,
      @RequestParam(defaultValue = "false") boolean includeNews,
      @RequestParam(required = false) @Nullable String location,
      @RequestParam(defaultValue = "8") int maxResults) {
    if (query == null || query.isBlank()) {
      throw new IllegalArgumentException("Query parameter 'query' is required");
    }
    if (maxResults < 1 || maxResults > MAX_WEB_SEARCH_RESULTS) {
      throw new IllegalArgumentException(
          "Query parameter 'maxResults' must be between 1 and "
              + MAX_WEB_SEARCH_RESULTS
              + ", got: "
              + maxResults);
    }
    return WebSearchApiResponse.from(
        webSearchClient.searchWithFallback(
            query, new WebSearchOptions(includeNews, location, maxResults)));
  }

  @PostMapping("/web-search")
  public WebSearchApiResponse webSearch(@Valid @RequestBody WebSearchRequest request) {
    boolean includeNews = !Boolean.FALSE.equals(request.includeNews());
    int maxResults =
        request.maxResults() != null ? request.maxResults() : DEFAULT_WEB_SEARCH_RESULTS;
    return WebSearchApiResponse.from(
        webSearchClient.searchWithFallback(
            request.query(), new WebSearchOptions(includeNews, request.location(), maxResults)));
  }

  @GetMapping("/search/status")
  public SearchStatus status() {
    boolean configured = webSearchClient.isConfigured();
    ProbeResult probe = configured ? webSearchClient.probe() : null;
    return new SearchStatus(configured, probe, Instant.now(clock));
  }
}
