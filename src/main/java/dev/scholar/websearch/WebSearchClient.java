package dev.scholar.websearch;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.util.UriComponentsBuilder;

/**
 * Client for the Serpstack web search API.
 *
 * <p>Each query variant (web, and optionally news) is one HTTP GET bounded by the configured
 * timeout and never retried. The JSON body is parsed into {@link SerpstackResponse}; an in-band
 * error object or a result that lacks a usable URL or title fails with {@link
 * WebSearchProviderException}, while an unreachable provider fails with {@link
 * WebSearchTransportException}.
 *
 * <p>Organic, news and answer-box results are scored with {@link DomainCredibility} and {@link
 * QueryRelevance}, merged, and ordered by {@link WebSearchResult#rankingScore()}.
 */
@Service
public class WebSearchClient {

  private static final Logger log = LoggerFactory.getLogger(WebSearchClient.class);

  static final int NEWS_REQUEST_COUNT = 3;
  static final int MAX_RELATED_QUERIES = 5;
  static final String FEATURED_ANSWER_TITLE = "Featured Answer";
  static final String PROBE_QUERY = "test";

  enum QueryType {
    WEB("web"),
    NEWS("news");

    private final String value;

    QueryType(String value) {
      this.value = value;
    }
  }

  private final RestClient restClient;
  private final ObjectMapper objectMapper;
  private final WebSearchProperties properties;
  private final Clock clock;

  public WebSearchClient(
      @Qualifier("webSearchRestClient") RestClient restClient,
      ObjectMapper objectMapper,
      WebSearchProperties properties,
      Clock clock) {
    this.restClient = restClient;
    this.objectMapper = objectMapper;
    this.properties = properties;
    this.clock = clock;
  }

  /** Whether an access key is configured; without one every search fails fast. */
  public boolean isConfigured() {
    return properties.hasAccessKey();
  }

  /**
   * Runs a web search and, if requested, a secondary news search.
   *
   * <p>A failing news search is logged and ignored; the web results are still returned.
   *
   * @param query the search text
   * @param options news inclusion, location and result cap
   * @return scored results, best first, with provider metadata
   * @throws WebSearchException if the primary web search fails
   */
  public WebSearchResponse search(String query, WebSearchOptions options) {
    long start = clock.millis();

    SerpstackResponse webData =
        request(query, QueryType.WEB, options.location(), options.requestCount());
    List<WebSearchResult> results = new ArrayList<>(toResults(webData, query));

    if (options.includeNews()) {
      try {
        SerpstackResponse newsData =
            request(query, QueryType.NEWS, options.location(), NEWS_REQUEST_COUNT);
        results.addAll(toResults(newsData, query));
      } catch (WebSearchException e) {
        log.warn("News search failed ({}) for '{}': {}", e.kind(), query, e.getMessage());
      }
    }

    results.sort(Comparator.comparingDouble(WebSearchResult::rankingScore).reversed());
    int limit = options.resultLimit();
    List<WebSearchResult> limited =
        results.size() > limit ? List.copyOf(results.subList(0, limit)) : results;

    List<String> relatedQueries =
        webData.relatedSearches().stream()
            .map(SerpstackResponse.RelatedSearch::label)
            .filter(Objects::nonNull)
            .limit(MAX_RELATED_QUERIES)
            .toList();

    return new WebSearchResponse(
        limited,
        webData.totalResults(),
        clock.millis() - start,
        relatedQueries,
        toKnowledgeGraph(webData.knowledgeGraph()));
  }

  /**
   * Same as {@link #search} but never throws: any failure is logged and answered with {@link
   * WebSearchResponse#empty()}.
   *
   * @param query the search text
   * @param options news inclusion, location and result cap
   * @return the search response, or the canonical empty response on failure
   */
  public WebSearchResponse searchWithFallback(String query, WebSearchOptions options) {
    try {
      return search(query, options);
    } catch (RuntimeException e) {
      log.error("Web search failed for '{}', returning empty results: {}", query, e.getMessage());
      return WebSearchResponse.empty();
    }
  }

  /**
   * Sends a one-result web query to check that the provider is reachable and accepts the key.
   *
   * @return the probe outcome; never throws
   */
  public ProbeResult probe() {
    try {
      SerpstackResponse data = request(PROBE_QUERY, QueryType.WEB, null, 1);
      return new ProbeResult(true, null, data.organicResults().size());
    } catch (WebSearchException e) {
      log.warn("Web search probe failed ({}): {}", e.kind(), e.getMessage());
      return new ProbeResult(false, e.getMessage(), 0);
    }
  }

  SerpstackResponse request(
      String query, QueryType type, @Nullable String location, int count) {
    if (!properties.hasAccessKey()) {
      throw new WebSearchProviderException("Web search access key is not configured");
    }

    String body;
    try {
      body =
          restClient
              .get()
              .uri(
                  builder -> {
                    Map<String, Object> vars = new HashMap<>();
                    vars.put("accessKey", properties.accessKey());
                    vars.put("query", query);
                    builder
                        .path("/search")
                        .queryParam("access_key", "{accessKey}")
                        .queryParam("query", "{query}")
                        .queryParam("type", type.value)
                        .queryParam("num", count)
                        .queryParam("gl", properties.gl())
                        .queryParam("hl", properties.hl())
                        .queryParam("safe", 0);
                    if (location != null && !location.isBlank()) {
                      builder.queryParam("location", "{location}");
                      vars.put("location", location);
                    }
                    return builder.build(vars);
                  })
              .retrieve()
              .body(String.class);
    } catch (ResourceAccessException e) {
      throw new WebSearchTransportException(
          "Web search provider unreachable: " + e.getMessage(), e);
    } catch (RestClientResponseException e) {
      throw new WebSearchProviderException(
          "Web search provider returned HTTP " + e.getStatusCode().value(), e);
    } catch (RestClientException e) {
      throw new WebSearchProviderException("Web search request failed: " + e.getMessage(), e);
    }

    SerpstackResponse response = parse(body);
    if (response.isError()) {
      SerpstackResponse.Error error = response.error();
      Integer code = error != null ? error.code() : null;
      String info = error != null && error.info() != null ? error.info() : "unknown error";
      throw new WebSearchProviderException("Serpstack API error: " + info, code);
    }
    return response;
  }

  private SerpstackResponse parse(@Nullable String body) {
    if (body == null || body.isBlank()) {
      throw new WebSearchProviderException("Web search provider returned an empty body");
    }
    try {
      return objectMapper.readValue(body, SerpstackResponse.class);
    } catch (JsonProcessingException e) {
      throw new WebSearchProviderException(
          "Web search provider returned malformed JSON: " + e.getOriginalMessage(), e);
    }
  }

  List<WebSearchResult> toResults(SerpstackResponse data, String query) {
    List<WebSearchResult> results = new ArrayList<>();

    List<SerpstackResponse.OrganicResult> organic = data.organicResults();
    for (int i = 0; i < organic.size(); i++) {
      SerpstackResponse.OrganicResult r = organic.get(i);
      String url = require(r.url(), "organic", i, "url");
      String title = require(r.title(), "organic", i, "title");
      String snippet = Objects.requireNonNullElse(r.snippet(), "");
      String domain = hostOf(url);
      results.add(
          new WebSearchResult(
              "organic_" + i,
              title,
              url,
              snippet,
              domain,
              WebResultKind.ORGANIC,
              DomainCredibility.score(domain, false),
              QueryRelevance.score(title, snippet, query),
              null,
              null));
    }

    List<SerpstackResponse.NewsResult> news = data.newsResults();
    for (int i = 0; i < news.size(); i++) {
      SerpstackResponse.NewsResult r = news.get(i);
      String url = require(r.url(), "news", i, "url");
      String title = require(r.title(), "news", i, "title");
      String snippet = Objects.requireNonNullElse(r.snippet(), "");
      String domain = hostOf(url);
      results.add(
          new WebSearchResult(
              "news_" + i,
              title,
              url,
              snippet,
              domain,
              WebResultKind.NEWS,
              DomainCredibility.score(domain, false),
              QueryRelevance.score(title, snippet, query),
              r.uploadedUtc(),
              r.sourceName()));
    }

    if (data.answerBox() != null) {
      List<SerpstackResponse.FeaturedSnippet> snippets = data.answerBox().featuredSnippets();
      for (int i = 0; i < snippets.size(); i++) {
        SerpstackResponse.FeaturedSnippet s = snippets.get(i);
        String url = require(s.link(), "answer_box", i, "link");
        String domain = hostOf(url);
        results.add(
            new WebSearchResult(
                "answer_" + i,
                Objects.requireNonNullElse(s.linkTitle(), FEATURED_ANSWER_TITLE),
                url,
                s.text(),
                domain,
                WebResultKind.ANSWER_BOX,
                DomainCredibility.score(domain, true),
                1.0,
                null,
                null));
      }
    }

    results.sort(Comparator.comparingDouble(WebSearchResult::rankingScore).reversed());
    return results;
  }

  private static String require(@Nullable String value, String category, int index, String field) {
    if (value == null || value.isBlank()) {
      throw new WebSearchProviderException(
          "Web search provider returned " + category + " result " + index + " without " + field);
    }
    return value;
  }

  /**
   * Extracts the host the way browsers do, so hosts such as {@code my_lab.example.com} that
   * {@link java.net.URI} rejects are still accepted.
   */
  static String hostOf(String url) {
    String host;
    try {
      host =
          UriComponentsBuilder.fromUriString(url.trim(), UriComponentsBuilder.ParserType.WHAT_WG)
              .build()
              .getHost();
    } catch (IllegalArgumentException e) {
      throw new WebSearchProviderException("Web search provider returned invalid URL: " + url, e);
    }
    if (host == null || host.isBlank()) {
      throw new WebSearchProviderException("Web search provider returned URL without host: " + url);
    }
    return host;
  }

  private static @Nullable KnowledgeGraph toKnowledgeGraph(
      SerpstackResponse.@Nullable KnowledgeGraphPanel panel) {
    if (panel == null) {
      return null;
    }
    return new KnowledgeGraph(panel.title(), panel.description(), panel.website(), panel.type());
  }
}
