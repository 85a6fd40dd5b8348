package dev.scholar.api;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import dev.scholar.config.GlobalExceptionHandler;
import dev.scholar.search.HybridSearchResult;
import dev.scholar.search.HybridSearchService;
import dev.scholar.search.MethodKind;
import dev.scholar.search.RetrievalMethod;
import dev.scholar.search.SearchConfigOverrides;
import dev.scholar.websearch.ProbeResult;
import dev.scholar.websearch.WebResultKind;
import dev.scholar.websearch.WebSearchClient;
import dev.scholar.websearch.WebSearchOptions;
import dev.scholar.websearch.WebSearchResponse;
import dev.scholar.websearch.WebSearchResult;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

@ExtendWith(MockitoExtension.class)
class SearchControllerTest {

  @Mock HybridSearchService searchService;

  @Mock WebSearchClient webSearchClient;

  @Captor ArgumentCaptor<SearchConfigOverrides> overridesCaptor;

  @Captor ArgumentCaptor<WebSearchOptions> optionsCaptor;

  private MockMvc mockMvc;

  @BeforeEach
  void setUp() {
    Clock clock = Clock.fixed(Instant.parse("2024-05-02T10:00:00Z"), ZoneOffset.UTC);
    mockMvc =
        MockMvcBuilders.standaloneSetup(
                new SearchController(searchService, webSearchClient, clock))
            .setControllerAdvice(new GlobalExceptionHandler())
            .build();
  }

  @Test
  void hybridSearchPassesConfigOverrides() throws Exception {
    given(searchService.search(eq("coral reefs"), any(SearchConfigOverrides.class)))
        .willReturn(HybridSearchResult.empty(4));

    mockMvc
        .perform(
            post("/api/search")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"query": "coral reefs",
                     "config": {"methods": [{"kind": "dense", "enabled": true, "weight": 0.7}],
                                "maxDocuments": 3}}
                    """))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.searchTimeMs").value(4))
        .andExpect(jsonPath("$.totalResults").value(0));

    verify(searchService).search(eq("coral reefs"), overridesCaptor.capture());
    SearchConfigOverrides overrides = overridesCaptor.getValue();
    assertThat(overrides.methods())
        .containsExactly(RetrievalMethod.enabled(MethodKind.DENSE, 0.7));
    assertThat(overrides.maxDocuments()).isEqualTo(3);
  }

  @Test
  void blankQueryIsBadRequest() throws Exception {
    mockMvc
        .perform(
            post("/api/search")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"query\": \" \"}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.detail").value(containsString("query")));

    verifyNoInteractions(searchService);
  }

  @Test
  void documentSearchUsesDefaultCountWhenUnset() throws Exception {
    given(searchService.searchDocuments("coral reefs")).willReturn(HybridSearchResult.empty(1));

    mockMvc
        .perform(
            post("/api/search/documents")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"query\": \"coral reefs\"}"))
        .andExpect(status().isOk());

    verify(searchService).searchDocuments("coral reefs");
  }

  @Test
  void webOnlySearchPassesCount() throws Exception {
    given(searchService.searchWeb("coral reefs", 4)).willReturn(HybridSearchResult.empty(1));

    mockMvc
        .perform(
            post("/api/search/web")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"query\": \"coral reefs\", \"maxResults\": 4}"))
        .andExpect(status().isOk());

    verify(searchService).searchWeb("coral reefs", 4);
  }

  @Test
  void rawWebSearchWrapsResponseWithSuccessFlag() throws Exception {
    var result =
        new WebSearchResult(
            "organic_0",
            "Reef health",
            "https://www.nature.com/reefs",
            "Coral reefs decline",
            "www.nature.com",
            WebResultKind.ORGANIC,
            0.9,
            0.8,
            null,
            null);
    given(webSearchClient.searchWithFallback(eq("coral reefs"), any(WebSearchOptions.class)))
        .willReturn(new WebSearchResponse(List.of(result), 42, 9, List.of("reef bleaching"), null));

    mockMvc
        .perform(
            post("/api/web-search")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"query\": \"coral reefs\"}"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.success").value(true))
        .andExpect(jsonPath("$.results[0].id").value("organic_0"))
        .andExpect(jsonPath("$.results[0].kind").value("organic"))
        .andExpect(jsonPath("$.totalResults").value(42))
        .andExpect(jsonPath("$.relatedQueries[0]").value("reef bleaching"))
        .andExpect(jsonPath("$.knowledgeGraph").doesNotExist());

    verify(webSearchClient).searchWithFallback(eq("coral reefs"), optionsCaptor.capture());
    assertThat(optionsCaptor.getValue())
        .isEqualTo(new WebSearchOptions(true, null, 8));
  }

  @Test
  void rawWebSearchByQueryStringLeavesNewsOff() throws Exception {
    given(webSearchClient.searchWithFallback(eq("coral"), any(WebSearchOptions.class)))
        .willReturn(WebSearchResponse.empty());

    mockMvc
        .perform(get("/api/web-search").param("query", "coral").param("location", "Sydney"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.success").value(true));

    verify(webSearchClient).searchWithFallback(eq("coral"), optionsCaptor.capture());
    assertThat(optionsCaptor.getValue())
        .isEqualTo(new WebSearchOptions(false, "Sydney", 8));
  }

  @Test
  void rawWebSearchByQueryStringRejectsOutOfRangeCount() throws Exception {
    mockMvc
        .perform(get("/api/web-search").param("query", "coral").param("maxResults", "-1"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.detail").value(containsString("maxResults")));
    mockMvc
        .perform(get("/api/web-search").param("query", "coral").param("maxResults", "51"))
        .andExpect(status().isBadRequest());

    verifyNoInteractions(webSearchClient);
  }

  @Test
  void rawWebSearchWithoutQueryIsBadRequest() throws Exception {
    mockMvc.perform(get("/api/web-search")).andExpect(status().isBadRequest());

    verifyNoInteractions(webSearchClient);
  }

  @Test
  void statusProbesOnlyWhenConfigured() throws Exception {
    given(webSearchClient.isConfigured()).willReturn(false);

    mockMvc
        .perform(get("/api/search/status"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.webSearchConfigured").value(false))
        .andExpect(jsonPath("$.probe").doesNotExist());

    verify(webSearchClient, never()).probe();
  }

  @Test
  void statusIncludesProbeOutcome() throws Exception {
    given(webSearchClient.isConfigured()).willReturn(true);
    given(webSearchClient.probe()).willReturn(new ProbeResult(true, null, 1));

    mockMvc
        .perform(get("/api/search/status"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.webSearchConfigured").value(true))
        .andExpect(jsonPath("$.probe.success").value(true))
        .andExpect(jsonPath("$.probe.resultsCount").value(1));
  }
}
