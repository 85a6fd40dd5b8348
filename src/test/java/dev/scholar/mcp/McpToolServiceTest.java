package dev.scholar.mcp;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

import dev.scholar.search.HybridSearchResult;
import dev.scholar.search.HybridSearchService;
import dev.scholar.search.SearchConfigOverrides;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class McpToolServiceTest {

  @Mock HybridSearchService searchService;

  @Captor ArgumentCaptor<SearchConfigOverrides> overridesCaptor;

  private McpToolService toolService;

  @BeforeEach
  void setUp() {
    toolService = new McpToolService(searchService, new SourceContextFormatter(5000));
  }

  private static HybridSearchResult oneDocument() {
    return new HybridSearchResult(
        List.of(),
        List.of(),
        0.4,
        List.of(SourceContextFormatterTest.documentSource("d1", "Findings")),
        15,
        1);
  }

  @Test
  void hybridSearchFormatsSources() {
    given(searchService.search(eq("ocean acidification"), any(SearchConfigOverrides.class)))
        .willReturn(oneDocument());

    String output = toolService.hybridSearch("ocean acidification", null, null, null, null);

    assertThat(output).startsWith("[1] Thesis d1 [DOCUMENT]");
    assertThat(output).endsWith("Found 1 source in 15 ms");
  }

  @Test
  void hybridSearchPassesClampedOverrides() {
    given(searchService.search(eq("ocean acidification"), any(SearchConfigOverrides.class)))
        .willReturn(HybridSearchResult.empty(1));

    toolService.hybridSearch("ocean acidification", 500, 3, false, null);

    verify(searchService).search(eq("ocean acidification"), overridesCaptor.capture());
    SearchConfigOverrides overrides = overridesCaptor.getValue();
    assertThat(overrides.methods()).isNull();
    assertThat(overrides.maxDocuments()).isEqualTo(50);
    assertThat(overrides.maxWebResults()).isEqualTo(3);
    assertThat(overrides.includeWeb()).isFalse();
    assertThat(overrides.includeNews()).isNull();
  }

  @Test
  void blankQueryIsRejectedWithoutSearching() {
    assertThat(toolService.hybridSearch("  ", null, null, null, null))
        .isEqualTo(McpToolService.EMPTY_QUERY_ERROR);
    assertThat(toolService.searchDocuments(null, 5)).isEqualTo(McpToolService.EMPTY_QUERY_ERROR);
    assertThat(toolService.searchWeb("", 5)).isEqualTo(McpToolService.EMPTY_QUERY_ERROR);
    verifyNoInteractions(searchService);
  }

  @Test
  void searchDocumentsUsesDefaultCountWhenUnset() {
    given(searchService.searchDocuments("ocean")).willReturn(HybridSearchResult.empty(2));

    assertThat(toolService.searchDocuments("ocean", null)).isEqualTo("No relevant sources found.");
  }

  @Test
  void searchDocumentsClampsCount() {
    given(searchService.searchDocuments("ocean", 1)).willReturn(oneDocument());

    assertThat(toolService.searchDocuments("ocean", -4)).contains("Thesis d1");
  }

  @Test
  void searchWebClampsCount() {
    given(searchService.searchWeb("ocean", 50)).willReturn(HybridSearchResult.empty(2));

    toolService.searchWeb("ocean", 1000);

    verify(searchService).searchWeb("ocean", 50);
  }

  @Test
  void searchWebUsesDefaultCountWhenUnset() {
    given(searchService.searchWeb("ocean")).willReturn(HybridSearchResult.empty(2));

    toolService.searchWeb("ocean", null);

    verify(searchService).searchWeb("ocean");
  }

  @Test
  void unexpectedFailureIsReturnedAsErrorString() {
    given(searchService.searchWeb("ocean")).willThrow(new IllegalStateException("executor down"));

    assertThat(toolService.searchWeb("ocean", null))
        .isEqualTo("Error searching the web: executor down");
  }
}
