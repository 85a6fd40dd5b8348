package dev.scholar.search;

import dev.scholar.document.DocumentRecord;
import dev.scholar.retrieval.SearchResult;
import dev.scholar.websearch.WebSearchResult;
import java.util.ArrayList;
import java.util.List;

/**
 * Pure static utility that turns ranked document and web hits into citation-numbered {@link
 * Source}s.
 *
 * <p>Citation numbers are 1-based positions. Web sources continue from {@code startIndex} so a
 * document list of size n followed by web sources yields labels 1..n, n+1.., without gaps.
 */
public final class SourceAssembler {

  static final String LOCAL_DOMAIN = "local-documents";
  static final double DOCUMENT_CREDIBILITY = 0.8;
  static final int SNIPPET_LENGTH = 300;
  static final String ELLIPSIS = "...";

  private SourceAssembler() {}

  /**
   * Builds sources for fused document results, numbered from 1.
   *
   * @param results document results in rank order
   * @return one source per result
   */
  public static List<Source> documentsToSources(List<SearchResult> results) {
    List<Source> sources = new ArrayList<>(results.size());
    for (int i = 0; i < results.size(); i++) {
      SearchResult result = results.get(i);
      DocumentRecord document = result.document();
      sources.add(
          new Source(
              document.id(),
              document.title(),
              "#document-" + document.id(),
              snippet(document.content()),
              LOCAL_DOMAIN,
              SourceKind.DOCUMENT,
              DOCUMENT_CREDIBILITY,
              result.score(),
              null,
              "[" + (i + 1) + "] " + document.title()));
    }
    return sources;
  }

  /**
   * Builds sources for web results, numbered from {@code startIndex + 1}.
   *
   * @param results web results in rank order
   * @param startIndex number of citations already assigned
   * @return one source per result
   */
  public static List<Source> webResultsToSources(List<WebSearchResult> results, int startIndex) {
    List<Source> sources = new ArrayList<>(results.size());
    for (int i = 0; i < results.size(); i++) {
      WebSearchResult result = results.get(i);
      sources.add(
          new Source(
              result.id(),
              result.title(),
              result.url(),
              result.snippet(),
              result.domain(),
              SourceKind.from(result.kind()),
              result.credibilityScore(),
              result.relevanceScore(),
              result.publishDate(),
              "[" + (startIndex + i + 1) + "] " + result.title() + " - " + result.domain()));
    }
    return sources;
  }

  private static String snippet(String content) {
    return content.substring(0, Math.min(SNIPPET_LENGTH, content.length())) + ELLIPSIS;
  }
}
