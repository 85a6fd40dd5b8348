package dev.scholar.websearch;

import java.util.List;
import java.util.Locale;

/**
 * Domain-reputation heuristic for web results.
 *
 * <p>Structured provider answers (knowledge graph, featured snippets) score 0.95. Otherwise the
 * host is checked against static high and medium reputation lists by substring, then by
 * top-level suffix ({@code .edu}, {@code .gov}, {@code .org}); anything else gets 0.5.
 */
public final class DomainCredibility {

  static final double STRUCTURED_ANSWER = 0.95;
  static final double HIGH = 0.9;
  static final double EDU = 0.85;
  static final double GOV = 0.8;
  static final double MEDIUM = 0.75;
  static final double ORG = 0.7;
  static final double UNKNOWN = 0.5;

  private static final List<String> HIGH_REPUTATION =
      List.of(
          "wikipedia.org",
          "britannica.com",
          "reuters.com",
          "bbc.com",
          "apnews.com",
          "nature.com",
          "science.org",
          "pubmed.ncbi.nlm.nih.gov",
          "arxiv.org",
          "jstor.org",
          "scholar.google.com");

  private static final List<String> MEDIUM_REPUTATION =
      List.of(
          "cnn.com",
          "nytimes.com",
          "washingtonpost.com",
          "theguardian.com",
          "wsj.com",
          "techcrunch.com",
          "wired.com",
          "scientificamerican.com");

  private DomainCredibility() {}

  /**
   * Scores a result's host.
   *
   * @param domain the result host name
   * @param structuredAnswer whether the result came from a knowledge graph or answer box
   * @return credibility in [0, 1]
   */
  public static double score(String domain, boolean structuredAnswer) {
    if (structuredAnswer) {
      return STRUCTURED_ANSWER;
    }
    String host = domain == null ? "" : domain.toLowerCase(Locale.ROOT);
    if (HIGH_REPUTATION.stream().anyMatch(host::contains)) {
      return HIGH;
    }
    if (MEDIUM_REPUTATION.stream().anyMatch(host::contains)) {
      return MEDIUM;
    }
    if (host.contains(".edu")) {
      return EDU;
    }
    if (host.contains(".gov")) {
      return GOV;
    }
    if (host.contains(".org")) {
      return ORG;
    }
    return UNKNOWN;
  }
}
