package dev.scholar.websearch;

import java.util.Locale;

/**
 * Query-term overlap heuristic for web results.
 *
 * <p>The lower-cased query is split on whitespace. Each term found in the title adds 0.4 and each
 * term found in the snippet adds 0.2. A coverage bonus of {@code hits / (terms * 2) * 0.4} is then
 * added and the total is clamped to [0, 1].
 */
public final class QueryRelevance {

  static final double TITLE_HIT = 0.4;
  static final double SNIPPET_HIT = 0.2;
  static final double COVERAGE_WEIGHT = 0.4;

  private QueryRelevance() {}

  /**
   * Scores how well a result's title and snippet cover the query terms.
   *
   * @param title result title (null treated as empty)
   * @param snippet result snippet (null treated as empty)
   * @param query the original query
   * @return relevance in [0, 1]; 0 for a blank query
   */
  public static double score(String title, String snippet, String query) {
    if (query == null || query.isBlank()) {
      return 0.0;
    }
    String[] terms = query.toLowerCase(Locale.ROOT).trim().split("\\s+");
    String lowerTitle = title == null ? "" : title.toLowerCase(Locale.ROOT);
    String lowerSnippet = snippet == null ? "" : snippet.toLowerCase(Locale.ROOT);

    double score = 0.0;
    int hits = 0;
    for (String term : terms) {
      if (lowerTitle.contains(term)) {
        score += TITLE_HIT;
        hits++;
      }
      if (lowerSnippet.contains(term)) {
        score += SNIPPET_HIT;
        hits++;
      }
    }

    double coverage = hits / (terms.length * 2.0);
    score += coverage * COVERAGE_WEIGHT;
    return Math.max(0.0, Math.min(score, 1.0));
  }
}
