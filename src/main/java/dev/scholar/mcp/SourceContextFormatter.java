package dev.scholar.mcp;

import dev.scholar.search.HybridSearchResult;
import dev.scholar.search.Source;
import dev.scholar.search.SourceKind;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Renders the sources of a {@link HybridSearchResult} as citation blocks for an LLM context,
 * within a token budget.
 *
 * <p>Tokens are estimated as characters / 4. Blocks are appended whole until the next one would
 * overflow the budget; a first block that alone exceeds it is cut at the character level so the
 * output is never empty while sources exist.
 */
@Component
public class SourceContextFormatter {

  static final String NO_SOURCES = "No relevant sources found.";
  static final String SEPARATOR = "\n\n---\n\n";

  private static final double CHARS_PER_TOKEN = 4.0;
  private static final double HIGH_CREDIBILITY = 0.8;
  private static final double MEDIUM_CREDIBILITY = 0.6;

  private final int tokenBudget;

  public SourceContextFormatter(@Value("${scholar.mcp.token-budget:5000}") int tokenBudget) {
    this.tokenBudget = tokenBudget;
  }

  /**
   * Formats the result's sources followed by a {@code Found N sources in T ms} footer.
   *
   * @param result the search result to render
   * @return citation blocks, or {@value #NO_SOURCES} when there are none
   */
  public String format(HybridSearchResult result) {
    if (result.sources().isEmpty()) {
      return NO_SOURCES;
    }

    StringBuilder output = new StringBuilder();
    int estimatedTokens = 0;
    int included = 0;

    for (Source source : result.sources()) {
      String block = (included == 0 ? "" : SEPARATOR) + formatSource(source);
      int blockTokens = estimateTokens(block);

      if (included == 0 && blockTokens > tokenBudget) {
        int maxChars = (int) (tokenBudget * CHARS_PER_TOKEN);
        output.append(block, 0, Math.min(maxChars, block.length()));
        included = 1;
        break;
      }
      if (estimatedTokens + blockTokens > tokenBudget) {
        break;
      }

      output.append(block);
      estimatedTokens += blockTokens;
      included++;
    }

    output
        .append("\n\nFound ")
        .append(included)
        .append(included == 1 ? " source" : " sources")
        .append(" in ")
        .append(result.searchTimeMs())
        .append(" ms");
    return output.toString();
  }

  public int getTokenBudget() {
    return tokenBudget;
  }

  int estimateTokens(String text) {
    return (int) Math.ceil(text.length() / CHARS_PER_TOKEN);
  }

  String formatSource(Source source) {
    StringBuilder block = new StringBuilder();
    block
        .append(source.citation())
        .append(' ')
        .append(typeLabel(source.kind()))
        .append(' ')
        .append(credibilityLabel(source.credibilityScore()))
        .append("\nTitle: ")
        .append(source.title());
    if (!source.url().equals("#document-" + source.id())) {
      block.append("\nURL: ").append(source.url());
    }
    block.append("\nContent: ").append(source.snippet());
    if (source.publishDate() != null) {
      block.append("\nPublished: ").append(source.publishDate());
    }
    return block.toString();
  }

  static String typeLabel(SourceKind kind) {
    return switch (kind) {
      case DOCUMENT -> "[DOCUMENT]";
      case NEWS -> "[NEWS]";
      case KNOWLEDGE_GRAPH -> "[KNOWLEDGE GRAPH]";
      case ANSWER_BOX -> "[FEATURED ANSWER]";
      case WEB -> "[WEB]";
    };
  }

  static String credibilityLabel(double credibility) {
    if (credibility > HIGH_CREDIBILITY) {
      return "[HIGH CREDIBILITY]";
    }
    if (credibility > MEDIUM_CREDIBILITY) {
      return "[MEDIUM CREDIBILITY]";
    }
    return "[LOW CREDIBILITY]";
  }
}
