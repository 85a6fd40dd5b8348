package dev.scholar.retrieval;

import dev.scholar.document.DocumentRecord;

/**
 * A document hit from one retrieval strategy, or from fusing several.
 *
 * @param document the matched document
 * @param similarity the strategy's raw similarity in [0, 1]
 * @param score the ranking score; equals {@code similarity} until fusion re-weights it
 * @param kind the strategy that produced this result
 */
public record SearchResult(
    DocumentRecord document, double similarity, double score, RetrievalKind kind) {

  /** Creates an unfused result whose score is its similarity. */
  public static SearchResult of(DocumentRecord document, double similarity, RetrievalKind kind) {
    return new SearchResult(document, similarity, similarity, kind);
  }

  public String documentId() {
    return document.id();
  }

  SearchResult withScore(double newScore, RetrievalKind newKind) {
    return new SearchResult(document, similarity, newScore, newKind);
  }
}
