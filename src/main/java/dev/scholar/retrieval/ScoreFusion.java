package dev.scholar.retrieval;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Pure static utility that fuses dense and sparse document results by weighted score addition.
 *
 * <p>Every dense hit enters with {@code similarity * denseWeight}. A sparse hit for a document
 * already present adds {@code similarity * sparseWeight} to it; otherwise it enters with that value
 * alone. Scores are neither averaged, capped nor renormalised, so the sum can exceed 1.0 when both
 * weights are large.
 *
 * <p>Ties keep insertion order (dense hits first, in their incoming order) because the final sort
 * is stable.
 */
public final class ScoreFusion {

  private ScoreFusion() {}

  /**
   * Fuses two ranked lists into one list of {@link RetrievalKind#HYBRID} results.
   *
   * @param dense results from vector similarity search
   * @param sparse results from fuzzy keyword matching
   * @param denseWeight multiplier for dense similarities
   * @param sparseWeight multiplier for sparse similarities
   * @return fused results sorted by score descending, one entry per document id
   */
  public static List<SearchResult> combine(
      List<SearchResult> dense,
      List<SearchResult> sparse,
      double denseWeight,
      double sparseWeight) {
    Map<String, SearchResult> fused = new LinkedHashMap<>();

    for (SearchResult d : dense) {
      fused.put(d.documentId(), d.withScore(d.similarity() * denseWeight, RetrievalKind.HYBRID));
    }

    for (SearchResult s : sparse) {
      double contribution = s.similarity() * sparseWeight;
      SearchResult existing = fused.get(s.documentId());
      if (existing != null) {
        fused.put(
            s.documentId(),
            existing.withScore(existing.score() + contribution, RetrievalKind.HYBRID));
      } else {
        fused.put(s.documentId(), s.withScore(contribution, RetrievalKind.HYBRID));
      }
    }

    List<SearchResult> ranked = new ArrayList<>(fused.values());
    ranked.sort(Comparator.comparingDouble(SearchResult::score).reversed());
    return ranked;
  }
}
