package dev.scholar.retrieval;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import dev.scholar.document.DocumentRecord;
import java.util.List;
import org.junit.jupiter.api.Test;

class ScoreFusionTest {

  private static SearchResult dense(String id, double similarity) {
    return SearchResult.of(doc(id), similarity, RetrievalKind.DENSE);
  }

  private static SearchResult sparse(String id, double similarity) {
    return SearchResult.of(doc(id), similarity, RetrievalKind.SPARSE);
  }

  private static DocumentRecord doc(String id) {
    return new DocumentRecord(id, "Title " + id, "content " + id, null);
  }

  @Test
  void overlappingDocumentsAddTheirWeightedScores() {
    List<SearchResult> fused =
        ScoreFusion.combine(
            List.of(dense("A", 0.9), dense("B", 0.7)),
            List.of(sparse("B", 0.8), sparse("C", 0.6)),
            0.6,
            0.4);

    assertThat(fused).extracting(SearchResult::documentId).containsExactly("B", "A", "C");
    assertThat(fused.get(0).score()).isCloseTo(0.74, within(1e-9));
    assertThat(fused.get(1).score()).isCloseTo(0.54, within(1e-9));
    assertThat(fused.get(2).score()).isCloseTo(0.24, within(1e-9));
  }

  @Test
  void everyFusedResultIsHybrid() {
    List<SearchResult> fused =
        ScoreFusion.combine(List.of(dense("A", 0.9)), List.of(sparse("C", 0.6)), 0.6, 0.4);

    assertThat(fused).allSatisfy(r -> assertThat(r.kind()).isEqualTo(RetrievalKind.HYBRID));
  }

  @Test
  void scoresAreNotCappedAtOne() {
    List<SearchResult> fused =
        ScoreFusion.combine(List.of(dense("A", 0.9)), List.of(sparse("A", 0.8)), 1.0, 1.0);

    assertThat(fused).hasSize(1);
    assertThat(fused.get(0).score()).isCloseTo(1.7, within(1e-9));
  }

  @Test
  void tiesKeepDenseInsertionOrderFirst() {
    List<SearchResult> fused =
        ScoreFusion.combine(
            List.of(dense("A", 0.5), dense("B", 0.5)), List.of(sparse("C", 0.5)), 1.0, 1.0);

    assertThat(fused).extracting(SearchResult::documentId).containsExactly("A", "B", "C");
  }

  @Test
  void keepsRawSimilarityAlongsideFusedScore() {
    List<SearchResult> fused = ScoreFusion.combine(List.of(dense("A", 0.9)), List.of(), 0.5, 0.5);

    assertThat(fused.get(0).similarity()).isEqualTo(0.9);
    assertThat(fused.get(0).score()).isCloseTo(0.45, within(1e-9));
  }

  @Test
  void emptyInputsFuseToEmpty() {
    assertThat(ScoreFusion.combine(List.of(), List.of(), 0.6, 0.4)).isEmpty();
  }
}
