package dev.scholar.retrieval;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

import dev.langchain4j.data.document.Metadata;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.store.embedding.EmbeddingMatch;
import dev.langchain4j.store.embedding.EmbeddingSearchRequest;
import dev.langchain4j.store.embedding.EmbeddingSearchResult;
import dev.langchain4j.store.embedding.EmbeddingStore;
import dev.scholar.embedding.EmbeddingFailureException;
import dev.scholar.embedding.EmbeddingProvider;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class DenseRetrieverTest {

  @Mock EmbeddingProvider embeddingProvider;

  @Mock EmbeddingStore<TextSegment> embeddingStore;

  @Captor ArgumentCaptor<EmbeddingSearchRequest> requestCaptor;

  private final Embedding queryEmbedding = Embedding.from(new float[] {0.1f, 0.2f, 0.3f});

  private DenseRetriever retriever;

  @BeforeEach
  void setUp() {
    retriever = new DenseRetriever(embeddingProvider, embeddingStore);
  }

  private static EmbeddingMatch<TextSegment> match(
      String embeddingId, String documentId, String title, String text, double score) {
    Metadata metadata =
        Metadata.from(
            Map.of(
                DenseRetriever.DOCUMENT_ID,
                documentId,
                DenseRetriever.TITLE,
                title,
                DenseRetriever.CREATED_AT,
                "2024-03-01T10:15:30Z"));
    return new EmbeddingMatch<>(score, embeddingId, null, TextSegment.from(text, metadata));
  }

  private void givenMatches(List<EmbeddingMatch<TextSegment>> matches) {
    given(embeddingProvider.embed("neural networks")).willReturn(queryEmbedding);
    given(embeddingStore.search(any(EmbeddingSearchRequest.class)))
        .willReturn(new EmbeddingSearchResult<>(matches));
  }

  @Test
  void passesThresholdAndCountToTheStore() {
    givenMatches(List.of());

    retriever.retrieve("neural networks", 7, 0.65);

    verify(embeddingStore).search(requestCaptor.capture());
    EmbeddingSearchRequest request = requestCaptor.getValue();
    assertThat(request.maxResults()).isEqualTo(7);
    assertThat(request.minScore()).isEqualTo(0.65);
    assertThat(request.queryEmbedding()).isEqualTo(queryEmbedding);
  }

  @Test
  void mapsSegmentMetadataToDocument() {
    givenMatches(List.of(match("e1", "doc-1", "Deep Learning", "Backpropagation explained", 0.82)));

    List<SearchResult> results = retriever.retrieve("neural networks", 5, 0.6);

    assertThat(results).hasSize(1);
    SearchResult result = results.get(0);
    assertThat(result.documentId()).isEqualTo("doc-1");
    assertThat(result.document().title()).isEqualTo("Deep Learning");
    assertThat(result.document().content()).isEqualTo("Backpropagation explained");
    assertThat(result.document().createdAt()).isEqualTo(Instant.parse("2024-03-01T10:15:30Z"));
    assertThat(result.similarity()).isEqualTo(0.82);
    assertThat(result.score()).isEqualTo(0.82);
    assertThat(result.kind()).isEqualTo(RetrievalKind.DENSE);
  }

  @Test
  void keepsBestSegmentPerDocumentInDescendingOrder() {
    givenMatches(
        List.of(
            match("e1", "doc-1", "A", "first chunk", 0.70),
            match("e2", "doc-2", "B", "other", 0.90),
            match("e3", "doc-1", "A", "second chunk", 0.80)));

    List<SearchResult> results = retriever.retrieve("neural networks", 5, 0.6);

    assertThat(results).extracting(SearchResult::documentId).containsExactly("doc-2", "doc-1");
    assertThat(results.get(1).similarity()).isEqualTo(0.80);
    assertThat(results.get(1).document().content()).isEqualTo("second chunk");
  }

  @Test
  void fallsBackToEmbeddingIdWhenDocumentIdIsMissing() {
    givenMatches(
        List.of(new EmbeddingMatch<>(0.75, "emb-9", null, TextSegment.from("orphan text"))));

    List<SearchResult> results = retriever.retrieve("neural networks", 5, 0.6);

    assertThat(results.get(0).documentId()).isEqualTo("emb-9");
    assertThat(results.get(0).document().title()).isEmpty();
    assertThat(results.get(0).document().createdAt()).isNull();
  }

  @Test
  void embeddingFailureYieldsEmptyList() {
    given(embeddingProvider.embed("neural networks"))
        .willThrow(new EmbeddingFailureException("model missing", new IllegalStateException()));

    assertThat(retriever.retrieve("neural networks", 5, 0.6)).isEmpty();
    verifyNoInteractions(embeddingStore);
  }

  @Test
  void storeFailureYieldsEmptyList() {
    given(embeddingProvider.embed("neural networks")).willReturn(queryEmbedding);
    given(embeddingStore.search(any(EmbeddingSearchRequest.class)))
        .willThrow(new RuntimeException("connection reset"));

    assertThat(retriever.retrieve("neural networks", 5, 0.6)).isEmpty();
  }

  @Test
  void nonPositiveMaxResultsSkipsEmbedding() {
    assertThat(retriever.retrieve("neural networks", 0, 0.6)).isEmpty();
    verifyNoInteractions(embeddingProvider, embeddingStore);
  }
}
