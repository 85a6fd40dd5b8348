package dev.scholar.retrieval;

import dev.langchain4j.data.document.Metadata;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.store.embedding.EmbeddingMatch;
import dev.langchain4j.store.embedding.EmbeddingSearchRequest;
import dev.langchain4j.store.embedding.EmbeddingStore;
import dev.scholar.document.DocumentRecord;
import dev.scholar.embedding.EmbeddingProvider;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Dense retrieval: embeds the query and runs a similarity search against the pgvector store.
 *
 * <p>Document fields travel as segment metadata ({@code document_id}, {@code title}, {@code
 * created_at}); the segment text is the document content. When several embedded segments belong to
 * the same document only the best-scoring one is kept.
 *
 * <p>Any failure (embedding model, store transport, bad row) is logged and yields an empty list.
 */
@Service
public class DenseRetriever {

  private static final Logger log = LoggerFactory.getLogger(DenseRetriever.class);

  static final String DOCUMENT_ID = "document_id";
  static final String TITLE = "title";
  static final String CREATED_AT = "created_at";

  private final EmbeddingProvider embeddingProvider;
  private final EmbeddingStore<TextSegment> embeddingStore;

  public DenseRetriever(
      EmbeddingProvider embeddingProvider, EmbeddingStore<TextSegment> embeddingStore) {
    this.embeddingProvider = embeddingProvider;
    this.embeddingStore = embeddingStore;
  }

  /**
   * Finds the documents most similar to the query.
   *
   * @param query the search text
   * @param maxResults maximum number of results
   * @param threshold minimum similarity for a hit
   * @return results ordered by similarity descending, or empty on failure
   */
  public List<SearchResult> retrieve(String query, int maxResults, double threshold) {
    if (maxResults < 1) {
      return List.of();
    }
    try {
      Embedding queryEmbedding = embeddingProvider.embed(query);

      EmbeddingSearchRequest request =
          EmbeddingSearchRequest.builder()
              .queryEmbedding(queryEmbedding)
              .maxResults(maxResults)
              .minScore(threshold)
              .build();

      List<EmbeddingMatch<TextSegment>> matches = embeddingStore.search(request).matches();
      List<SearchResult> results = toResults(matches);
      log.debug("Dense retrieval returned {} documents for '{}'", results.size(), query);
      return results;
    } catch (RuntimeException e) {
      log.warn("Dense retrieval failed for '{}': {}", query, e.getMessage());
      return List.of();
    }
  }

  private List<SearchResult> toResults(List<EmbeddingMatch<TextSegment>> matches) {
    List<EmbeddingMatch<TextSegment>> sorted = new ArrayList<>(matches);
    sorted.sort((a, b) -> Double.compare(b.score(), a.score()));

    Set<String> seen = new HashSet<>();
    List<SearchResult> results = new ArrayList<>();
    for (EmbeddingMatch<TextSegment> match : sorted) {
      DocumentRecord document = toDocument(match);
      if (seen.add(document.id())) {
        results.add(SearchResult.of(document, match.score(), RetrievalKind.DENSE));
      }
    }
    return results;
  }

  private DocumentRecord toDocument(EmbeddingMatch<TextSegment> match) {
    TextSegment segment = match.embedded();
    Metadata metadata = segment.metadata();
    String id = Objects.requireNonNullElse(metadata.getString(DOCUMENT_ID), match.embeddingId());
    return new DocumentRecord(
        id,
        Objects.requireNonNullElse(metadata.getString(TITLE), ""),
        segment.text(),
        parseInstant(metadata.getString(CREATED_AT)));
  }

  private static @Nullable Instant parseInstant(@Nullable String value) {
    if (value == null || value.isBlank()) {
      return null;
    }
    try {
      return Instant.parse(value);
    } catch (DateTimeParseException e) {
      log.debug("Ignoring unparseable created_at '{}'", value);
      return null;
    }
  }
}
