package dev.scholar.retrieval;

import dev.scholar.document.Document;
import dev.scholar.document.DocumentRecord;
import dev.scholar.document.DocumentRepository;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Sparse retrieval: fuzzy keyword matching of the query against document titles and content.
 *
 * <p>No index is kept between calls. Each call loads the current corpus (newest first) and builds
 * a fresh {@link FuzzyMatcher}, so newly ingested documents are searchable immediately. Title
 * matches weigh 0.7 and content matches 0.3; the matcher's lower-is-better score is turned into
 * a similarity as {@code 1 - score}.
 *
 * <p>Any failure is logged and yields an empty list.
 */
@Service
public class SparseRetriever {

  private static final Logger log = LoggerFactory.getLogger(SparseRetriever.class);

  static final double TITLE_WEIGHT = 0.7;
  static final double CONTENT_WEIGHT = 0.3;
  static final double MATCH_THRESHOLD = 0.4;
  static final int MIN_MATCH_CHAR_LENGTH = 2;

  private static final List<FuzzyMatcher.Field<DocumentRecord>> FIELDS =
      List.of(
          new FuzzyMatcher.Field<>("title", TITLE_WEIGHT, DocumentRecord::title),
          new FuzzyMatcher.Field<>("content", CONTENT_WEIGHT, DocumentRecord::content));

  private final DocumentRepository documentRepository;

  public SparseRetriever(DocumentRepository documentRepository) {
    this.documentRepository = documentRepository;
  }

  /**
   * Finds the documents whose title or content fuzzily matches the query.
   *
   * @param query the search text
   * @param maxResults maximum number of results
   * @return results ordered by similarity descending, or empty on failure
   */
  public List<SearchResult> retrieve(String query, int maxResults) {
    if (maxResults < 1) {
      return List.of();
    }
    try {
      List<DocumentRecord> corpus =
          documentRepository.findAllByOrderByCreatedAtDesc().stream()
              .map(Document::toRecord)
              .toList();

      FuzzyMatcher<DocumentRecord> matcher =
          new FuzzyMatcher<>(FIELDS, MATCH_THRESHOLD, MIN_MATCH_CHAR_LENGTH);

      List<SearchResult> results =
          matcher.search(corpus, query, maxResults).stream()
              .map(m -> SearchResult.of(m.item(), 1.0 - m.score(), RetrievalKind.SPARSE))
              .toList();
      log.debug(
          "Sparse retrieval matched {} of {} documents for '{}'",
          results.size(),
          corpus.size(),
          query);
      return results;
    } catch (RuntimeException e) {
      log.warn("Sparse retrieval failed for '{}': {}", query, e.getMessage());
      return List.of();
    }
  }
}
