package dev.scholar.document;

import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

/** Spring Data repository for {@link Document} entities. */
public interface DocumentRepository extends JpaRepository<Document, UUID> {

  /**
   * Returns every stored document, newest first. Used as the corpus snapshot for sparse
   * retrieval.
   *
   * @return all documents ordered by {@code created_at} descending
   */
  List<Document> findAllByOrderByCreatedAtDesc();
}
