package dev.scholar.document;

import java.time.Instant;
import org.jspecify.annotations.Nullable;

/**
 * Read-only snapshot of a stored document as seen by retrieval.
 *
 * @param id stable unique document key
 * @param title document title
 * @param content full extracted text
 * @param createdAt ingestion timestamp (null when the vector store row carries none)
 */
public record DocumentRecord(
    String id, String title, String content, @Nullable Instant createdAt) {

  public DocumentRecord {
    if (id == null || id.isBlank()) {
      throw new IllegalArgumentException("Document id must not be blank");
    }
    title = title == null ? "" : title;
    content = content == null ? "" : content;
  }
}
