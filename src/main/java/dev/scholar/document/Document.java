package dev.scholar.document;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;

/**
 * A stored document available for retrieval.
 *
 * <p>Documents are written by the ingestion pipeline; retrieval only reads them. The embedding
 * vector lives in the pgvector {@code document_embeddings} table managed by LangChain4j's {@code
 * PgVectorEmbeddingStore} and is not mapped here.
 *
 * <p>Maps to the {@code documents} table managed by Flyway migrations.
 *
 * @see DocumentRepository
 */
@Entity
@Table(name = "documents")
public class Document {

  @Id private UUID id;

  @Column(nullable = false, columnDefinition = "TEXT")
  private String title;

  @Column(nullable = false, columnDefinition = "TEXT")
  private String content;

  @Column(name = "file_type")
  private String fileType;

  @Column(name = "file_size")
  private Long fileSize;

  @Column(name = "page_count")
  private Integer pageCount;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  protected Document() {
    // JPA requires no-arg constructor
  }

  public Document(UUID id, String title, String content) {
    this.id = id;
    this.title = title;
    this.content = content;
  }

  @PrePersist
  protected void onCreate() {
    if (createdAt == null) {
      createdAt = Instant.now();
    }
  }

  /** Returns a detached, immutable view of this document for the retrieval pipeline. */
  public DocumentRecord toRecord() {
    return new DocumentRecord(id.toString(), title, content, createdAt);
  }

  public UUID getId() {
    return id;
  }

  public String getTitle() {
    return title;
  }

  public String getContent() {
    return content;
  }

  public String getFileType() {
    return fileType;
  }

  public void setFileType(String fileType) {
    this.fileType = fileType;
  }

  public Long getFileSize() {
    return fileSize;
  }

  public void setFileSize(Long fileSize) {
    this.fileSize = fileSize;
  }

  public Integer getPageCount() {
    return pageCount;
  }

  public void setPageCount(Integer pageCount) {
    this.pageCount = pageCount;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public void setCreatedAt(Instant createdAt) {
    this.createdAt = createdAt;
  }
}
