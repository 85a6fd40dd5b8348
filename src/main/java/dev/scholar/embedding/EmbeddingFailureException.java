package dev.scholar.embedding;

/** Raised when the embedding model cannot be created or fails to embed a text. */
public class EmbeddingFailureException extends RuntimeException {

  public EmbeddingFailureException(String message, Throwable cause) {
    super(message, cause);
  }
}
