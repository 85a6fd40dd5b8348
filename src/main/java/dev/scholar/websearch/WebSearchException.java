package dev.scholar.websearch;

/**
 * Base class for web search failures. Callers that need to tell an unreachable provider apart from
 * one that answered with an error inspect {@link #kind()}.
 */
public abstract class WebSearchException extends RuntimeException {

  /** Broad failure category. */
  public enum FailureKind {
    /** The provider could not be reached or did not answer in time. */
    TRANSPORT,
    /** The provider answered, but with an error or a payload that does not fit the schema. */
    PROVIDER
  }

  protected WebSearchException(String message, Throwable cause) {
    super(message, cause);
  }

  protected WebSearchException(String message) {
    super(message);
  }

  public abstract FailureKind kind();
}
