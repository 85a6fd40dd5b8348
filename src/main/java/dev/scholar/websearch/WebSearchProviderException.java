package dev.scholar.websearch;

import org.jspecify.annotations.Nullable;

/**
 * The search provider answered but the answer is unusable: an in-band error object, an HTTP error
 * status, or a body that does not match the expected schema.
 */
public class WebSearchProviderException extends WebSearchException {

  private final @Nullable Integer errorCode;

  public WebSearchProviderException(String message) {
    super(message);
    this.errorCode = null;
  }

  public WebSearchProviderException(String message, Throwable cause) {
    super(message, cause);
    this.errorCode = null;
  }

  public WebSearchProviderException(String message, @Nullable Integer errorCode) {
    super(message);
    this.errorCode = errorCode;
  }

  /** Provider-specific error code, when the provider sent one. */
  public @Nullable Integer errorCode() {
    return errorCode;
  }

  @Override
  public FailureKind kind() {
    return FailureKind.PROVIDER;
  }
}
