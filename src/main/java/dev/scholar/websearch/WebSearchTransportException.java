package dev.scholar.websearch;

/** The search provider was unreachable: connection refused, DNS failure or timeout. */
public class WebSearchTransportException extends WebSearchException {

  public WebSearchTransportException(String message, Throwable cause) {
    super(message, cause);
  }

  @Override
  public FailureKind kind() {
    return FailureKind.TRANSPORT;
  }
}
