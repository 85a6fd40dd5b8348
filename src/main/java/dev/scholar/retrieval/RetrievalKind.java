package dev.scholar.retrieval;

import com.fasterxml.jackson.annotation.JsonValue;

/** Which document retrieval strategy produced a {@link SearchResult}. */
public enum RetrievalKind {
  DENSE("dense"),
  SPARSE("sparse"),
  HYBRID("hybrid");

  private final String value;

  RetrievalKind(String value) {
    this.value = value;
  }

  @JsonValue
  public String value() {
    return value;
  }
}
