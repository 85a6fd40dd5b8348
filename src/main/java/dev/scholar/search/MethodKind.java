package dev.scholar.search;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/** Retrieval method that a {@link RetrievalMethod} entry switches on or off. */
public enum MethodKind {
  DENSE("dense"),
  SPARSE("sparse"),
  WEB_ONLY("web_only"),
  HYBRID("hybrid"),
  DOCUMENTS_ONLY("documents_only");

  private final String value;

  MethodKind(String value) {
    this.value = value;
  }

  @JsonValue
  public String value() {
    return value;
  }

  @JsonCreator
  public static MethodKind fromValue(String value) {
    for (MethodKind kind : values()) {
      if (kind.value.equalsIgnoreCase(value)) {
        return kind;
      }
    }
    throw new IllegalArgumentException("Invalid retrieval method: " + value);
  }
}
