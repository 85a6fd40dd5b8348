package dev.scholar.websearch;

import com.fasterxml.jackson.annotation.JsonValue;

/** Result category reported by the search provider. */
public enum WebResultKind {
  ORGANIC("organic"),
  NEWS("news"),
  KNOWLEDGE_GRAPH("knowledge_graph"),
  ANSWER_BOX("answer_box");

  private final String value;

  WebResultKind(String value) {
    this.value = value;
  }

  @JsonValue
  public String value() {
    return value;
  }
}
