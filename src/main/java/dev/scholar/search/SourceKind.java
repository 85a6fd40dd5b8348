package dev.scholar.search;

import com.fasterxml.jackson.annotation.JsonValue;
import dev.scholar.websearch.WebResultKind;

/** Provenance of a {@link Source}. */
public enum SourceKind {
  DOCUMENT("document"),
  WEB("web"),
  NEWS("news"),
  KNOWLEDGE_GRAPH("knowledge_graph"),
  ANSWER_BOX("answer_box");

  private final String value;

  SourceKind(String value) {
    this.value = value;
  }

  @JsonValue
  public String value() {
    return value;
  }

  /** Maps a web result category; organic results become plain {@link #WEB} sources. */
  public static SourceKind from(WebResultKind kind) {
    return switch (kind) {
      case ORGANIC -> WEB;
      case NEWS -> NEWS;
      case KNOWLEDGE_GRAPH -> KNOWLEDGE_GRAPH;
      case ANSWER_BOX -> ANSWER_BOX;
    };
  }
}
