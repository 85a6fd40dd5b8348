package dev.scholar.search;

import org.jspecify.annotations.Nullable;

/**
 * One entry of a {@link SearchConfig} method list.
 *
 * @param kind the retrieval method
 * @param enabled whether the method runs
 * @param weight fusion weight; null or 0 means unset and the orchestrator's fallback applies
 */
public record RetrievalMethod(MethodKind kind, boolean enabled, @Nullable Double weight) {

  public RetrievalMethod {
    if (kind == null) {
      throw new IllegalArgumentException("Retrieval method kind must not be null");
    }
  }

  public static RetrievalMethod enabled(MethodKind kind, double weight) {
    return new RetrievalMethod(kind, true, weight);
  }

  public static RetrievalMethod disabled(MethodKind kind) {
    return new RetrievalMethod(kind, false, null);
  }

  boolean hasWeight() {
    return weight != null && weight != 0.0;
  }
}
