package dev.scholar.search;

import java.util.List;
import java.util.Optional;
import org.jspecify.annotations.Nullable;

/**
 * Fully resolved, immutable configuration for one hybrid search.
 *
 * @param methods retrieval methods with their enablement and fusion weights
 * @param includeWeb whether web search may run at all
 * @param includeNews whether the web search adds a news query
 * @param maxDocuments cap on document results after fusion
 * @param maxWebResults cap on web results
 * @param similarityThreshold minimum dense similarity
 * @param location optional location hint for web search
 */
public record SearchConfig(
    List<RetrievalMethod> methods,
    boolean includeWeb,
    boolean includeNews,
    int maxDocuments,
    int maxWebResults,
    double similarityThreshold,
    @Nullable String location) {

  public SearchConfig {
    methods = methods == null ? List.of() : List.copyOf(methods);
    if (maxDocuments < 0) {
      throw new IllegalArgumentException("maxDocuments must not be negative");
    }
    if (maxWebResults < 0) {
      throw new IllegalArgumentException("maxWebResults must not be negative");
    }
  }

  /** First method entry of the given kind, if any. */
  public Optional<RetrievalMethod> method(MethodKind kind) {
    return methods.stream().filter(m -> m.kind() == kind).findFirst();
  }

  /** Whether a method of the given kind is present and enabled. */
  public boolean isEnabled(MethodKind kind) {
    return method(kind).map(RetrievalMethod::enabled).orElse(false);
  }

  /** The method's fusion weight, or {@code fallback} when absent or unset. */
  public double weightOr(MethodKind kind, double fallback) {
    return method(kind)
        .filter(RetrievalMethod::hasWeight)
        .map(RetrievalMethod::weight)
        .orElse(fallback);
  }

  /**
   * Returns a new configuration with the non-null overrides applied. This instance is unchanged.
   *
   * @param overrides caller-supplied partial values (null means none)
   * @return the merged configuration
   */
  public SearchConfig withOverrides(@Nullable SearchConfigOverrides overrides) {
    if (overrides == null) {
      return this;
    }
    return new SearchConfig(
        overrides.methods() != null ? overrides.methods() : methods,
        overrides.includeWeb() != null ? overrides.includeWeb() : includeWeb,
        overrides.includeNews() != null ? overrides.includeNews() : includeNews,
        overrides.maxDocuments() != null ? overrides.maxDocuments() : maxDocuments,
        overrides.maxWebResults() != null ? overrides.maxWebResults() : maxWebResults,
        overrides.similarityThreshold() != null
            ? overrides.similarityThreshold()
            : similarityThreshold,
        overrides.location() != null ? overrides.location() : location);
  }
}
