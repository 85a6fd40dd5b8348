package dev.scholar.search;

import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Caller-supplied partial {@link SearchConfig}. Null fields keep the default; a non-null {@code
 * methods} list replaces the default list as a whole.
 */
public record SearchConfigOverrides(
    @Nullable List<RetrievalMethod> methods,
    @Nullable Boolean includeWeb,
    @Nullable Boolean includeNews,
    @Nullable Integer maxDocuments,
    @Nullable Integer maxWebResults,
    @Nullable Double similarityThreshold,
    @Nullable String location) {

  private static final SearchConfigOverrides NONE =
      new SearchConfigOverrides(null, null, null, null, null, null, null);

  /** Overrides that change nothing. */
  public static SearchConfigOverrides none() {
    return NONE;
  }
}
