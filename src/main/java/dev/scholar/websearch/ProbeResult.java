package dev.scholar.websearch;

import org.jspecify.annotations.Nullable;

/**
 * Outcome of a connectivity probe against the search provider.
 *
 * @param success whether the provider answered without error
 * @param error failure message, when it did not
 * @param resultsCount number of organic results returned by the probe query
 */
public record ProbeResult(boolean success, @Nullable String error, int resultsCount) {}
