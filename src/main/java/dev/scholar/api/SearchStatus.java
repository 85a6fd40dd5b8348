package dev.scholar.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import dev.scholar.websearch.ProbeResult;
import java.time.Instant;
import org.jspecify.annotations.Nullable;

/**
 * Reply of {@code GET /api/search/status}.
 *
 * @param webSearchConfigured whether a provider access key is set
 * @param probe outcome of a live one-result query; absent when not configured
 * @param timestamp when the status was taken
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SearchStatus(
    boolean webSearchConfigured, @Nullable ProbeResult probe, Instant timestamp) {}
