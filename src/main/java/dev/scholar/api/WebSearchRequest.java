package dev.scholar.api;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import org.jspecify.annotations.Nullable;

/**
 * Body of {@code POST /api/web-search}. News is included unless {@code includeNews} is false.
 */
public record WebSearchRequest(
    @NotBlank String query,
    @Nullable Boolean includeNews,
    @Nullable String location,
    @Nullable @Min(1) @Max(50) Integer maxResults) {}
