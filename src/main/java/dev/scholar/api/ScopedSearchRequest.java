package dev.scholar.api;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import org.jspecify.annotations.Nullable;

/**
 * Body of the documents-only and web-only search endpoints.
 *
 * @param query the search text
 * @param maxResults result cap; the service default applies when null
 */
public record ScopedSearchRequest(
    @NotBlank String query,
    @Nullable @Min(1) @Max(50) Integer maxResults) {}
