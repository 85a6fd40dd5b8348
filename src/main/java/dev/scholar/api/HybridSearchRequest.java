package dev.scholar.api;

import dev.scholar.search.SearchConfigOverrides;
import jakarta.validation.constraints.NotBlank;
import org.jspecify.annotations.Nullable;

/**
 * Body of {@code POST /api/search}.
 *
 * @param query the search text
 * @param config partial configuration laid over the service defaults
 */
public record HybridSearchRequest(
    @NotBlank String query,
    @Nullable SearchConfigOverrides config) {}
