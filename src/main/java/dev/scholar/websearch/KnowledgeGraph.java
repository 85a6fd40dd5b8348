package dev.scholar.websearch;

import org.jspecify.annotations.Nullable;

/** Knowledge graph panel returned alongside the primary web results. */
public record KnowledgeGraph(
    @Nullable String title,
    @Nullable String description,
    @Nullable String website,
    @Nullable String type) {}
