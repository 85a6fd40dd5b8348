package dev.scholar.search;

import org.jspecify.annotations.Nullable;

/**
 * A citable source, projected from either a document hit or a web hit.
 *
 * @param id document id or web result id
 * @param title display title
 * @param url result URL, or a {@code #document-<id>} anchor for local documents
 * @param snippet excerpt shown to the reader
 * @param domain host name, or {@value SourceAssembler#LOCAL_DOMAIN} for local documents
 * @param kind provenance
 * @param credibilityScore trust heuristic in [0, 1]
 * @param relevanceScore fused document score or web relevance
 * @param publishDate publication date, when known
 * @param citation label such as {@code [3] Title - example.com}
 */
public record Source(
    String id,
    String title,
    String url,
    String snippet,
    String domain,
    SourceKind kind,
    double credibilityScore,
    double relevanceScore,
    @Nullable String publishDate,
    String citation) {}
