package dev.scholar.search;

import dev.scholar.retrieval.DenseRetriever;
import dev.scholar.retrieval.ScoreFusion;
import dev.scholar.retrieval.SearchResult;
import dev.scholar.retrieval.SparseRetriever;
import dev.scholar.websearch.WebSearchClient;
import dev.scholar.websearch.WebSearchOptions;
import dev.scholar.websearch.WebSearchResult;
import java.time.Clock;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;
import java.util.stream.Stream;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Hybrid search orchestrator: runs dense, sparse and web retrieval concurrently, fuses the document
 * hits, and assembles citation-numbered sources.
 *
 * <p>Pipeline: merge caller overrides onto defaults -> dispatch every enabled strategy on the
 * retrieval executor -> wait for all of them (a failed or timed-out strategy contributes nothing,
 * its siblings are unaffected) -> fuse dense + sparse when both ran -> truncate -> build sources.
 *
 * <p>Failures degrade, they never propagate. Each retriever already swallows its own errors; the
 * per-branch handler here catches anything that still escapes, and a final catch around the whole
 * pipeline turns any other fault into an empty {@link HybridSearchResult} with measured timing.
 */
@Service
public class HybridSearchService {

  private static final Logger log = LoggerFactory.getLogger(HybridSearchService.class);

  /** Fusion weights used when the dense/sparse method entry carries no weight of its own. */
  static final double FALLBACK_DENSE_WEIGHT = 0.6;

  static final double FALLBACK_SPARSE_WEIGHT = 0.4;

  static final int DEFAULT_DOCUMENT_RESULTS = 5;
  static final int DEFAULT_WEB_RESULTS = 8;

  private final DenseRetriever denseRetriever;
  private final SparseRetriever sparseRetriever;
  private final WebSearchClient webSearchClient;
  private final SearchProperties properties;
  private final Executor retrievalExecutor;
  private final Clock clock;

  public HybridSearchService(
      DenseRetriever denseRetriever,
      SparseRetriever sparseRetriever,
      WebSearchClient webSearchClient,
      SearchProperties properties,
      @Qualifier("retrievalExecutor") Executor retrievalExecutor,
      Clock clock) {
    this.denseRetriever = denseRetriever;
    this.sparseRetriever = sparseRetriever;
    this.webSearchClient = webSearchClient;
    this.properties = properties;
    this.retrievalExecutor = retrievalExecutor;
    this.clock = clock;
  }

  /**
   * Runs a hybrid search. Never throws.
   *
   * @param query the search text
   * @param overrides partial configuration laid over the defaults (null for none)
   * @return fused document and web hits with their sources; empty if the search failed
   */
  public HybridSearchResult search(String query, @Nullable SearchConfigOverrides overrides) {
    long start = clock.millis();
    try {
      SearchConfig config = properties.toDefaultConfig().withOverrides(overrides);

      boolean denseEnabled = config.isEnabled(MethodKind.DENSE);
      boolean sparseEnabled = config.isEnabled(MethodKind.SPARSE);
      boolean webEnabled = config.isEnabled(MethodKind.WEB_ONLY) && config.includeWeb();

      CompletableFuture<List<SearchResult>> dense =
          denseEnabled
              ? branch(
                  "dense",
                  query,
                  () ->
                      denseRetriever.retrieve(
                          query, config.maxDocuments(), config.similarityThreshold()))
              : CompletableFuture.completedFuture(List.of());
      CompletableFuture<List<SearchResult>> sparse =
          sparseEnabled
              ? branch(
                  "sparse", query, () -> sparseRetriever.retrieve(query, config.maxDocuments()))
              : CompletableFuture.completedFuture(List.of());
      CompletableFuture<List<WebSearchResult>> web =
          webEnabled
              ? branch(
                  "web",
                  query,
                  () ->
                      webSearchClient
                          .searchWithFallback(
                              query,
                              new WebSearchOptions(
                                  config.includeNews(), config.location(), config.maxWebResults()))
                          .results())
              : CompletableFuture.completedFuture(List.of());

      CompletableFuture.allOf(dense, sparse, web).join();

      List<SearchResult> documentResults;
      if (denseEnabled && sparseEnabled) {
        documentResults =
            ScoreFusion.combine(
                dense.join(),
                sparse.join(),
                config.weightOr(MethodKind.DENSE, FALLBACK_DENSE_WEIGHT),
                config.weightOr(MethodKind.SPARSE, FALLBACK_SPARSE_WEIGHT));
      } else if (denseEnabled) {
        documentResults = dense.join();
      } else if (sparseEnabled) {
        documentResults = sparse.join();
      } else {
        documentResults = List.of();
      }

      documentResults = limit(documentResults, config.maxDocuments());
      List<WebSearchResult> webResults = limit(web.join(), config.maxWebResults());

      double meanDocumentScore =
          documentResults.stream().mapToDouble(SearchResult::score).average().orElse(0.0);
      double meanWebScore =
          webResults.stream().mapToDouble(WebSearchResult::relevanceScore).average().orElse(0.0);
      double combinedScore = (meanDocumentScore + meanWebScore) / 2;

      List<Source> documentSources = SourceAssembler.documentsToSources(documentResults);
      List<Source> webSources =
          SourceAssembler.webResultsToSources(webResults, documentSources.size());
      List<Source> sources =
          Stream.concat(documentSources.stream(), webSources.stream()).toList();

      long elapsed = clock.millis() - start;
      log.debug(
          "Hybrid search for '{}' returned {} documents and {} web results in {} ms",
          query,
          documentResults.size(),
          webResults.size(),
          elapsed);

      return new HybridSearchResult(
          documentResults,
          webResults,
          combinedScore,
          sources,
          elapsed,
          documentResults.size() + webResults.size());
    } catch (RuntimeException e) {
      log.error("Hybrid search failed for '{}'", query, e);
      return HybridSearchResult.empty(clock.millis() - start);
    }
  }

  /** Runs a hybrid search with default configuration. */
  public HybridSearchResult search(String query) {
    return search(query, null);
  }

  /**
   * Searches stored documents only: dense and sparse fused at 0.6 / 0.4, web disabled.
   *
   * @param query the search text
   * @param maxResults maximum number of document results
   * @return document hits with their sources
   */
  public HybridSearchResult searchDocuments(String query, int maxResults) {
    return search(
        query,
        new SearchConfigOverrides(
            List.of(
                RetrievalMethod.enabled(MethodKind.DENSE, 0.6),
                RetrievalMethod.enabled(MethodKind.SPARSE, 0.4)),
            false,
            null,
            maxResults,
            0,
            null,
            null));
  }

  public HybridSearchResult searchDocuments(String query) {
    return searchDocuments(query, DEFAULT_DOCUMENT_RESULTS);
  }

  /**
   * Searches the web only (news included), documents disabled.
   *
   * @param query the search text
   * @param maxResults maximum number of web results
   * @return web hits with their sources
   */
  public HybridSearchResult searchWeb(String query, int maxResults) {
    return search(
        query,
        new SearchConfigOverrides(
            List.of(RetrievalMethod.enabled(MethodKind.WEB_ONLY, 1.0)),
            true,
            true,
            0,
            maxResults,
            null,
            null));
  }

  public HybridSearchResult searchWeb(String query) {
    return searchWeb(query, DEFAULT_WEB_RESULTS);
  }

  private <T> CompletableFuture<List<T>> branch(
      String strategy, String query, Supplier<List<T>> task) {
    CompletableFuture<List<T>> future;
    try {
      future = CompletableFuture.supplyAsync(task, retrievalExecutor);
    } catch (RejectedExecutionException e) {
      log.warn(
          "{} retrieval rejected by executor for '{}', contributing no results: {}",
          strategy,
          query,
          e.getMessage());
      return CompletableFuture.completedFuture(List.of());
    }
    return future
        .orTimeout(properties.strategyTimeout().toMillis(), TimeUnit.MILLISECONDS)
        .exceptionally(
            e -> {
              Throwable cause =
                  e instanceof CompletionException && e.getCause() != null ? e.getCause() : e;
              if (cause instanceof TimeoutException) {
                log.warn(
                    "{} retrieval timed out after {} ms for '{}', contributing no results",
                    strategy,
                    properties.strategyTimeout().toMillis(),
                    query);
              } else {
                log.warn(
                    "{} retrieval failed for '{}', contributing no results: {}",
                    strategy,
                    query,
                    cause.toString());
              }
              return List.of();
            });
  }

  private static <T> List<T> limit(List<T> results, int max) {
    return results.size() > max ? List.copyOf(results.subList(0, max)) : results;
  }
}
