package dev.scholar.embedding;

import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.model.embedding.EmbeddingModel;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Process-wide holder of the embedding model, created lazily on the first {@link #embed} call.
 *
 * <p>Loading the ONNX model is expensive, so it is deferred until a query actually needs an
 * embedding and then reused for the lifetime of the process. Concurrent first callers block on a
 * lock so the factory runs at most once per successful initialization. A factory failure leaves the
 * holder empty and the next caller tries again. There is no reload path.
 *
 * <p>Every failure, whether during model creation or inference, surfaces as {@link
 * EmbeddingFailureException}.
 */
public class EmbeddingProvider {

  private static final Logger log = LoggerFactory.getLogger(EmbeddingProvider.class);

  private final Supplier<EmbeddingModel> modelFactory;
  private final ReentrantLock initLock = new ReentrantLock();
  private volatile @Nullable EmbeddingModel model;

  public EmbeddingProvider(Supplier<EmbeddingModel> modelFactory) {
    this.modelFactory = modelFactory;
  }

  /**
   * Embeds the given text, initializing the model on first use.
   *
   * @param text the text to embed
   * @return the embedding vector
   * @throws EmbeddingFailureException if the model cannot be created or inference fails
   */
  public Embedding embed(String text) {
    EmbeddingModel embeddingModel = model();
    try {
      return embeddingModel.embed(text).content();
    } catch (RuntimeException e) {
      throw new EmbeddingFailureException("Failed to generate embedding", e);
    }
  }

  /** Whether the model has been created yet. */
  public boolean isInitialized() {
    return model != null;
  }

  private EmbeddingModel model() {
    EmbeddingModel current = model;
    if (current != null) {
      return current;
    }
    initLock.lock();
    try {
      current = model;
      if (current == null) {
        long start = System.nanoTime();
        try {
          current = modelFactory.get();
        } catch (RuntimeException e) {
          throw new EmbeddingFailureException("Failed to initialize embedding model", e);
        }
        model = current;
        log.info(
            "Embedding model {} initialized in {} ms",
            current.getClass().getSimpleName(),
            (System.nanoTime() - start) / 1_000_000);
      }
      return current;
    } finally {
      initLock.unlock();
    }
  }
}
