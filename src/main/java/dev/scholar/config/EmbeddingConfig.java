package dev.scholar.config;

import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.onnx.bgesmallenv15q.BgeSmallEnV15QuantizedEmbeddingModel;
import dev.langchain4j.store.embedding.EmbeddingStore;
import dev.langchain4j.store.embedding.pgvector.PgVectorEmbeddingStore;
import dev.scholar.embedding.EmbeddingProvider;
import javax.sql.DataSource;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configures the embedding provider and the vector store.
 *
 * <p>The ONNX bge-small-en-v1.5 quantized model (384 dimensions) runs in-process. It is handed to
 * {@link EmbeddingProvider} as a factory so the model is only loaded when the first query needs an
 * embedding. The {@link PgVectorEmbeddingStore} shares the application's HikariCP {@link
 * DataSource}.
 *
 * @see dev.scholar.retrieval.DenseRetriever
 */
@Configuration
public class EmbeddingConfig {

  /** Embedding dimension of bge-small-en-v1.5. */
  static final int DIMENSION = 384;

  /**
   * Provides the lazily initialized embedding provider.
   *
   * @return a provider that builds the ONNX model on first use
   */
  @Bean
  public EmbeddingProvider embeddingProvider() {
    return new EmbeddingProvider(BgeSmallEnV15QuantizedEmbeddingModel::new);
  }

  /**
   * Configures the pgvector embedding store.
   *
   * <p>Schema and HNSW index are managed by Flyway; {@code createTable} and {@code useIndex} are
   * disabled to avoid conflicts.
   *
   * @param dataSource the shared HikariCP data source
   * @param table the embeddings table name
   * @return a similarity-search store backed by pgvector
   */
  @Bean
  public EmbeddingStore<TextSegment> embeddingStore(
      DataSource dataSource,
      @Value("${scholar.vector-store.table:document_embeddings}") String table) {
    return PgVectorEmbeddingStore.datasourceBuilder()
        .datasource(dataSource)
        .table(table)
        .dimension(DIMENSION)
        .createTable(false)
        .useIndex(false)
        .build();
  }
}
