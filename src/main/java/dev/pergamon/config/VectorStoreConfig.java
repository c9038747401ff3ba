package dev.pergamon.config;

import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.store.embedding.EmbeddingStore;
import dev.langchain4j.store.embedding.pgvector.PgVectorEmbeddingStore;
import javax.sql.DataSource;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configures the pgvector {@link EmbeddingStore} over the shared {@link DataSource}.
 *
 * <p>The table and its index belong to the ingestion pipeline, so {@code createTable} and {@code
 * useIndex} are disabled: this engine only reads.
 */
@Configuration
public class VectorStoreConfig {

  @Bean
  public EmbeddingStore<TextSegment> embeddingStore(
      DataSource dataSource,
      @Value("${pergamon.store.table:document_chunks}") String table,
      @Value("${pergamon.store.dimension:384}") int dimension) {
    return PgVectorEmbeddingStore.datasourceBuilder()
        .datasource(dataSource)
        .table(table)
        .dimension(dimension)
        .createTable(false)
        .useIndex(false)
        .build();
  }
}
