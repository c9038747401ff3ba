package dev.pergamon;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Entry point for the Pergamon retrieval engine.
 *
 * <p>Wires the hybrid search pipeline against the pgvector-backed {@code document_chunks} table.
 * The engine is consumed in-process through {@link dev.pergamon.search.SearchService}.
 */
@SpringBootApplication
public class PergamonApplication {
  public static void main(String[] args) {
    SpringApplication.run(PergamonApplication.class, args);
  }
}
