package dev.pergamon.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.pergamon.search.SearchConfig;
import dev.pergamon.search.SearchProperties;
import dev.pergamon.search.query.DomainLexicon;
import java.io.IOException;
import java.io.InputStream;
import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.Resource;

/** Wires the search pipeline's shared collaborators: tuning, lexicon, clock and worker pool. */
@Configuration
@EnableConfigurationProperties(SearchProperties.class)
public class SearchEngineConfig {

  private static final Logger log = LoggerFactory.getLogger(SearchEngineConfig.class);

  @Bean
  @ConditionalOnMissingBean
  public Clock clock() {
    return Clock.systemDefaultZone();
  }

  @Bean
  public SearchConfig searchConfig(SearchProperties properties) {
    return properties.toSearchConfig();
  }

  /**
   * Loads the domain lexicon.
   *
   * @throws IllegalStateException if the lexicon resource is missing or malformed
   */
  @Bean
  public DomainLexicon domainLexicon(
      @Value("${pergamon.lexicon.location:classpath:lexicon/domain-lexicon.json}")
          Resource location,
      ObjectMapper objectMapper) {
    try (InputStream in = location.getInputStream()) {
      DomainLexicon lexicon = DomainLexicon.fromJson(objectMapper, in);
      log.info(
          "Loaded domain lexicon from {}: {} domains, {} synonym entries",
          location.getDescription(),
          lexicon.domainKeywordCount(),
          lexicon.synonymCount());
      return lexicon;
    } catch (IOException e) {
      throw new IllegalStateException(
          "Failed to load domain lexicon from " + location.getDescription(), e);
    }
  }

  /** Fixed pool of daemon threads running the concurrent sub-searches. */
  @Bean(destroyMethod = "shutdownNow")
  public ExecutorService subSearchExecutor(SearchProperties properties) {
    AtomicInteger counter = new AtomicInteger();
    ThreadFactory threadFactory =
        runnable -> {
          Thread thread = new Thread(runnable, "sub-search-" + counter.incrementAndGet());
          thread.setDaemon(true);
          return thread;
        };
    return Executors.newFixedThreadPool(properties.getSubSearchThreads(), threadFactory);
  }
}
