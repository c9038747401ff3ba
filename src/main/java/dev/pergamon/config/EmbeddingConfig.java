package dev.pergamon.config;

import dev.langchain4j.model.azure.AzureOpenAiEmbeddingModel;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.embedding.onnx.bgesmallenv15q.BgeSmallEnV15QuantizedEmbeddingModel;
import dev.langchain4j.model.openai.OpenAiEmbeddingModel;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configures the query {@link EmbeddingModel}.
 *
 * <p>The model must be the one the corpus was embedded with at ingestion time; mixing providers
 * makes vector distances meaningless. The default is the in-process ONNX bge-small-en-v1.5
 * quantized model (384 dimensions).
 */
@Configuration
@EnableConfigurationProperties(EmbeddingProperties.class)
public class EmbeddingConfig {

  private static final Logger log = LoggerFactory.getLogger(EmbeddingConfig.class);

  /**
   * Builds the embedding model for the configured provider.
   *
   * @throws IllegalStateException if a remote provider is selected without its credentials
   */
  @Bean
  public EmbeddingModel embeddingModel(EmbeddingProperties properties) {
    log.info("Embedding provider: {}", properties.getProvider());
    return switch (properties.getProvider()) {
      case LOCAL -> new BgeSmallEnV15QuantizedEmbeddingModel();
      case OPENAI -> openAi(properties);
      case AZURE -> azure(properties);
    };
  }

  private static EmbeddingModel openAi(EmbeddingProperties properties) {
    OpenAiEmbeddingModel.OpenAiEmbeddingModelBuilder builder =
        OpenAiEmbeddingModel.builder()
            .apiKey(require("api-key", properties.getApiKey()))
            .modelName(properties.getModelName());
    String endpoint = properties.getEndpoint();
    if (endpoint != null && !endpoint.isBlank()) {
      builder.baseUrl(endpoint);
    }
    return builder.build();
  }

  private static EmbeddingModel azure(EmbeddingProperties properties) {
    AzureOpenAiEmbeddingModel.Builder builder =
        AzureOpenAiEmbeddingModel.builder()
            .endpoint(require("endpoint", properties.getEndpoint()))
            .apiKey(require("api-key", properties.getApiKey()))
            .deploymentName(require("deployment-name", properties.getDeploymentName()));
    String serviceVersion = properties.getServiceVersion();
    if (serviceVersion != null && !serviceVersion.isBlank()) {
      builder.serviceVersion(serviceVersion);
    }
    return builder.build();
  }

  private static String require(String name, @Nullable String value) {
    if (value == null || value.isBlank()) {
      throw new IllegalStateException("pergamon.embedding." + name + " must be set");
    }
    return value;
  }
}
