package dev.pergamon.config;

import org.jspecify.annotations.Nullable;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Embedding provider settings bound from {@code pergamon.embedding.*}.
 *
 * <p>{@code local} runs bge-small-en-v1.5 in-process and needs nothing else. {@code openai} needs
 * {@code api-key}; {@code azure} needs {@code api-key}, {@code endpoint} and {@code
 * deployment-name}.
 */
@ConfigurationProperties(prefix = "pergamon.embedding")
public class EmbeddingProperties {

  /** Supported embedding back ends. */
  public enum Provider {
    LOCAL,
    OPENAI,
    AZURE
  }

  private Provider provider = Provider.LOCAL;
  private @Nullable String apiKey;
  private @Nullable String endpoint;
  private String modelName = "text-embedding-3-small";
  private @Nullable String deploymentName;
  private @Nullable String serviceVersion;

  public Provider getProvider() {
    return provider;
  }

  public void setProvider(Provider provider) {
    this.provider = provider;
  }

  public @Nullable String getApiKey() {
    return apiKey;
  }

  public void setApiKey(@Nullable String apiKey) {
    this.apiKey = apiKey;
  }

  public @Nullable String getEndpoint() {
    return endpoint;
  }

  public void setEndpoint(@Nullable String endpoint) {
    this.endpoint = endpoint;
  }

  public String getModelName() {
    return modelName;
  }

  public void setModelName(String modelName) {
    this.modelName = modelName;
  }

  public @Nullable String getDeploymentName() {
    return deploymentName;
  }

  public void setDeploymentName(@Nullable String deploymentName) {
    this.deploymentName = deploymentName;
  }

  public @Nullable String getServiceVersion() {
    return serviceVersion;
  }

  public void setServiceVersion(@Nullable String serviceVersion) {
    this.serviceVersion = serviceVersion;
  }
}
