package com.flamingo.ai.textbookrag.config;

import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.openai.OpenAiEmbeddingModel;
import java.time.Duration;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Embedding model used for chunks and queries. Retries are left to the Resilience4j {@code
 * embedding} instance, so the client itself does not retry.
 */
@Slf4j
@Configuration
public class LangChain4jConfig {

  @Value("${langchain4j.openai.api-key:}")
  private String apiKey;

  @Value("${langchain4j.openai.base-url:https://api.openai.com/v1}")
  private String baseUrl;

  @Value("${langchain4j.openai.embedding-model.model-name:text-embedding-3-small}")
  private String modelName;

  @Value("${langchain4j.openai.embedding-model.dimensions:1024}")
  private int dimensions;

  @Value("${langchain4j.openai.embedding-model.timeout-seconds:30}")
  private long timeoutSeconds;

  @Bean
  public EmbeddingModel embeddingModel() {
    if (apiKey == null || apiKey.isBlank()) {
      throw new IllegalStateException(
          "OpenAI API key is required for embeddings. Set OPENAI_API_KEY.");
    }
    log.info("Embedding model {} ({} dimensions) at {}", modelName, dimensions, baseUrl);
    return OpenAiEmbeddingModel.builder()
        .apiKey(apiKey)
        .baseUrl(baseUrl)
        .modelName(modelName)
        .dimensions(dimensions)
        .timeout(Duration.ofSeconds(timeoutSeconds))
        .maxRetries(0)
        .build();
  }
}
