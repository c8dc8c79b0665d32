package com.flamingo.ai.arabicsearch.config;

import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.openai.OpenAiEmbeddingModel;
import java.time.Duration;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Lazy;

/**
 * Configuration for the LangChain4j embedding model.
 *
 * <p>Any OpenAI-compatible embeddings endpoint can be used through {@code base-url}, including a
 * locally served Arabic BERT model. The bean is lazy: it is created when the embedding provider
 * first loads it, so a missing key degrades semantic search instead of failing startup.
 */
@Configuration
public class LangChain4jConfig {

  @Value("${langchain4j.openai.api-key:}")
  private String openAiApiKey;

  @Value("${langchain4j.openai.base-url:https://api.openai.com/v1}")
  private String baseUrl;

  @Value("${langchain4j.openai.embedding-model.model-name:text-embedding-3-small}")
  private String embeddingModelName;

  /** 0 lets the model use its native dimensionality. */
  @Value("${langchain4j.openai.embedding-model.dimensions:0}")
  private int embeddingDimensions;

  @Value("${langchain4j.openai.embedding-model.timeout:30s}")
  private Duration timeout;

  @Bean
  @Lazy
  public EmbeddingModel embeddingModel() {
    validateApiKey();

    return OpenAiEmbeddingModel.builder()
        .baseUrl(baseUrl)
        .apiKey(openAiApiKey)
        .modelName(embeddingModelName)
        .dimensions(embeddingDimensions > 0 ? embeddingDimensions : null)
        .timeout(timeout)
        .logRequests(false)
        .logResponses(false)
        .build();
  }

  private void validateApiKey() {
    if (openAiApiKey == null || openAiApiKey.isBlank()) {
      throw new IllegalStateException(
          "Embedding API key is required. Set OPENAI_API_KEY environment variable.");
    }
  }
}
