package com.flamingo.ai.retrieval.config;

import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.openai.OpenAiEmbeddingModel;
import java.time.Duration;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Configuration for the LangChain4j embedding model behind the embedding provider. */
@Configuration
@Slf4j
public class LangChain4jConfig {

  @Value("${langchain4j.openai.api-key:}")
  private String openAiApiKey;

  @Value("${langchain4j.openai.base-url:}")
  private String baseUrl;

  @Value("${langchain4j.openai.timeout:30s}")
  private Duration timeout;

  /**
   * OpenAI embedding model named and sized by {@code rag.embedding}, so the collection dimension
   * and the model output always agree. Retries are left to the provider's Resilience4j policy.
   */
  @Bean
  public EmbeddingModel embeddingModel(RagConfig ragConfig) {
    if (openAiApiKey == null || openAiApiKey.isBlank()) {
      throw new IllegalStateException(
          "OpenAI API key is required. Set OPENAI_API_KEY environment variable.");
    }
    RagConfig.Embedding embedding = ragConfig.getEmbedding();

    OpenAiEmbeddingModel.OpenAiEmbeddingModelBuilder builder =
        OpenAiEmbeddingModel.builder()
            .apiKey(openAiApiKey)
            .modelName(embedding.getModel())
            .dimensions(embedding.dimensionsForModel())
            .timeout(timeout)
            .maxRetries(0);
    if (baseUrl != null && !baseUrl.isBlank()) {
      builder.baseUrl(baseUrl);
    }
    log.info(
        "OpenAI embedding model configured: model={}, dimensions={}",
        embedding.getModel(),
        embedding.dimensionsForModel());
    return builder.build();
  }
}
