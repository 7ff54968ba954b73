package com.flamingo.ai.retrieval.config;

import com.flamingo.ai.retrieval.service.rag.chunking.CharacterRatioTokenCounter;
import com.flamingo.ai.retrieval.service.rag.chunking.JTokkitTokenCounter;
import com.flamingo.ai.retrieval.service.rag.chunking.TokenCounter;
import com.flamingo.ai.retrieval.service.rag.embedding.CachingEmbeddingClient;
import com.flamingo.ai.retrieval.service.rag.embedding.CaffeineEmbeddingCacheStore;
import com.flamingo.ai.retrieval.service.rag.embedding.EmbeddingCacheStore;
import com.flamingo.ai.retrieval.service.rag.embedding.EmbeddingProvider;
import com.flamingo.ai.retrieval.service.rag.embedding.ProviderEmbeddingClient;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Wires the token counter and the cached embedding client. */
@Configuration
@Slf4j
public class EmbeddingConfig {

  @Bean
  public TokenCounter tokenCounter(RagConfig ragConfig) {
    RagConfig.Chunking chunking = ragConfig.getChunking();
    if ("ratio".equalsIgnoreCase(chunking.getTokenizer())) {
      return new CharacterRatioTokenCounter(chunking.getCharsPerToken());
    }
    return new JTokkitTokenCounter(chunking.getCharsPerToken());
  }

  @Bean
  public EmbeddingCacheStore embeddingCacheStore(RagConfig ragConfig) {
    return new CaffeineEmbeddingCacheStore(ragConfig.getEmbedding().getCacheMaxEntries());
  }

  @Bean
  public CachingEmbeddingClient embeddingClient(
      EmbeddingProvider embeddingProvider,
      EmbeddingCacheStore embeddingCacheStore,
      RagConfig ragConfig,
      MeterRegistry meterRegistry) {
    RagConfig.Embedding cfg = ragConfig.getEmbedding();
    Double price = cfg.getPricePerMillionTokens().get(cfg.getModel());
    if (price == null) {
      log.warn("No price configured for embedding model {}, reporting cost 0", cfg.getModel());
      price = 0.0;
    }
    ProviderEmbeddingClient providerClient =
        new ProviderEmbeddingClient(
            embeddingProvider,
            cfg.getModel(),
            cfg.dimensionsForModel(),
            cfg.getBatchSize(),
            price,
            meterRegistry);
    log.info(
        "Embedding client initialized: model={}, dimensions={}, batchSize={}, cacheTtl={}",
        cfg.getModel(),
        cfg.dimensionsForModel(),
        cfg.getBatchSize(),
        cfg.getCacheTtl());
    return new CachingEmbeddingClient(
        providerClient, embeddingCacheStore, cfg.getCacheTtl(), meterRegistry);
  }
}
