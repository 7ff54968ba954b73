package com.flamingo.ai.retrieval.config;

import com.flamingo.ai.retrieval.service.rag.RetrievalPipeline;
import io.micrometer.core.aop.TimedAspect;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.MeterBinder;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.actuate.autoconfigure.metrics.MeterRegistryCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Configuration for retrieval metrics. */
@Configuration
public class MetricsConfig {

  /**
   * Enables the @Timed annotation on embedding, index and reranker adapters.
   *
   * @param registry the meter registry
   * @return the timed aspect bean
   */
  @Bean
  public TimedAspect timedAspect(MeterRegistry registry) {
    return new TimedAspect(registry);
  }

  /** Tags every meter with the application and the vector backend in use. */
  @Bean
  public MeterRegistryCustomizer<MeterRegistry> retrievalCommonTags(
      @Value("${spring.application.name:retrieval-core}") String application,
      RagConfig ragConfig) {
    String backend = ragConfig.getIndex().getBackend();
    return registry ->
        registry.config().commonTags("application", application, "index_backend", backend);
  }

  /** Gauges over pipeline-wide totals, read on each scrape. */
  @Bean
  public MeterBinder retrievalGauges(RetrievalPipeline retrievalPipeline) {
    return registry -> {
      Gauge.builder(
              "rag.index.chunks", retrievalPipeline, p -> p.stats().indexedChunkCount())
          .description("Chunks in the lexical index of the configured collection")
          .register(registry);
      Gauge.builder(
              "embedding.cache.hit_rate", retrievalPipeline, p -> p.stats().cacheHitRate())
          .description("Embedding cache hits over requests")
          .register(registry);
      Gauge.builder(
              "embedding.cost.total", retrievalPipeline, p -> p.stats().totalEmbeddingCost())
          .description("Cumulative embedding cost in dollars")
          .register(registry);
    };
  }
}
