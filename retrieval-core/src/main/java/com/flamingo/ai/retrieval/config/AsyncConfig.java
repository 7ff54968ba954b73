package com.flamingo.ai.retrieval.config;

import java.util.concurrent.Executor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/** Worker pools for retrieval and ingest. */
@Configuration
public class AsyncConfig {

  /** Embedding, vector index and reranker calls. */
  @Bean(name = "retrievalIoExecutor")
  public Executor retrievalIoExecutor() {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(8);
    executor.setMaxPoolSize(32);
    executor.setQueueCapacity(200);
    executor.setThreadNamePrefix("retrieval-io-");
    executor.initialize();
    return executor;
  }

  /** BM25 scoring is CPU-bound, so the pool is sized to the machine. */
  @Bean(name = "lexicalSearchExecutor")
  public Executor lexicalSearchExecutor() {
    int cores = Runtime.getRuntime().availableProcessors();
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(cores);
    executor.setMaxPoolSize(cores);
    executor.setQueueCapacity(500);
    executor.setThreadNamePrefix("lexical-");
    executor.initialize();
    return executor;
  }

  @Bean(name = "ingestExecutor")
  public Executor ingestExecutor(RagConfig ragConfig) {
    int concurrency = Math.max(1, ragConfig.getIngest().getMaxConcurrentDocuments());
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(concurrency);
    executor.setMaxPoolSize(concurrency);
    executor.setQueueCapacity(Math.max(1, ragConfig.getIngest().getBatchSize()) * 2);
    executor.setThreadNamePrefix("ingest-");
    executor.initialize();
    return executor;
  }
}
