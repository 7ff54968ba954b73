package com.flamingo.ai.retrieval.service.rag.embedding;

import com.flamingo.ai.retrieval.exception.ProviderUnavailableException;
import com.flamingo.ai.retrieval.service.rag.chunking.TokenCounter;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import dev.langchain4j.model.output.TokenUsage;
import io.github.resilience4j.ratelimiter.annotation.RateLimiter;
import io.github.resilience4j.retry.annotation.Retry;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/** Embedding provider backed by a LangChain4j {@link EmbeddingModel} (OpenAI by default). */
@Component
@RequiredArgsConstructor
@Slf4j
public class LangChain4jEmbeddingProvider implements EmbeddingProvider {

  private final EmbeddingModel embeddingModel;
  private final TokenCounter tokenCounter;
  private final MeterRegistry meterRegistry;

  @Override
  @Timed(value = "embedding.provider", description = "Time for one embedding provider call")
  @RateLimiter(name = "embedding")
  @Retry(name = "embedding")
  public ProviderBatch embed(String model, List<String> texts) {
    log.debug("Calling embedding model {} for {} texts", model, texts.size());
    List<TextSegment> segments = texts.stream().map(TextSegment::from).toList();

    Response<List<Embedding>> response;
    try {
      response = embeddingModel.embedAll(segments);
    } catch (RuntimeException e) {
      meterRegistry.counter("embedding.requests.failure", "model", model).increment();
      throw new ProviderUnavailableException(
          "embedding", "Embedding call failed for " + texts.size() + " texts", e);
    }

    List<Embedding> embeddings = response == null ? null : response.content();
    if (embeddings == null || embeddings.size() != texts.size()) {
      meterRegistry.counter("embedding.requests.failure", "model", model).increment();
      throw new ProviderUnavailableException(
          "embedding",
          String.format(
              "Embedding model returned %d vectors for %d texts",
              embeddings == null ? 0 : embeddings.size(), texts.size()));
    }

    List<float[]> vectors = new ArrayList<>(embeddings.size());
    for (Embedding embedding : embeddings) {
      vectors.add(embedding.vector());
    }
    meterRegistry.counter("embedding.requests.success", "model", model).increment();
    return new ProviderBatch(vectors, tokenUsage(response.tokenUsage(), texts));
  }

  /** Providers that do not report usage are billed on the local token estimate. */
  private long tokenUsage(TokenUsage usage, List<String> texts) {
    if (usage != null && usage.inputTokenCount() != null) {
      return usage.inputTokenCount();
    }
    return texts.stream().mapToLong(tokenCounter::count).sum();
  }
}
