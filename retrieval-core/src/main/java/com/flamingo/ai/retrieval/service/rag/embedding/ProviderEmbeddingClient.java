package com.flamingo.ai.retrieval.service.rag.embedding;

import com.flamingo.ai.retrieval.exception.DimensionMismatchException;
import com.flamingo.ai.retrieval.exception.ProviderUnavailableException;
import com.flamingo.ai.retrieval.service.rag.model.EmbeddingResult;
import com.flamingo.ai.retrieval.service.rag.model.EmbeddingStats;
import com.google.common.collect.Lists;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.DoubleAdder;
import lombok.extern.slf4j.Slf4j;

/**
 * Calls the embedding provider in bounded sub-batches and keeps token and cost totals. Cost is
 * token usage times the model's price per million tokens.
 */
@Slf4j
public class ProviderEmbeddingClient implements EmbeddingClient {

  private final EmbeddingProvider provider;
  private final String model;
  private final int dimensions;
  private final int maxBatchSize;
  private final double pricePerMillionTokens;
  private final MeterRegistry meterRegistry;

  private final AtomicLong totalRequests = new AtomicLong();
  private final AtomicLong totalTokens = new AtomicLong();
  private final DoubleAdder totalCost = new DoubleAdder();

  public ProviderEmbeddingClient(
      EmbeddingProvider provider,
      String model,
      int dimensions,
      int maxBatchSize,
      double pricePerMillionTokens,
      MeterRegistry meterRegistry) {
    if (maxBatchSize < 1) {
      throw new IllegalArgumentException("maxBatchSize must be positive: " + maxBatchSize);
    }
    this.provider = provider;
    this.model = model;
    this.dimensions = dimensions;
    this.maxBatchSize = maxBatchSize;
    this.pricePerMillionTokens = pricePerMillionTokens;
    this.meterRegistry = meterRegistry;
  }

  @Override
  public EmbeddingResult embed(String text) {
    return embedBatch(List.of(text)).get(0);
  }

  @Override
  public List<EmbeddingResult> embedBatch(List<String> texts) {
    if (texts.isEmpty()) {
      return List.of();
    }
    List<EmbeddingResult> results = new ArrayList<>(texts.size());
    for (List<String> batch : Lists.partition(texts, maxBatchSize)) {
      EmbeddingProvider.ProviderBatch response = provider.embed(model, batch);
      if (response.vectors().size() != batch.size()) {
        throw new ProviderUnavailableException(
            "embedding",
            String.format(
                "Provider returned %d vectors for %d texts",
                response.vectors().size(), batch.size()));
      }
      for (float[] vector : response.vectors()) {
        int actual = vector == null ? 0 : vector.length;
        if (dimensions > 0 && actual != dimensions) {
          meterRegistry.counter("embedding.dimension_mismatch", "model", model).increment();
          throw new DimensionMismatchException(model, dimensions, actual);
        }
      }
      long[] perText = attributeTokens(batch, response.tokenUsage());
      for (int i = 0; i < batch.size(); i++) {
        results.add(
            new EmbeddingResult(
                batch.get(i),
                response.vectors().get(i),
                model,
                (int) perText[i],
                false,
                cost(perText[i])));
      }
      record(batch.size(), response.tokenUsage());
    }
    log.debug("Embedded {} texts with {}", texts.size(), model);
    return results;
  }

  @Override
  public String model() {
    return model;
  }

  @Override
  public int dimensions() {
    return dimensions;
  }

  @Override
  public EmbeddingStats stats() {
    long requests = totalRequests.get();
    return new EmbeddingStats(requests, 0, requests, totalTokens.get(), totalCost.sum(), 0.0);
  }

  private void record(int texts, long tokens) {
    totalRequests.addAndGet(texts);
    totalTokens.addAndGet(tokens);
    double batchCost = cost(tokens);
    totalCost.add(batchCost);
    meterRegistry.counter("embedding.tokens", "model", model).increment(tokens);
    meterRegistry.counter("embedding.cost", "model", model).increment(batchCost);
  }

  private double cost(long tokens) {
    return tokens * pricePerMillionTokens / 1_000_000.0;
  }

  /** Splits the batch's token usage over its texts by length; the last text takes the remainder. */
  private static long[] attributeTokens(List<String> batch, long tokenUsage) {
    long[] perText = new long[batch.size()];
    long totalChars = batch.stream().mapToLong(String::length).sum();
    long assigned = 0;
    for (int i = 0; i < batch.size() - 1; i++) {
      perText[i] = totalChars == 0 ? 0 : tokenUsage * batch.get(i).length() / totalChars;
      assigned += perText[i];
    }
    perText[batch.size() - 1] = tokenUsage - assigned;
    return perText;
  }
}
