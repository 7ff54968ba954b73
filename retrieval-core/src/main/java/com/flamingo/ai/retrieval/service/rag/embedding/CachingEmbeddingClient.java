package com.flamingo.ai.retrieval.service.rag.embedding;

import com.flamingo.ai.retrieval.service.rag.model.EmbeddingResult;
import com.flamingo.ai.retrieval.service.rag.model.EmbeddingStats;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.hash.Hashing;
import io.micrometer.core.instrument.MeterRegistry;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import lombok.extern.slf4j.Slf4j;

/**
 * Content-addressed cache in front of another {@link EmbeddingClient}.
 *
 * <p>Entries are keyed by {@code emb:<model>:<sha256(text)>}, so identical text under the same
 * model always yields the same vector bytes. Batch calls only send uncached, de-duplicated texts
 * to the delegate. A failing cache store degrades to a miss and never fails the call.
 */
@Slf4j
public class CachingEmbeddingClient implements EmbeddingClient {

  private final EmbeddingClient delegate;
  private final EmbeddingCacheStore store;
  private final Duration ttl;
  private final MeterRegistry meterRegistry;

  private final AtomicLong requests = new AtomicLong();
  private final AtomicLong hits = new AtomicLong();
  private final AtomicLong misses = new AtomicLong();

  public CachingEmbeddingClient(
      EmbeddingClient delegate,
      EmbeddingCacheStore store,
      Duration ttl,
      MeterRegistry meterRegistry) {
    this.delegate = delegate;
    this.store = store;
    this.ttl = ttl;
    this.meterRegistry = meterRegistry;
  }

  @Override
  public EmbeddingResult embed(String text) {
    requests.incrementAndGet();
    String key = cacheKey(delegate.model(), text);
    Optional<float[]> cached = lookup(key);
    if (cached.isPresent()) {
      hits.incrementAndGet();
      meterRegistry.counter("embedding.cache.hit").increment();
      return fromCache(text, cached.get());
    }
    misses.incrementAndGet();
    meterRegistry.counter("embedding.cache.miss").increment();
    EmbeddingResult result = delegate.embed(text);
    save(key, result.vector());
    return result;
  }

  @Override
  public List<EmbeddingResult> embedBatch(List<String> texts) {
    if (texts.isEmpty()) {
      return List.of();
    }
    String model = delegate.model();
    EmbeddingResult[] results = new EmbeddingResult[texts.size()];
    Map<String, List<Integer>> uncached = new LinkedHashMap<>();

    for (int i = 0; i < texts.size(); i++) {
      String text = texts.get(i);
      Optional<float[]> cached = lookup(cacheKey(model, text));
      if (cached.isPresent()) {
        results[i] = fromCache(text, cached.get());
      } else {
        uncached.computeIfAbsent(text, t -> new ArrayList<>()).add(i);
      }
    }

    int hitCount = texts.size() - uncached.values().stream().mapToInt(List::size).sum();
    requests.addAndGet(texts.size());
    hits.addAndGet(hitCount);
    misses.addAndGet(texts.size() - hitCount);
    meterRegistry.counter("embedding.cache.hit").increment(hitCount);
    meterRegistry.counter("embedding.cache.miss").increment(texts.size() - hitCount);

    if (!uncached.isEmpty()) {
      List<String> toEmbed = new ArrayList<>(uncached.keySet());
      List<EmbeddingResult> fresh = delegate.embedBatch(toEmbed);
      for (int j = 0; j < toEmbed.size(); j++) {
        EmbeddingResult result = fresh.get(j);
        save(cacheKey(model, toEmbed.get(j)), result.vector());
        for (int index : uncached.get(toEmbed.get(j))) {
          results[index] = result;
        }
      }
    }

    log.debug(
        "Embedded batch of {} texts: {} cached, {} sent to {}",
        texts.size(),
        hitCount,
        uncached.size(),
        model);
    return Arrays.asList(results);
  }

  @Override
  public String model() {
    return delegate.model();
  }

  @Override
  public int dimensions() {
    return delegate.dimensions();
  }

  @Override
  public EmbeddingStats stats() {
    EmbeddingStats inner = delegate.stats();
    long total = requests.get();
    double hitRate = total == 0 ? 0.0 : (double) hits.get() / total;
    return new EmbeddingStats(
        total, hits.get(), misses.get(), inner.totalTokens(), inner.totalCost(), hitRate);
  }

  /** Drops every cached vector. Counters are kept. */
  public void clearCache() {
    store.clear();
    log.info("Embedding cache cleared");
  }

  public long cacheSize() {
    return store.size();
  }

  @VisibleForTesting
  static String cacheKey(String model, String text) {
    return "emb:" + model + ":" + Hashing.sha256().hashString(text, StandardCharsets.UTF_8);
  }

  private EmbeddingResult fromCache(String text, float[] vector) {
    return new EmbeddingResult(text, vector, delegate.model(), 0, true, 0.0);
  }

  private Optional<float[]> lookup(String key) {
    try {
      return store.get(key).map(VectorCodec::decode);
    } catch (RuntimeException e) {
      log.warn("Embedding cache read failed for {}, treating as miss: {}", key, e.getMessage());
      meterRegistry.counter("embedding.cache.errors", "op", "get").increment();
      return Optional.empty();
    }
  }

  private void save(String key, float[] vector) {
    try {
      store.put(key, VectorCodec.encode(vector), ttl);
    } catch (RuntimeException e) {
      log.warn("Embedding cache write failed for {}: {}", key, e.getMessage());
      meterRegistry.counter("embedding.cache.errors", "op", "put").increment();
    }
  }
}
