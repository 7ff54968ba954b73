package com.flamingo.ai.retrieval.service.rag.embedding;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import java.time.Duration;
import java.util.Optional;

/** In-process embedding cache with a per-entry time to live. */
public class CaffeineEmbeddingCacheStore implements EmbeddingCacheStore {

  private final Cache<String, Entry> cache;

  public CaffeineEmbeddingCacheStore(long maximumSize) {
    this.cache =
        Caffeine.newBuilder()
            .maximumSize(maximumSize)
            .expireAfter(new EntryExpiry())
            .recordStats()
            .build();
  }

  @Override
  public Optional<byte[]> get(String key) {
    Entry entry = cache.getIfPresent(key);
    return entry == null ? Optional.empty() : Optional.of(entry.value());
  }

  @Override
  public void put(String key, byte[] value, Duration ttl) {
    cache.put(key, new Entry(value, ttl.toNanos()));
  }

  @Override
  public void clear() {
    cache.invalidateAll();
  }

  @Override
  public long size() {
    return cache.estimatedSize();
  }

  private record Entry(byte[] value, long ttlNanos) {}

  private static final class EntryExpiry implements Expiry<String, Entry> {

    @Override
    public long expireAfterCreate(String key, Entry entry, long currentTime) {
      return entry.ttlNanos();
    }

    @Override
    public long expireAfterUpdate(
        String key, Entry entry, long currentTime, long currentDuration) {
      return entry.ttlNanos();
    }

    @Override
    public long expireAfterRead(String key, Entry entry, long currentTime, long currentDuration) {
      return currentDuration;
    }
  }
}
