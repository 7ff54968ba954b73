package com.flamingo.ai.retrieval.service.rag.embedding;

import java.time.Duration;
import java.util.Optional;

/** Key-value store for serialized embedding vectors. */
public interface EmbeddingCacheStore {

  Optional<byte[]> get(String key);

  void put(String key, byte[] value, Duration ttl);

  void clear();

  /** Number of live entries, approximate for concurrent stores. */
  long size();
}
