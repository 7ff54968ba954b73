package com.flamingo.ai.retrieval.service.rag.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/** Defensive copies of metadata maps. */
public final class MetadataMaps {

  private MetadataMaps() {}

  /**
   * Unmodifiable copy that keeps insertion order and, unlike {@link Map#copyOf}, allows null
   * values.
   *
   * @param metadata source map, {@code null} for none
   * @return an unmodifiable copy, empty for {@code null}
   */
  public static Map<String, Object> copyOf(Map<String, Object> metadata) {
    if (metadata == null || metadata.isEmpty()) {
      return Map.of();
    }
    return Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
  }
}
