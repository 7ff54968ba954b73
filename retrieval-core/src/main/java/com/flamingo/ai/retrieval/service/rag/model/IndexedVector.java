package com.flamingo.ai.retrieval.service.rag.model;

import java.util.Map;

/**
 * A vector index entry. On search results {@code score} is the similarity to the query.
 *
 * @param id chunk id
 * @param vector embedding of the chunk text
 * @param text chunk text
 * @param metadata chunk metadata, used for exact-match filtering
 * @param score similarity, {@code null} outside search results
 */
public record IndexedVector(
    String id, float[] vector, String text, Map<String, Object> metadata, Double score) {

  public IndexedVector {
    metadata = MetadataMaps.copyOf(metadata);
  }

  public IndexedVector(String id, float[] vector, String text, Map<String, Object> metadata) {
    this(id, vector, text, metadata, null);
  }

  public IndexedVector withScore(double newScore) {
    return new IndexedVector(id, vector, text, metadata, newScore);
  }

  /** Whether every filter entry is present in the metadata with an equal value. */
  public boolean matches(Map<String, Object> filter) {
    return MetadataFilter.matches(metadata, filter);
  }
}
