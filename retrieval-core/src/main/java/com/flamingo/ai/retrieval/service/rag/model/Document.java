package com.flamingo.ai.retrieval.service.rag.model;

import java.util.Map;

/**
 * A unit of ingestion. Re-ingesting a document with the same id replaces all of its chunks.
 *
 * @param id stable document identifier
 * @param text full document text
 * @param metadata arbitrary key/value metadata copied onto every chunk
 */
public record Document(String id, String text, Map<String, Object> metadata) {

  public Document {
    metadata = MetadataMaps.copyOf(metadata);
  }

  public Document(String id, String text) {
    this(id, text, Map.of());
  }
}
