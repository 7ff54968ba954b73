package com.flamingo.ai.retrieval.service.rag.model;

import java.util.Map;

/**
 * Outcome of a batch ingest. A failed document does not affect the others.
 *
 * @param chunksIndexed chunk count per successfully indexed document id
 * @param failures error message per failed document id
 */
public record IngestReport(Map<String, Integer> chunksIndexed, Map<String, String> failures) {

  public IngestReport {
    chunksIndexed = Map.copyOf(chunksIndexed);
    failures = Map.copyOf(failures);
  }

  public int totalChunks() {
    return chunksIndexed.values().stream().mapToInt(Integer::intValue).sum();
  }

  public boolean hasFailures() {
    return !failures.isEmpty();
  }
}
