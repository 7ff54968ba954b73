package com.flamingo.ai.retrieval.service.rag.model;

import java.util.List;
import java.util.Set;

/**
 * Ranked answer to one query.
 *
 * @param query the raw query
 * @param chunks at most k chunks, best first
 * @param elapsedMs wall-clock time of the whole retrieval
 * @param strategy paths that contributed to the ranking
 * @param candidatesExamined size of the fused candidate union
 * @param degradations stage failures that lowered confidence, empty on a clean run
 */
public record RetrievalResult(
    String query,
    List<ScoredChunk> chunks,
    long elapsedMs,
    RetrievalStrategy strategy,
    int candidatesExamined,
    Set<QueryDegradation> degradations) {

  public RetrievalResult {
    chunks = List.copyOf(chunks);
    degradations = Set.copyOf(degradations);
  }

  public boolean degraded() {
    return !degradations.isEmpty();
  }
}
