package com.flamingo.ai.retrieval.service.rag.model;

import java.util.Map;
import lombok.Builder;

/**
 * Parameters of one retrieval. Unset values fall back to the configured retrieval defaults.
 *
 * @param query raw query text
 * @param k number of results, {@code null} for the configured top-k
 * @param useHybrid run the lexical side alongside the vector side, {@code null} means true
 * @param useRerank rerank the fused candidates when a reranker is available, {@code null} means
 *     true
 * @param filter exact-match metadata filter applied to both sides
 * @param alpha lexical weight in fusion, {@code null} for the configured alpha
 */
@Builder
public record RetrievalRequest(
    String query,
    Integer k,
    Boolean useHybrid,
    Boolean useRerank,
    Map<String, Object> filter,
    Double alpha) {

  public RetrievalRequest {
    useHybrid = useHybrid == null || useHybrid;
    useRerank = useRerank == null || useRerank;
    filter = filter == null ? Map.of() : Map.copyOf(filter);
  }

  /** Hybrid, reranked retrieval with configured defaults. */
  public static RetrievalRequest of(String query) {
    return new RetrievalRequest(query, null, true, true, Map.of(), null);
  }
}
