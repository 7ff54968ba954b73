package com.flamingo.ai.retrieval.service.rag.rerank;

import java.util.List;

/**
 * Precision reranking of retrieval candidates against the raw query. Implementations call an
 * external cross-encoder; failures propagate so the pipeline can fall back to the fused ranking.
 */
public interface Reranker {

  /**
   * Scores candidate texts against the query.
   *
   * @param query the raw query
   * @param texts candidate texts
   * @param topN number of scores to return
   * @return at most {@code topN} scores, best first, each pointing at an input index
   */
  List<RerankScore> rerank(String query, List<String> texts, int topN);

  /**
   * Relevance of one candidate.
   *
   * @param index position of the candidate in the input list
   * @param relevanceScore reranker score, larger is more relevant
   */
  record RerankScore(int index, double relevanceScore) {}
}
