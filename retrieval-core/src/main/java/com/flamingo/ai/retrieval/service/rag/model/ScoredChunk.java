package com.flamingo.ai.retrieval.service.rag.model;

import java.util.Map;

/**
 * A retrieval candidate with its final score and the normalized per-side scores behind it.
 *
 * @param id chunk id
 * @param documentId owning document, may be {@code null} for foreign index entries
 * @param text chunk text
 * @param metadata chunk metadata
 * @param score fused or reranked score
 * @param lexicalScore max-normalized BM25 score, 0 when the lexical side did not return it
 * @param vectorScore max-normalized similarity, 0 when the vector side did not return it
 */
public record ScoredChunk(
    String id,
    String documentId,
    String text,
    Map<String, Object> metadata,
    double score,
    double lexicalScore,
    double vectorScore) {

  public ScoredChunk withScore(double newScore) {
    return new ScoredChunk(id, documentId, text, metadata, newScore, lexicalScore, vectorScore);
  }
}
