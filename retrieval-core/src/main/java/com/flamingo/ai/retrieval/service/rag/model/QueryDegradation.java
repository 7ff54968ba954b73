package com.flamingo.ai.retrieval.service.rag.model;

/** A non-fatal stage failure recorded on a retrieval result. */
public enum QueryDegradation {
  LEXICAL_FAILED,
  LEXICAL_TIMEOUT,
  VECTOR_FAILED,
  VECTOR_TIMEOUT,
  RERANK_FAILED,
  RERANK_TIMEOUT,
  /** Reranking was requested but no reranker is configured. */
  RERANK_UNAVAILABLE
}
