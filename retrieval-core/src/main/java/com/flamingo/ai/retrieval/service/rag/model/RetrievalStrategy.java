package com.flamingo.ai.retrieval.service.rag.model;

/** Which paths produced a result. */
public enum RetrievalStrategy {
  VECTOR("vector"),
  VECTOR_RERANK("vector+rerank"),
  LEXICAL("lexical"),
  LEXICAL_RERANK("lexical+rerank"),
  HYBRID("hybrid"),
  HYBRID_RERANK("hybrid+rerank");

  private final String label;

  RetrievalStrategy(String label) {
    this.label = label;
  }

  public String label() {
    return label;
  }

  public boolean reranked() {
    return this == VECTOR_RERANK || this == LEXICAL_RERANK || this == HYBRID_RERANK;
  }

  /** The same base strategy with the rerank suffix. */
  public RetrievalStrategy withRerank() {
    return switch (this) {
      case VECTOR, VECTOR_RERANK -> VECTOR_RERANK;
      case LEXICAL, LEXICAL_RERANK -> LEXICAL_RERANK;
      case HYBRID, HYBRID_RERANK -> HYBRID_RERANK;
    };
  }

  @Override
  public String toString() {
    return label;
  }
}
