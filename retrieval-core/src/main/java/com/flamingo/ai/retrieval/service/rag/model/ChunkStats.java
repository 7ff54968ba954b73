package com.flamingo.ai.retrieval.service.rag.model;

/** Token distribution over a list of chunks. */
public record ChunkStats(
    int totalChunks, double avgTokens, int minTokens, int maxTokens, long totalTokens) {

  public static ChunkStats empty() {
    return new ChunkStats(0, 0.0, 0, 0, 0L);
  }
}
