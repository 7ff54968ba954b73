package com.flamingo.ai.retrieval.service.rag.model;

/** Pipeline-wide counters. */
public record RetrievalStats(
    long totalQueries,
    double avgLatencyMs,
    long indexedChunkCount,
    double cacheHitRate,
    double totalEmbeddingCost) {}
