package com.flamingo.ai.retrieval.service.rag.model;

/** Cumulative embedding usage. {@code cacheHitRate} is hits over requests, 0 with no requests. */
public record EmbeddingStats(
    long totalRequests,
    long cacheHits,
    long cacheMisses,
    long totalTokens,
    double totalCost,
    double cacheHitRate) {}
