package com.flamingo.ai.retrieval.service.rag.model;

/**
 * Embedding of one text.
 *
 * @param text embedded text
 * @param vector embedding vector
 * @param model model that produced the vector
 * @param tokenCount provider-reported tokens attributed to this text, 0 on a cache hit
 * @param fromCache whether the vector came from the cache
 * @param cost dollar cost attributed to this text, 0 on a cache hit
 */
public record EmbeddingResult(
    String text, float[] vector, String model, int tokenCount, boolean fromCache, double cost) {}
