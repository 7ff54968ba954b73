package com.flamingo.ai.retrieval.service.rag.model;

/** Point count and shape of a vector collection. */
public record CollectionStats(
    String name, long pointCount, int dimensions, DistanceMetric distanceMetric, String status) {}
