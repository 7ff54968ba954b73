package com.flamingo.ai.retrieval.service.rag.model;

/**
 * Shape of a vector collection.
 *
 * @param name collection name
 * @param dimensions required vector length
 * @param distanceMetric similarity function
 */
public record CollectionConfig(String name, int dimensions, DistanceMetric distanceMetric) {}
