package com.flamingo.ai.retrieval.service.rag.index;

import com.flamingo.ai.retrieval.exception.DimensionMismatchException;
import com.flamingo.ai.retrieval.service.rag.chunking.ChunkingEngine;
import com.flamingo.ai.retrieval.service.rag.model.CollectionConfig;
import com.flamingo.ai.retrieval.service.rag.model.CollectionStats;
import com.flamingo.ai.retrieval.service.rag.model.IndexedVector;
import com.google.common.collect.Lists;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/** Exact brute-force vector index held in process memory. */
@Component
@ConditionalOnProperty(name = "rag.index.backend", havingValue = "memory", matchIfMissing = true)
@Slf4j
public class InMemoryVectorIndex implements VectorIndex {

  private static final int SCAN_BATCH_SIZE = 500;

  private final Map<String, StoredCollection> collections = new ConcurrentHashMap<>();

  @Override
  public void createCollection(CollectionConfig config, boolean recreate) {
    if (recreate) {
      collections.put(config.name(), new StoredCollection(config));
      log.info("Recreated in-memory collection {}", config.name());
      return;
    }
    StoredCollection existing =
        collections.putIfAbsent(config.name(), new StoredCollection(config));
    if (existing == null) {
      log.info(
          "Created in-memory collection {} ({} dims, {})",
          config.name(),
          config.dimensions(),
          config.distanceMetric());
    } else if (existing.config.dimensions() != config.dimensions()) {
      throw new DimensionMismatchException(
          config.name(), existing.config.dimensions(), config.dimensions());
    }
  }

  @Override
  public void upsert(String collection, List<IndexedVector> vectors) {
    StoredCollection target = require(collection);
    for (IndexedVector vector : vectors) {
      target.checkDimensions(vector.vector());
    }
    for (IndexedVector vector : vectors) {
      target.points.put(vector.id(), vector);
    }
  }

  @Override
  public List<IndexedVector> search(
      String collection,
      float[] queryVector,
      int k,
      Map<String, Object> filter,
      Double scoreThreshold) {
    StoredCollection target = require(collection);
    target.checkDimensions(queryVector);
    return target.points.values().stream()
        .filter(point -> point.matches(filter))
        .map(
            point ->
                point.withScore(
                    target.config.distanceMetric().similarity(queryVector, point.vector())))
        .filter(point -> scoreThreshold == null || point.score() >= scoreThreshold)
        .sorted(
            Comparator.comparingDouble(IndexedVector::score)
                .reversed()
                .thenComparing(IndexedVector::id))
        .limit(k)
        .toList();
  }

  @Override
  public void delete(String collection, List<String> ids) {
    StoredCollection target = collections.get(collection);
    if (target == null) {
      return;
    }
    ids.forEach(target.points::remove);
  }

  @Override
  public int deleteDocument(String collection, String documentId) {
    StoredCollection target = collections.get(collection);
    if (target == null) {
      return 0;
    }
    List<IndexedVector> points = listDocument(collection, documentId);
    points.forEach(point -> target.points.remove(point.id()));
    return points.size();
  }

  @Override
  public List<IndexedVector> listDocument(String collection, String documentId) {
    StoredCollection target = collections.get(collection);
    if (target == null) {
      return List.of();
    }
    return target.points.values().stream()
        .filter(point -> belongsTo(point, documentId))
        .sorted(Comparator.comparing(IndexedVector::id))
        .toList();
  }

  @Override
  public void scan(String collection, Consumer<List<IndexedVector>> batchConsumer) {
    StoredCollection target = require(collection);
    List<IndexedVector> points =
        target.points.values().stream().sorted(Comparator.comparing(IndexedVector::id)).toList();
    Lists.partition(points, SCAN_BATCH_SIZE).forEach(batchConsumer);
  }

  @Override
  public CollectionStats collectionStats(String collection) {
    StoredCollection target = require(collection);
    return new CollectionStats(
        collection,
        target.points.size(),
        target.config.dimensions(),
        target.config.distanceMetric(),
        "green");
  }

  @Override
  public boolean healthCheck() {
    return true;
  }

  private static boolean belongsTo(IndexedVector point, String documentId) {
    return Objects.equals(
        documentId, Objects.toString(point.metadata().get(ChunkingEngine.DOCUMENT_ID), null));
  }

  private StoredCollection require(String name) {
    StoredCollection collection = collections.get(name);
    if (collection == null) {
      throw new IllegalStateException("Collection not found: " + name);
    }
    return collection;
  }

  private static final class StoredCollection {
    private final CollectionConfig config;
    private final Map<String, IndexedVector> points = new ConcurrentHashMap<>();

    private StoredCollection(CollectionConfig config) {
      this.config = config;
    }

    private void checkDimensions(float[] vector) {
      int actual = vector == null ? 0 : vector.length;
      if (actual != config.dimensions()) {
        throw new DimensionMismatchException(config.name(), config.dimensions(), actual);
      }
    }
  }
}
