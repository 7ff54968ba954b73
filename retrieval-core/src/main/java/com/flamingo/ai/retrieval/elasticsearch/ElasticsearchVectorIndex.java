package com.flamingo.ai.retrieval.elasticsearch;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.elasticsearch._types.Refresh;
import co.elastic.clients.elasticsearch._types.Time;
import co.elastic.clients.elasticsearch._types.mapping.DenseVectorProperty;
import co.elastic.clients.elasticsearch._types.mapping.DenseVectorSimilarity;
import co.elastic.clients.elasticsearch._types.mapping.DynamicMapping;
import co.elastic.clients.elasticsearch._types.mapping.Property;
import co.elastic.clients.elasticsearch._types.mapping.TextProperty;
import co.elastic.clients.elasticsearch._types.query_dsl.Query;
import co.elastic.clients.elasticsearch.core.BulkRequest;
import co.elastic.clients.elasticsearch.core.BulkResponse;
import co.elastic.clients.elasticsearch.core.DeleteByQueryRequest;
import co.elastic.clients.elasticsearch.core.DeleteByQueryResponse;
import co.elastic.clients.elasticsearch.core.ScrollResponse;
import co.elastic.clients.elasticsearch.core.SearchRequest;
import co.elastic.clients.elasticsearch.core.SearchResponse;
import co.elastic.clients.elasticsearch.core.search.Hit;
import co.elastic.clients.elasticsearch.indices.CreateIndexRequest;
import com.flamingo.ai.retrieval.config.RagConfig;
import com.flamingo.ai.retrieval.exception.DimensionMismatchException;
import com.flamingo.ai.retrieval.exception.ProviderUnavailableException;
import com.flamingo.ai.retrieval.service.rag.chunking.ChunkingEngine;
import com.flamingo.ai.retrieval.service.rag.index.VectorIndex;
import com.flamingo.ai.retrieval.service.rag.model.CollectionConfig;
import com.flamingo.ai.retrieval.service.rag.model.CollectionStats;
import com.flamingo.ai.retrieval.service.rag.model.DistanceMetric;
import com.flamingo.ai.retrieval.service.rag.model.IndexedVector;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.Lists;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Vector index backed by Elasticsearch {@code dense_vector} fields and kNN search.
 *
 * <p>One index per collection. Chunk metadata is stored in a {@code flattened} field so arbitrary
 * keys can be filtered with {@code term} queries on {@code metadata.<key>}. Elasticsearch
 * normalizes kNN scores per similarity; they are mapped back so that cosine and dot product are
 * reported as-is and euclidean as {@code 1 / (1 + distance)}.
 */
@Component
@ConditionalOnProperty(name = "rag.index.backend", havingValue = "elasticsearch")
@Slf4j
public class ElasticsearchVectorIndex implements VectorIndex {

  static final String TEXT_FIELD = "text";
  static final String EMBEDDING_FIELD = "embedding";
  static final String METADATA_FIELD = "metadata";
  private static final int MAX_NUM_CANDIDATES = 10_000;
  private static final String SCROLL_KEEP_ALIVE = "1m";

  private final ElasticsearchClient elasticsearchClient;
  private final MeterRegistry meterRegistry;
  private final int upsertBatchSize;
  private final Map<String, CollectionConfig> collections = new ConcurrentHashMap<>();

  public ElasticsearchVectorIndex(
      ElasticsearchClient elasticsearchClient, MeterRegistry meterRegistry, RagConfig ragConfig) {
    this.elasticsearchClient = elasticsearchClient;
    this.meterRegistry = meterRegistry;
    this.upsertBatchSize = Math.max(1, ragConfig.getIndex().getUpsertBatchSize());
  }

  @Override
  @CircuitBreaker(name = "elasticsearch")
  public void createCollection(CollectionConfig config, boolean recreate) {
    String index = config.name();
    try {
      var indices = elasticsearchClient.indices();
      boolean exists = indices.exists(e -> e.index(index)).value();
      if (exists && recreate) {
        indices.delete(d -> d.index(index));
        log.info("Deleted Elasticsearch index {} for recreation", index);
        exists = false;
      }
      if (!exists) {
        CreateIndexRequest request =
            CreateIndexRequest.of(
                c ->
                    c.index(index)
                        .mappings(
                            m -> m.dynamic(DynamicMapping.False).properties(properties(config))));
        indices.create(request);
        log.info(
            "Created Elasticsearch index {} ({} dims, {})",
            index,
            config.dimensions(),
            config.distanceMetric());
      } else {
        log.debug("Elasticsearch index {} already exists", index);
      }
      collections.put(index, config);
    } catch (IOException e) {
      throw new ProviderUnavailableException(
          "elasticsearch", "Failed to create index '" + index + "'", e);
    }
  }

  @Override
  @Timed(value = "vector_index.upsert", description = "Time to upsert vectors")
  @CircuitBreaker(name = "elasticsearch")
  @Retry(name = "elasticsearch")
  public void upsert(String collection, List<IndexedVector> vectors) {
    CollectionConfig config = require(collection);
    for (IndexedVector vector : vectors) {
      if (vector.vector().length != config.dimensions()) {
        throw new DimensionMismatchException(
            collection, config.dimensions(), vector.vector().length);
      }
    }
    for (List<IndexedVector> batch : Lists.partition(vectors, upsertBatchSize)) {
      BulkRequest.Builder bulk = new BulkRequest.Builder().refresh(Refresh.WaitFor);
      for (IndexedVector vector : batch) {
        Map<String, Object> document = toDocument(vector);
        bulk.operations(
            op -> op.index(idx -> idx.index(collection).id(vector.id()).document(document)));
      }
      executeBulk(collection, bulk.build(), "upsert");
    }
    meterRegistry.counter("vector_index.es.indexed").increment(vectors.size());
    log.debug("Upserted {} vectors to {}", vectors.size(), collection);
  }

  @Override
  @Timed(value = "vector_index.search", description = "Time for vector search")
  @CircuitBreaker(name = "elasticsearch")
  @Retry(name = "elasticsearch")
  @SuppressWarnings({"rawtypes", "unchecked"})
  public List<IndexedVector> search(
      String collection,
      float[] queryVector,
      int k,
      Map<String, Object> filter,
      Double scoreThreshold) {
    CollectionConfig config = require(collection);
    if (queryVector.length != config.dimensions()) {
      throw new DimensionMismatchException(collection, config.dimensions(), queryVector.length);
    }
    try {
      SearchRequest request = buildSearchRequest(collection, queryVector, k, filter);
      SearchResponse<Map> response = elasticsearchClient.search(request, Map.class);
      List<IndexedVector> results = new ArrayList<>();
      for (Hit<Map> hit : response.hits().hits()) {
        Map<String, Object> source = hit.source();
        if (source == null || hit.score() == null) {
          continue;
        }
        double score = fromElasticsearchScore(config.distanceMetric(), hit.score());
        if (scoreThreshold != null && score < scoreThreshold) {
          continue;
        }
        Object metadata = source.get(METADATA_FIELD);
        results.add(
            new IndexedVector(
                hit.id(),
                null,
                (String) source.get(TEXT_FIELD),
                metadata instanceof Map ? (Map<String, Object>) metadata : Map.of(),
                score));
      }
      meterRegistry.counter("vector_index.es.search").increment();
      log.debug("Vector search on {} returned {} hits", collection, results.size());
      return results;
    } catch (IOException e) {
      throw new ProviderUnavailableException(
          "elasticsearch", "Vector search failed for '" + collection + "'", e);
    }
  }

  @Override
  @Timed(value = "vector_index.delete", description = "Time to delete vectors")
  @CircuitBreaker(name = "elasticsearch")
  @Retry(name = "elasticsearch")
  public void delete(String collection, List<String> ids) {
    if (ids.isEmpty()) {
      return;
    }
    for (List<String> batch : Lists.partition(ids, upsertBatchSize)) {
      BulkRequest.Builder bulk = new BulkRequest.Builder().refresh(Refresh.WaitFor);
      for (String id : batch) {
        bulk.operations(op -> op.delete(d -> d.index(collection).id(id)));
      }
      executeBulk(collection, bulk.build(), "delete");
    }
    meterRegistry.counter("vector_index.es.deleted").increment(ids.size());
  }

  @Override
  @Timed(value = "vector_index.delete_document", description = "Time to delete a document")
  @CircuitBreaker(name = "elasticsearch")
  @Retry(name = "elasticsearch")
  public int deleteDocument(String collection, String documentId) {
    require(collection);
    try {
      DeleteByQueryRequest request =
          DeleteByQueryRequest.of(
              d -> d.index(collection).query(documentQuery(documentId)).refresh(true));
      DeleteByQueryResponse response = elasticsearchClient.deleteByQuery(request);
      long deleted = response.deleted() == null ? 0 : response.deleted();
      meterRegistry.counter("vector_index.es.deleted").increment(deleted);
      log.info("Deleted {} chunks of document {} from {}", deleted, documentId, collection);
      return (int) deleted;
    } catch (IOException e) {
      throw new ProviderUnavailableException(
          "elasticsearch",
          "Failed to delete document '" + documentId + "' from '" + collection + "'",
          e);
    }
  }

  @Override
  @CircuitBreaker(name = "elasticsearch")
  @Retry(name = "elasticsearch")
  public List<IndexedVector> listDocument(String collection, String documentId) {
    require(collection);
    List<IndexedVector> points = new ArrayList<>();
    scroll(collection, documentQuery(documentId), points::addAll);
    return points;
  }

  @Override
  @CircuitBreaker(name = "elasticsearch")
  public void scan(String collection, Consumer<List<IndexedVector>> batchConsumer) {
    require(collection);
    scroll(collection, Query.of(q -> q.matchAll(m -> m)), batchConsumer);
  }

  @Override
  @CircuitBreaker(name = "elasticsearch")
  public CollectionStats collectionStats(String collection) {
    CollectionConfig config = require(collection);
    try {
      long count = elasticsearchClient.count(c -> c.index(collection)).count();
      return new CollectionStats(
          collection, count, config.dimensions(), config.distanceMetric(), "green");
    } catch (IOException e) {
      throw new ProviderUnavailableException(
          "elasticsearch", "Failed to count documents in '" + collection + "'", e);
    }
  }

  @Override
  public boolean healthCheck() {
    try {
      return elasticsearchClient.ping().value();
    } catch (IOException | RuntimeException e) {
      log.warn("Elasticsearch health check failed: {}", e.getMessage());
      return false;
    }
  }

  @VisibleForTesting
  SearchRequest buildSearchRequest(
      String collection, float[] queryVector, int k, Map<String, Object> filter) {
    List<Float> vector = new ArrayList<>(queryVector.length);
    for (float v : queryVector) {
      vector.add(v);
    }
    List<Query> filters = new ArrayList<>();
    if (filter != null) {
      for (Map.Entry<String, Object> entry : filter.entrySet()) {
        String field = METADATA_FIELD + "." + entry.getKey();
        String value = String.valueOf(entry.getValue());
        filters.add(Query.of(q -> q.term(t -> t.field(field).value(value))));
      }
    }
    int numCandidates = Math.min(MAX_NUM_CANDIDATES, Math.max(k * 2, 100));
    return SearchRequest.of(
        s ->
            s.index(collection)
                .knn(
                    knn ->
                        knn.field(EMBEDDING_FIELD)
                            .queryVector(vector)
                            .k(k)
                            .numCandidates(numCandidates)
                            .filter(filters))
                .source(src -> src.filter(f -> f.excludes(EMBEDDING_FIELD)))
                .size(k));
  }

  @VisibleForTesting
  static Query documentQuery(String documentId) {
    String field = METADATA_FIELD + "." + ChunkingEngine.DOCUMENT_ID;
    return Query.of(q -> q.term(t -> t.field(field).value(documentId)));
  }

  /** Stored point with its vector, or {@code null} when the hit carries no source. */
  @VisibleForTesting
  @SuppressWarnings({"rawtypes", "unchecked"})
  static IndexedVector fromStoredHit(Hit<Map> hit) {
    Map<String, Object> source = hit.source();
    if (source == null) {
      return null;
    }
    float[] vector = null;
    Object embedding = source.get(EMBEDDING_FIELD);
    if (embedding instanceof List) {
      List<Object> values = (List<Object>) embedding;
      vector = new float[values.size()];
      for (int i = 0; i < values.size(); i++) {
        vector[i] = ((Number) values.get(i)).floatValue();
      }
    }
    Object metadata = source.get(METADATA_FIELD);
    return new IndexedVector(
        hit.id(),
        vector,
        (String) source.get(TEXT_FIELD),
        metadata instanceof Map ? (Map<String, Object>) metadata : Map.of());
  }

  /** Inverts Elasticsearch's kNN score normalization. */
  @VisibleForTesting
  static double fromElasticsearchScore(DistanceMetric metric, double score) {
    return switch (metric) {
      case COSINE, DOT -> 2 * score - 1;
      case EUCLIDEAN -> {
        double squared = Math.max(0.0, 1 / score - 1);
        yield 1 / (1 + Math.sqrt(squared));
      }
    };
  }

  private Map<String, Property> properties(CollectionConfig config) {
    Map<String, Property> properties = new HashMap<>();
    properties.put(TEXT_FIELD, Property.of(p -> p.text(TextProperty.of(t -> t))));
    properties.put(METADATA_FIELD, Property.of(p -> p.flattened(f -> f)));
    properties.put(
        EMBEDDING_FIELD,
        Property.of(
            p ->
                p.denseVector(
                    DenseVectorProperty.of(
                        d ->
                            d.dims(config.dimensions())
                                .index(true)
                                .similarity(similarity(config.distanceMetric()))))));
    return properties;
  }

  private static DenseVectorSimilarity similarity(DistanceMetric metric) {
    return switch (metric) {
      case COSINE -> DenseVectorSimilarity.Cosine;
      case DOT -> DenseVectorSimilarity.DotProduct;
      case EUCLIDEAN -> DenseVectorSimilarity.L2Norm;
    };
  }

  private static Map<String, Object> toDocument(IndexedVector vector) {
    List<Float> embedding = new ArrayList<>(vector.vector().length);
    for (float v : vector.vector()) {
      embedding.add(v);
    }
    Map<String, Object> document = new HashMap<>();
    document.put(TEXT_FIELD, vector.text());
    document.put(METADATA_FIELD, vector.metadata());
    document.put(EMBEDDING_FIELD, embedding);
    return document;
  }

  @SuppressWarnings("rawtypes")
  private void scroll(String collection, Query query, Consumer<List<IndexedVector>> consumer) {
    Time keepAlive = Time.of(t -> t.time(SCROLL_KEEP_ALIVE));
    String scrollId = null;
    try {
      SearchResponse<Map> page =
          elasticsearchClient.search(
              s -> s.index(collection).query(query).size(upsertBatchSize).scroll(keepAlive),
              Map.class);
      scrollId = page.scrollId();
      List<Hit<Map>> hits = page.hits().hits();
      while (!hits.isEmpty()) {
        List<IndexedVector> batch = new ArrayList<>(hits.size());
        for (Hit<Map> hit : hits) {
          IndexedVector point = fromStoredHit(hit);
          if (point != null) {
            batch.add(point);
          }
        }
        consumer.accept(batch);
        if (scrollId == null) {
          break;
        }
        String current = scrollId;
        ScrollResponse<Map> next =
            elasticsearchClient.scroll(
                sc -> sc.scrollId(current).scroll(keepAlive), Map.class);
        scrollId = next.scrollId();
        hits = next.hits().hits();
      }
    } catch (IOException e) {
      throw new ProviderUnavailableException(
          "elasticsearch", "Failed to scroll '" + collection + "'", e);
    } finally {
      clearScroll(scrollId);
    }
  }

  private void clearScroll(String scrollId) {
    if (scrollId == null) {
      return;
    }
    try {
      elasticsearchClient.clearScroll(c -> c.scrollId(scrollId));
    } catch (IOException e) {
      log.warn("Failed to clear scroll context: {}", e.getMessage());
    }
  }

  private void executeBulk(String collection, BulkRequest request, String operation) {
    try {
      BulkResponse response = elasticsearchClient.bulk(request);
      if (response.errors()) {
        long failed = response.items().stream().filter(item -> item.error() != null).count();
        meterRegistry.counter("vector_index.es.errors", "op", operation).increment();
        throw new ProviderUnavailableException(
            "elasticsearch",
            String.format("Bulk %s to '%s' failed for %d items", operation, collection, failed));
      }
    } catch (IOException e) {
      throw new ProviderUnavailableException(
          "elasticsearch", "Bulk " + operation + " to '" + collection + "' failed", e);
    }
  }

  private CollectionConfig require(String collection) {
    CollectionConfig config = collections.get(collection);
    if (config == null) {
      throw new IllegalStateException("Collection not found: " + collection);
    }
    return config;
  }
}
