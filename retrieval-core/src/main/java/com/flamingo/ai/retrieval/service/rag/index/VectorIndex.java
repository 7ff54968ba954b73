package com.flamingo.ai.retrieval.service.rag.index;

import com.flamingo.ai.retrieval.service.rag.model.CollectionConfig;
import com.flamingo.ai.retrieval.service.rag.model.CollectionStats;
import com.flamingo.ai.retrieval.service.rag.model.IndexedVector;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Approximate nearest-neighbor store for chunk vectors. Adapters wrap an external engine or keep
 * vectors in process; callers only rely on this contract.
 */
public interface VectorIndex {

  /**
   * Creates a collection. An existing collection is kept unless {@code recreate} is set, in which
   * case it is dropped with all of its points first.
   *
   * @param config collection name, dimension and metric
   * @param recreate drop an existing collection of the same name
   */
  void createCollection(CollectionConfig config, boolean recreate);

  /**
   * Inserts or replaces points by id.
   *
   * @param collection collection name
   * @param vectors points to write; every vector must have the collection's dimension
   * @throws com.flamingo.ai.retrieval.exception.DimensionMismatchException on a wrong length
   */
  void upsert(String collection, List<IndexedVector> vectors);

  /**
   * Finds the points most similar to the query vector. The metadata filter is applied before
   * ranking; points scoring below {@code scoreThreshold} are dropped even when in the top k.
   *
   * @param collection collection name
   * @param queryVector query embedding
   * @param k maximum results
   * @param filter exact-match metadata filter, empty for none
   * @param scoreThreshold minimum similarity, {@code null} for none
   * @return points best first, each with its score; vectors may be omitted
   */
  List<IndexedVector> search(
      String collection,
      float[] queryVector,
      int k,
      Map<String, Object> filter,
      Double scoreThreshold);

  /**
   * Removes points by id. Unknown ids are ignored.
   *
   * @param collection collection name
   * @param ids point ids
   */
  void delete(String collection, List<String> ids);

  /**
   * Removes every point whose {@code document_id} metadata equals {@code documentId}.
   *
   * @param collection collection name
   * @param documentId source document id
   * @return number of points removed
   */
  int deleteDocument(String collection, String documentId);

  /**
   * Stored points of one document, vectors included.
   *
   * @param collection collection name
   * @param documentId source document id
   * @return the document's points, empty when none are stored
   */
  List<IndexedVector> listDocument(String collection, String documentId);

  /**
   * Visits every stored point of a collection in batches, vectors included.
   *
   * @param collection collection name
   * @param batchConsumer receives each batch in turn
   */
  void scan(String collection, Consumer<List<IndexedVector>> batchConsumer);

  CollectionStats collectionStats(String collection);

  /** Whether the backing engine answers. Implementations must not throw. */
  boolean healthCheck();
}
