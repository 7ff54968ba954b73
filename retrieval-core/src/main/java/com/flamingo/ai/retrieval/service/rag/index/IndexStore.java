package com.flamingo.ai.retrieval.service.rag.index;

import com.flamingo.ai.retrieval.exception.DimensionMismatchException;
import com.flamingo.ai.retrieval.service.rag.chunking.ChunkingEngine;
import com.flamingo.ai.retrieval.service.rag.model.CollectionConfig;
import com.flamingo.ai.retrieval.service.rag.model.CollectionStats;
import com.flamingo.ai.retrieval.service.rag.model.IndexedVector;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Keeps the vector index and the in-process lexical index in step.
 *
 * <p>Every successful vector write is mirrored to the lexical corpus of the same collection, and
 * dimensions are checked before anything is written.
 */
@Service
@Slf4j
public class IndexStore {

  private final VectorIndex vectorIndex;
  private final LexicalTokenizer lexicalTokenizer;
  private final MeterRegistry meterRegistry;
  private final Map<String, CollectionConfig> collections = new ConcurrentHashMap<>();
  private final Map<String, LexicalCorpus> corpora = new ConcurrentHashMap<>();

  public IndexStore(
      VectorIndex vectorIndex, LexicalTokenizer lexicalTokenizer, MeterRegistry meterRegistry) {
    this.vectorIndex = vectorIndex;
    this.lexicalTokenizer = lexicalTokenizer;
    this.meterRegistry = meterRegistry;
  }

  /**
   * Creates a collection on the vector side and registers its lexical corpus. The first time a
   * collection is opened without {@code recreate}, the lexical corpus is rebuilt from the points
   * already stored in the vector index.
   *
   * @param config collection shape
   * @param recreate drop existing points on both sides
   */
  public void createCollection(CollectionConfig config, boolean recreate) {
    vectorIndex.createCollection(config, recreate);
    boolean known = collections.containsKey(config.name());
    LexicalCorpus corpus = corpus(config.name());
    if (recreate) {
      corpus.clear();
    } else if (!known) {
      rebuildLexical(config.name(), corpus);
    }
    collections.put(config.name(), config);
  }

  public boolean hasCollection(String collection) {
    return collections.containsKey(collection);
  }

  /**
   * Writes points to the vector index, then mirrors them to the lexical index.
   *
   * @param collection collection name
   * @param vectors points with the collection's dimension
   * @throws DimensionMismatchException before any write when a vector has the wrong length
   */
  public void upsert(String collection, List<IndexedVector> vectors) {
    if (vectors.isEmpty()) {
      return;
    }
    checkDimensions(collection, vectors);
    vectorIndex.upsert(collection, vectors);
    corpus(collection).upsert(vectors.stream().map(IndexStore::toLexical).toList());
    meterRegistry
        .counter("vector_index.upserted", "collection", collection)
        .increment(vectors.size());
  }

  /**
   * Replaces all chunks of one document. New points are written first, then the stale chunks of
   * the previous version are deleted, then the lexical side is swapped in one publish.
   *
   * <p>The previous version is read from the vector index before anything is written. If a vector
   * write fails, points added by this call are removed and the previous points are written back;
   * the lexical side is not touched. The failure is rethrown.
   *
   * @param collection collection name
   * @param documentId document being replaced
   * @param vectors the document's complete new chunk set
   */
  public void replaceDocument(String collection, String documentId, List<IndexedVector> vectors) {
    checkDimensions(collection, vectors);
    LexicalCorpus corpus = corpus(collection);
    List<IndexedVector> previous = vectorIndex.listDocument(collection, documentId);
    Set<String> previousIds = new LinkedHashSet<>();
    previous.forEach(v -> previousIds.add(v.id()));
    previousIds.addAll(corpus.idsForDocument(documentId));
    Set<String> fresh = new LinkedHashSet<>();
    vectors.forEach(v -> fresh.add(v.id()));
    List<String> stale = previousIds.stream().filter(id -> !fresh.contains(id)).toList();

    try {
      if (!vectors.isEmpty()) {
        vectorIndex.upsert(collection, vectors);
      }
      if (!stale.isEmpty()) {
        vectorIndex.delete(collection, stale);
      }
    } catch (RuntimeException e) {
      restore(collection, documentId, previous, previousIds, fresh, e);
      throw e;
    }

    corpus.replaceDocument(documentId, vectors.stream().map(IndexStore::toLexical).toList());
    meterRegistry
        .counter("vector_index.upserted", "collection", collection)
        .increment(vectors.size());
    log.debug(
        "Replaced document {} in {}: {} chunks written, {} stale removed",
        documentId,
        collection,
        vectors.size(),
        stale.size());
  }

  /**
   * Vector similarity search.
   *
   * @throws DimensionMismatchException when the query vector has the wrong length
   */
  public List<IndexedVector> search(
      String collection,
      float[] queryVector,
      int k,
      Map<String, Object> filter,
      Double scoreThreshold) {
    CollectionConfig config = collections.get(collection);
    if (config != null && queryVector.length != config.dimensions()) {
      throw new DimensionMismatchException(collection, config.dimensions(), queryVector.length);
    }
    return vectorIndex.search(collection, queryVector, k, filter, scoreThreshold);
  }

  /**
   * BM25 search over the collection's current lexical snapshot.
   *
   * @param collection collection name
   * @param query raw query text
   * @param k maximum results
   * @param filter exact-match metadata filter, empty for none
   * @return chunks with positive score, best first
   */
  public List<LexicalHit> lexicalSearch(
      String collection, String query, int k, Map<String, Object> filter) {
    return corpus(collection).snapshot().search(query, k, filter);
  }

  /** Number of chunks in the collection's lexical index. */
  public int lexicalSize(String collection) {
    return corpus(collection).size();
  }

  /**
   * Removes points from both indices.
   *
   * @param collection collection name
   * @param ids chunk ids
   */
  public void delete(String collection, List<String> ids) {
    if (ids.isEmpty()) {
      return;
    }
    vectorIndex.delete(collection, ids);
    corpus(collection).remove(ids);
    meterRegistry.counter("vector_index.deleted", "collection", collection).increment(ids.size());
  }

  /**
   * Removes every chunk of a document from both indices. The vector side is queried by document
   * id, so chunks written by an earlier process are removed as well.
   *
   * @return number of chunks removed from the vector index
   */
  public int deleteDocument(String collection, String documentId) {
    int removed = vectorIndex.deleteDocument(collection, documentId);
    int lexicalRemoved = corpus(collection).removeDocument(documentId);
    meterRegistry.counter("vector_index.deleted", "collection", collection).increment(removed);
    log.info(
        "Deleted document {} from {}: {} vector chunks, {} lexical chunks",
        documentId,
        collection,
        removed,
        lexicalRemoved);
    return removed;
  }

  /** Drops every point of a collection on both sides and recreates it empty. */
  public void clear(String collection) {
    CollectionConfig config = collections.get(collection);
    if (config == null) {
      throw new IllegalStateException("Collection not found: " + collection);
    }
    createCollection(config, true);
    log.info("Cleared collection {}", collection);
  }

  public CollectionStats collectionStats(String collection) {
    return vectorIndex.collectionStats(collection);
  }

  /** Whether the vector backend answers. Never throws. */
  public boolean healthCheck() {
    try {
      return vectorIndex.healthCheck();
    } catch (RuntimeException e) {
      log.warn("Vector index health check failed: {}", e.getMessage());
      return false;
    }
  }

  private void restore(
      String collection,
      String documentId,
      List<IndexedVector> previous,
      Set<String> previousIds,
      Set<String> fresh,
      RuntimeException cause) {
    log.error(
        "Vector write failed for document {} in {}, restoring {} previous chunks: {}",
        documentId,
        collection,
        previous.size(),
        cause.getMessage());
    meterRegistry.counter("vector_index.rollback", "collection", collection).increment();
    List<String> added = fresh.stream().filter(id -> !previousIds.contains(id)).toList();
    List<IndexedVector> restorable = previous.stream().filter(v -> v.vector() != null).toList();
    if (restorable.size() < previous.size()) {
      log.warn(
          "{} previous chunks of document {} came back without vectors and cannot be restored",
          previous.size() - restorable.size(),
          documentId);
    }
    try {
      if (!added.isEmpty()) {
        vectorIndex.delete(collection, added);
      }
      if (!restorable.isEmpty()) {
        vectorIndex.upsert(collection, restorable);
      }
    } catch (RuntimeException restoreFailure) {
      cause.addSuppressed(restoreFailure);
      log.error(
          "Restoring document {} in {} failed: {}",
          documentId,
          collection,
          restoreFailure.getMessage());
    }
  }

  private void rebuildLexical(String collection, LexicalCorpus corpus) {
    List<LexicalDocument> entries = new ArrayList<>();
    vectorIndex.scan(collection, batch -> batch.forEach(v -> entries.add(toLexical(v))));
    if (entries.isEmpty()) {
      return;
    }
    corpus.rebuild(entries);
    log.info("Rebuilt lexical index for {} from {} stored chunks", collection, entries.size());
  }

  private void checkDimensions(String collection, List<IndexedVector> vectors) {
    CollectionConfig config = collections.get(collection);
    if (config == null) {
      throw new IllegalStateException("Collection not found: " + collection);
    }
    for (IndexedVector vector : vectors) {
      int actual = vector.vector() == null ? 0 : vector.vector().length;
      if (actual != config.dimensions()) {
        throw new DimensionMismatchException(collection, config.dimensions(), actual);
      }
    }
  }

  private LexicalCorpus corpus(String collection) {
    return corpora.computeIfAbsent(collection, name -> new LexicalCorpus(name, lexicalTokenizer));
  }

  private static LexicalDocument toLexical(IndexedVector vector) {
    Object documentId = vector.metadata().get(ChunkingEngine.DOCUMENT_ID);
    return new LexicalDocument(
        vector.id(),
        documentId == null ? null : documentId.toString(),
        vector.text(),
        vector.metadata());
  }
}
