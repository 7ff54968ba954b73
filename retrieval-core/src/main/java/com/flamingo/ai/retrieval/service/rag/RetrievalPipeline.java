package com.flamingo.ai.retrieval.service.rag;

import com.flamingo.ai.retrieval.config.RagConfig;
import com.flamingo.ai.retrieval.exception.DimensionMismatchException;
import com.flamingo.ai.retrieval.exception.IngestException;
import com.flamingo.ai.retrieval.exception.RetrievalException;
import com.flamingo.ai.retrieval.service.rag.chunking.ChunkingEngine;
import com.flamingo.ai.retrieval.service.rag.embedding.EmbeddingClient;
import com.flamingo.ai.retrieval.service.rag.index.IndexStore;
import com.flamingo.ai.retrieval.service.rag.index.LexicalHit;
import com.flamingo.ai.retrieval.service.rag.model.Chunk;
import com.flamingo.ai.retrieval.service.rag.model.ChunkingStrategy;
import com.flamingo.ai.retrieval.service.rag.model.CollectionConfig;
import com.flamingo.ai.retrieval.service.rag.model.ConversationMessage;
import com.flamingo.ai.retrieval.service.rag.model.DistanceMetric;
import com.flamingo.ai.retrieval.service.rag.model.Document;
import com.flamingo.ai.retrieval.service.rag.model.EmbeddingResult;
import com.flamingo.ai.retrieval.service.rag.model.EmbeddingStats;
import com.flamingo.ai.retrieval.service.rag.model.IndexedVector;
import com.flamingo.ai.retrieval.service.rag.model.IngestReport;
import com.flamingo.ai.retrieval.service.rag.model.QueryDegradation;
import com.flamingo.ai.retrieval.service.rag.model.RetrievalRequest;
import com.flamingo.ai.retrieval.service.rag.model.RetrievalResult;
import com.flamingo.ai.retrieval.service.rag.model.RetrievalStats;
import com.flamingo.ai.retrieval.service.rag.model.RetrievalStrategy;
import com.flamingo.ai.retrieval.service.rag.model.ScoredChunk;
import com.flamingo.ai.retrieval.service.rag.model.StageOutcome;
import com.flamingo.ai.retrieval.service.rag.rerank.Reranker;
import com.google.common.collect.Lists;
import com.google.common.util.concurrent.Striped;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.DoubleAdder;
import java.util.concurrent.locks.Lock;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Hybrid retrieval over the configured collection.
 *
 * <p>Per query the lexical and vector sides run in parallel on separate pools, each with its own
 * timeout. Their candidates are fused by {@link ScoreFusion} and optionally reranked. A failed or
 * timed-out side lowers the strategy and is recorded as a {@link QueryDegradation}; only when every
 * attempted side fails is a {@link RetrievalException} thrown.
 *
 * <p>Ingest chunks a document, embeds every chunk and replaces the document's previous chunks in
 * both indices. Ingests and deletes of the same document id are serialized.
 */
@Service
@Slf4j
public class RetrievalPipeline {

  static final String CHUNK_INDEX = "chunk_index";
  static final String INDEXED_AT = "indexed_at";

  private final ChunkingEngine chunkingEngine;
  private final EmbeddingClient embeddingClient;
  private final IndexStore indexStore;
  private final ScoreFusion scoreFusion;
  private final Optional<Reranker> reranker;
  private final RagConfig ragConfig;
  private final MeterRegistry meterRegistry;
  private final Executor ioExecutor;
  private final Executor lexicalExecutor;
  private final Executor ingestExecutor;

  private final Striped<Lock> documentLocks = Striped.lock(64);
  private final AtomicLong totalQueries = new AtomicLong();
  private final DoubleAdder totalLatencyMs = new DoubleAdder();

  public RetrievalPipeline(
      ChunkingEngine chunkingEngine,
      EmbeddingClient embeddingClient,
      IndexStore indexStore,
      ScoreFusion scoreFusion,
      Optional<Reranker> reranker,
      RagConfig ragConfig,
      MeterRegistry meterRegistry,
      @Qualifier("retrievalIoExecutor") Executor ioExecutor,
      @Qualifier("lexicalSearchExecutor") Executor lexicalExecutor,
      @Qualifier("ingestExecutor") Executor ingestExecutor) {
    this.chunkingEngine = chunkingEngine;
    this.embeddingClient = embeddingClient;
    this.indexStore = indexStore;
    this.scoreFusion = scoreFusion;
    this.reranker = reranker;
    this.ragConfig = ragConfig;
    this.meterRegistry = meterRegistry;
    this.ioExecutor = ioExecutor;
    this.lexicalExecutor = lexicalExecutor;
    this.ingestExecutor = ingestExecutor;
  }

  /**
   * Creates the configured collection when the application starts. A backend that is down at
   * startup is not fatal; creation is retried on first use.
   */
  @PostConstruct
  public void initializeCollection() {
    try {
      ensureCollection();
      log.info(
          "Retrieval pipeline ready: collection={}, reranker={}",
          collection(),
          reranker.isPresent() ? "enabled" : "disabled");
    } catch (RuntimeException e) {
      log.warn(
          "Could not initialize collection {} at startup, will retry on first use: {}",
          collection(),
          e.getMessage());
    }
  }

  /**
   * Indexes a document with the configured chunking strategy.
   *
   * @return number of chunks indexed
   */
  public int indexDocument(Document document) {
    return indexDocument(document, null);
  }

  /**
   * Chunks, embeds and indexes one document, replacing any previous version of it.
   *
   * @param document the document
   * @param strategy chunking strategy, {@code null} for the configured one
   * @return number of chunks indexed
   * @throws IngestException when chunking, embedding or indexing fails
   * @throws DimensionMismatchException when the embeddings do not fit the collection
   */
  public int indexDocument(Document document, ChunkingStrategy strategy) {
    Lock lock = documentLocks.get(document.id());
    lock.lock();
    try {
      List<Chunk> chunks =
          strategy == null
              ? chunkingEngine.chunk(document)
              : chunkingEngine.chunk(document, strategy);
      return indexChunks(document.id(), chunks);
    } catch (IngestException | DimensionMismatchException e) {
      meterRegistry.counter("rag.ingest.failures").increment();
      throw e;
    } catch (RuntimeException e) {
      meterRegistry.counter("rag.ingest.failures").increment();
      log.error("Failed to index document {}: {}", document.id(), e.getMessage());
      throw new IngestException(
          document.id(), "Failed to index document " + document.id() + ": " + e.getMessage(), e);
    } finally {
      lock.unlock();
    }
  }

  /**
   * Indexes documents in bounded partitions. A failing document is reported and does not affect the
   * others.
   *
   * @param documents documents to index
   * @param strategy chunking strategy, {@code null} for the configured one
   * @return chunk counts and failures per document id
   */
  public IngestReport indexDocuments(List<Document> documents, ChunkingStrategy strategy) {
    Map<String, Integer> indexed = new LinkedHashMap<>();
    Map<String, String> failures = new LinkedHashMap<>();
    int batchSize = Math.max(1, ragConfig.getIngest().getBatchSize());

    for (List<Document> batch : Lists.partition(documents, batchSize)) {
      List<CompletableFuture<StageOutcome<Integer>>> futures = new ArrayList<>(batch.size());
      for (Document document : batch) {
        futures.add(
            submit(() -> indexDocument(document, strategy), ingestExecutor)
                .handle(StageOutcome::of));
      }
      for (int i = 0; i < batch.size(); i++) {
        String documentId = batch.get(i).id();
        StageOutcome<Integer> outcome = futures.get(i).join();
        if (outcome.succeeded()) {
          indexed.put(documentId, outcome.value());
        } else {
          failures.put(documentId, String.valueOf(outcome.error().getMessage()));
        }
      }
    }

    IngestReport report = new IngestReport(indexed, failures);
    log.info(
        "Batch ingest complete: {} documents indexed ({} chunks), {} failed",
        indexed.size(),
        report.totalChunks(),
        failures.size());
    return report;
  }

  /**
   * Indexes a conversation as groups of consecutive messages, replacing any earlier indexing of
   * the same conversation.
   *
   * @param conversationId id used as the document id of every chunk
   * @param messages messages in order
   * @return number of chunks indexed
   */
  public int indexConversation(String conversationId, List<ConversationMessage> messages) {
    Lock lock = documentLocks.get(conversationId);
    lock.lock();
    try {
      List<Chunk> chunks =
          chunkingEngine.chunkConversation(
              conversationId,
              messages,
              ragConfig.getChunking().getConversationMessagesPerChunk());
      return indexChunks(conversationId, chunks);
    } catch (IngestException | DimensionMismatchException e) {
      meterRegistry.counter("rag.ingest.failures").increment();
      throw e;
    } catch (RuntimeException e) {
      meterRegistry.counter("rag.ingest.failures").increment();
      log.error("Failed to index conversation {}: {}", conversationId, e.getMessage());
      throw new IngestException(
          conversationId, "Failed to index conversation " + conversationId, e);
    } finally {
      lock.unlock();
    }
  }

  /**
   * Removes every chunk of a document from both indices.
   *
   * @return number of chunks removed
   */
  public int deleteDocument(String documentId) {
    Lock lock = documentLocks.get(documentId);
    lock.lock();
    try {
      ensureCollection();
      int removed = indexStore.deleteDocument(collection(), documentId);
      meterRegistry.counter("rag.ingest.deleted").increment(removed);
      return removed;
    } finally {
      lock.unlock();
    }
  }

  private int indexChunks(String documentId, List<Chunk> chunks) {
    long start = System.nanoTime();
    ensureCollection();

    List<EmbeddingResult> embeddings =
        embeddingClient.embedBatch(chunks.stream().map(Chunk::text).toList());
    if (embeddings.size() != chunks.size()) {
      throw new IngestException(
          documentId,
          "Embedding count " + embeddings.size() + " does not match chunk count " + chunks.size());
    }

    String indexedAt = Instant.now().toString();
    List<IndexedVector> vectors = new ArrayList<>(chunks.size());
    for (int i = 0; i < chunks.size(); i++) {
      Chunk chunk = chunks.get(i);
      Map<String, Object> metadata = new HashMap<>(chunk.metadata());
      metadata.put(ChunkingEngine.DOCUMENT_ID, documentId);
      metadata.put(CHUNK_INDEX, chunk.index());
      metadata.put(INDEXED_AT, indexedAt);
      float[] vector = embeddings.get(i).vector();
      vectors.add(new IndexedVector(chunk.id(), vector, chunk.text(), metadata));
    }

    indexStore.replaceDocument(collection(), documentId, vectors);

    long cachedCount = embeddings.stream().filter(EmbeddingResult::fromCache).count();
    long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
    meterRegistry.counter("rag.ingest.documents").increment();
    meterRegistry.counter("rag.ingest.chunks").increment(chunks.size());
    log.info(
        "Indexed document {}: {} chunks ({} embeddings from cache) in {}ms",
        documentId,
        chunks.size(),
        cachedCount,
        elapsedMs);
    return chunks.size();
  }

  /**
   * Retrieves the best chunks for a query.
   *
   * @param query raw query
   * @param k number of results
   * @param useHybrid run the lexical side alongside the vector side
   * @param useRerank rerank fused candidates when a reranker is available
   * @param filter exact-match metadata filter, {@code null} or empty for none
   * @param alpha lexical weight in [0, 1], {@code null} for the configured one
   */
  public RetrievalResult retrieve(
      String query,
      int k,
      boolean useHybrid,
      boolean useRerank,
      Map<String, Object> filter,
      Double alpha) {
    return retrieve(
        RetrievalRequest.builder()
            .query(query)
            .k(k)
            .useHybrid(useHybrid)
            .useRerank(useRerank)
            .filter(filter)
            .alpha(alpha)
            .build());
  }

  /**
   * Retrieves the best chunks for a query.
   *
   * @throws RetrievalException when every attempted search path failed
   */
  public RetrievalResult retrieve(RetrievalRequest request) {
    Timer.Sample sample = Timer.start(meterRegistry);
    long start = System.nanoTime();
    RagConfig.Retrieval cfg = ragConfig.getRetrieval();
    int k = request.k() == null ? cfg.getTopK() : request.k();
    double alpha = request.alpha() == null ? cfg.getAlpha() : request.alpha();
    if (k < 1) {
      throw new IllegalArgumentException("k must be at least 1, was " + k);
    }
    if (alpha < 0.0 || alpha > 1.0) {
      throw new IllegalArgumentException("alpha must be within [0, 1], was " + alpha);
    }
    String query = request.query();
    if (query == null || query.isBlank()) {
      log.debug("Blank query, returning no results");
      return finish(sample, start, query, List.of(), RetrievalStrategy.VECTOR, 0, Set.of());
    }

    ensureCollection();
    String collection = collection();
    int candidates = k * Math.max(1, cfg.getCandidatesMultiplier());
    Map<String, Object> filter = request.filter();
    Set<QueryDegradation> degradations = EnumSet.noneOf(QueryDegradation.class);

    boolean lexicalAttempted = request.useHybrid() && indexStore.lexicalSize(collection) > 0;
    boolean vectorAttempted = !lexicalAttempted || indexStore.healthCheck();
    if (!vectorAttempted) {
      log.warn("Vector index unhealthy, answering '{}' from the lexical index only", query);
      degradations.add(QueryDegradation.VECTOR_FAILED);
    }

    CompletableFuture<StageOutcome<List<LexicalHit>>> lexicalFuture =
        lexicalAttempted
            ? lexicalSearch(collection, query, candidates, filter, cfg.getLexicalTimeout())
            : CompletableFuture.completedFuture(StageOutcome.success(List.of()));
    CompletableFuture<StageOutcome<List<IndexedVector>>> vectorFuture =
        vectorAttempted
            ? vectorSearch(collection, query, candidates, filter, cfg)
            : CompletableFuture.completedFuture(StageOutcome.success(List.of()));

    StageOutcome<List<LexicalHit>> lexical = lexicalFuture.join();
    StageOutcome<List<IndexedVector>> vector = vectorFuture.join();

    boolean lexicalOk = lexicalAttempted && lexical.succeeded();
    boolean vectorOk = vectorAttempted && vector.succeeded();
    if (lexicalAttempted && !lexicalOk) {
      degradations.add(
          lexical.timedOut() ? QueryDegradation.LEXICAL_TIMEOUT : QueryDegradation.LEXICAL_FAILED);
      log.warn("Lexical search failed for '{}': {}", query, describe(lexical.error()));
    }
    if (vectorAttempted && !vectorOk) {
      degradations.add(
          vector.timedOut() ? QueryDegradation.VECTOR_TIMEOUT : QueryDegradation.VECTOR_FAILED);
      log.warn("Vector search failed for '{}': {}", query, describe(vector.error()));
    }
    if (!lexicalOk && !vectorOk) {
      meterRegistry.counter("rag.retrieve.failures").increment();
      Throwable cause = vectorAttempted ? vector.error() : lexical.error();
      throw new RetrievalException("All retrieval paths failed for query: " + query, cause);
    }

    RetrievalStrategy strategy;
    double effectiveAlpha;
    if (lexicalOk && vectorOk) {
      strategy = RetrievalStrategy.HYBRID;
      effectiveAlpha = alpha;
    } else if (lexicalOk) {
      strategy = RetrievalStrategy.LEXICAL;
      effectiveAlpha = 1.0;
    } else {
      strategy = RetrievalStrategy.VECTOR;
      effectiveAlpha = 0.0;
    }

    List<ScoredChunk> fused =
        scoreFusion.fuse(
            lexicalOk ? lexical.value() : List.of(),
            vectorOk ? vector.value() : List.of(),
            effectiveAlpha);
    int examined = fused.size();

    List<ScoredChunk> ranked = fused;
    if (request.useRerank() && !fused.isEmpty()) {
      Optional<List<ScoredChunk>> reranked = rerank(query, fused, k, degradations);
      if (reranked.isPresent()) {
        ranked = reranked.get();
        strategy = strategy.withRerank();
      }
    }

    List<ScoredChunk> top = ranked.size() > k ? ranked.subList(0, k) : ranked;
    return finish(sample, start, query, top, strategy, examined, degradations);
  }

  private CompletableFuture<StageOutcome<List<LexicalHit>>> lexicalSearch(
      String collection,
      String query,
      int candidates,
      Map<String, Object> filter,
      Duration timeout) {
    return submit(
            () -> indexStore.lexicalSearch(collection, query, candidates, filter), lexicalExecutor)
        .orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS)
        .handle(StageOutcome::of);
  }

  private CompletableFuture<StageOutcome<List<IndexedVector>>> vectorSearch(
      String collection,
      String query,
      int candidates,
      Map<String, Object> filter,
      RagConfig.Retrieval cfg) {
    return submit(() -> embeddingClient.embed(query).vector(), ioExecutor)
        .orTimeout(cfg.getEmbeddingTimeout().toMillis(), TimeUnit.MILLISECONDS)
        .thenCompose(
            queryVector ->
                submit(
                        () -> indexStore.search(collection, queryVector, candidates, filter, null),
                        ioExecutor)
                    .orTimeout(cfg.getVectorTimeout().toMillis(), TimeUnit.MILLISECONDS))
        .handle(StageOutcome::of);
  }

  /**
   * Reranks the head of the fused list. Returns empty when the reranker is absent, fails or times
   * out, after recording the degradation.
   */
  private Optional<List<ScoredChunk>> rerank(
      String query, List<ScoredChunk> fused, int k, Set<QueryDegradation> degradations) {
    if (reranker.isEmpty()) {
      degradations.add(QueryDegradation.RERANK_UNAVAILABLE);
      log.debug("Rerank requested but no reranker is configured");
      return Optional.empty();
    }
    RagConfig.Retrieval cfg = ragConfig.getRetrieval();
    int poolSize = Math.min(Math.min(2 * k, cfg.getMaxRerankCandidates()), fused.size());
    List<ScoredChunk> pool = fused.subList(0, poolSize);
    List<String> texts = pool.stream().map(ScoredChunk::text).toList();

    StageOutcome<List<Reranker.RerankScore>> outcome =
        submit(() -> reranker.get().rerank(query, texts, k), ioExecutor)
            .orTimeout(cfg.getRerankTimeout().toMillis(), TimeUnit.MILLISECONDS)
            .handle(StageOutcome::of)
            .join();
    if (!outcome.succeeded()) {
      degradations.add(
          outcome.timedOut() ? QueryDegradation.RERANK_TIMEOUT : QueryDegradation.RERANK_FAILED);
      meterRegistry.counter("rag.reranker.fallback").increment();
      log.warn(
          "Reranking failed for '{}', keeping fused order: {}", query, describe(outcome.error()));
      return Optional.empty();
    }

    List<ScoredChunk> reranked =
        outcome.value().stream()
            .filter(score -> score.index() >= 0 && score.index() < pool.size())
            .map(score -> pool.get(score.index()).withScore(score.relevanceScore()))
            .toList();
    log.debug("Reranked {} candidates into {}", pool.size(), reranked.size());
    return Optional.of(reranked);
  }

  /** Runs a task on an executor; a rejected submission yields a failed future. */
  private static <T> CompletableFuture<T> submit(Supplier<T> task, Executor executor) {
    try {
      return CompletableFuture.supplyAsync(task, executor);
    } catch (RejectedExecutionException e) {
      log.warn("Executor rejected task: {}", e.getMessage());
      return CompletableFuture.failedFuture(e);
    }
  }

  private RetrievalResult finish(
      Timer.Sample sample,
      long start,
      String query,
      List<ScoredChunk> chunks,
      RetrievalStrategy strategy,
      int examined,
      Set<QueryDegradation> degradations) {
    long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
    sample.stop(meterRegistry.timer("rag.retrieve", "strategy", strategy.label()));
    totalQueries.incrementAndGet();
    totalLatencyMs.add(elapsedMs);
    if (!degradations.isEmpty()) {
      meterRegistry.counter("rag.retrieve.degraded").increment();
    }
    log.info(
        "Retrieved {} chunks for '{}' via {} in {}ms ({} candidates{})",
        chunks.size(),
        query,
        strategy,
        elapsedMs,
        examined,
        degradations.isEmpty() ? "" : ", degraded: " + degradations);
    return new RetrievalResult(query, chunks, elapsedMs, strategy, examined, degradations);
  }

  /** Drops every chunk of a collection on both the vector and the lexical side. */
  public void clearIndex(String collection) {
    if (collection().equals(collection)) {
      ensureCollection();
    }
    indexStore.clear(collection);
    meterRegistry.counter("rag.index.cleared").increment();
  }

  public RetrievalStats stats() {
    long queries = totalQueries.get();
    double avgLatency = queries == 0 ? 0.0 : totalLatencyMs.sum() / queries;
    EmbeddingStats embeddingStats = embeddingClient.stats();
    String collection = collection();
    long indexed = indexStore.hasCollection(collection) ? indexStore.lexicalSize(collection) : 0;
    return new RetrievalStats(
        queries,
        avgLatency,
        indexed,
        embeddingStats.cacheHitRate(),
        embeddingStats.totalCost());
  }

  private void ensureCollection() {
    if (!indexStore.hasCollection(collection())) {
      createCollection();
    }
  }

  private synchronized void createCollection() {
    String name = collection();
    if (indexStore.hasCollection(name)) {
      return;
    }
    CollectionConfig config =
        new CollectionConfig(
            name,
            embeddingClient.dimensions(),
            DistanceMetric.fromName(ragConfig.getIndex().getDistanceMetric()));
    indexStore.createCollection(config, false);
    log.info(
        "Created collection {} ({} dimensions, {})",
        name,
        config.dimensions(),
        config.distanceMetric());
  }

  private String collection() {
    return ragConfig.getIndex().getCollection();
  }

  private static String describe(Throwable error) {
    if (error == null) {
      return "unknown";
    }
    return error.getClass().getSimpleName() + ": " + error.getMessage();
  }
}
