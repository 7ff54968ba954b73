package com.flamingo.ai.retrieval.service.rag.index;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;
import lombok.extern.slf4j.Slf4j;

/**
 * The chunk set of one collection and its published BM25 snapshot.
 *
 * <p>Writers are serialized; each write copies the chunk set, builds a new {@link LexicalIndex} and
 * swaps it in. Readers take the current snapshot without locking and never observe a partially
 * built index.
 */
@Slf4j
public class LexicalCorpus {

  private final String collection;
  private final LexicalTokenizer tokenizer;
  private final Map<String, LexicalDocument> documents = new LinkedHashMap<>();
  private final AtomicReference<LexicalIndex> snapshot;
  private long version;

  public LexicalCorpus(String collection, LexicalTokenizer tokenizer) {
    this.collection = collection;
    this.tokenizer = tokenizer;
    this.snapshot = new AtomicReference<>(LexicalIndex.empty(tokenizer));
  }

  /** Current snapshot; safe to search concurrently with writes. */
  public LexicalIndex snapshot() {
    return snapshot.get();
  }

  public synchronized void upsert(Collection<LexicalDocument> entries) {
    if (entries.isEmpty()) {
      return;
    }
    entries.forEach(entry -> documents.put(entry.id(), entry));
    publish();
  }

  public synchronized void remove(Collection<String> ids) {
    boolean changed = false;
    for (String id : ids) {
      changed |= documents.remove(id) != null;
    }
    if (changed) {
      publish();
    }
  }

  /**
   * Replaces every chunk of a document with a new set in a single publish.
   *
   * @param documentId document whose chunks are replaced
   * @param entries the document's new chunks
   */
  public synchronized void replaceDocument(String documentId, Collection<LexicalDocument> entries) {
    documents.values().removeIf(entry -> Objects.equals(entry.documentId(), documentId));
    entries.forEach(entry -> documents.put(entry.id(), entry));
    publish();
  }

  /**
   * Removes every chunk of a document.
   *
   * @return number of chunks removed
   */
  public synchronized int removeDocument(String documentId) {
    int before = documents.size();
    documents.values().removeIf(entry -> Objects.equals(entry.documentId(), documentId));
    int removed = before - documents.size();
    if (removed > 0) {
      publish();
    }
    return removed;
  }

  /** Replaces the whole chunk set, e.g. when reloading a collection from the vector index. */
  public synchronized void rebuild(Collection<LexicalDocument> entries) {
    documents.clear();
    entries.forEach(entry -> documents.put(entry.id(), entry));
    publish();
  }

  /** Ids of the chunks currently indexed for a document. */
  public synchronized List<String> idsForDocument(String documentId) {
    return documents.values().stream()
        .filter(entry -> Objects.equals(entry.documentId(), documentId))
        .map(LexicalDocument::id)
        .toList();
  }

  public synchronized void clear() {
    documents.clear();
    publish();
  }

  public int size() {
    return snapshot.get().size();
  }

  private void publish() {
    version++;
    LexicalIndex next = LexicalIndex.build(version, List.copyOf(documents.values()), tokenizer);
    snapshot.set(next);
    log.debug(
        "Published lexical snapshot v{} for {}: {} chunks, {} terms",
        version,
        collection,
        next.size(),
        next.vocabularySize());
  }
}
