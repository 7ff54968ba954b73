package com.flamingo.ai.retrieval.service.rag.index;

import com.flamingo.ai.retrieval.service.rag.model.MetadataFilter;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

/**
 * Immutable BM25 (Okapi) snapshot over a fixed set of chunks.
 *
 * <p>score(D, Q) = sum over query terms of idf(t) * tf * (k1 + 1) / (tf + k1 * (1 - b + b *
 * |D| / avgdl)), with idf(t) = ln((N - df + 0.5) / (df + 0.5) + 1). The +1 keeps idf positive, so
 * any shared term gives a positive score.
 */
public final class LexicalIndex {

  static final double K1 = 1.5;
  static final double B = 0.75;

  private final long version;
  private final Map<String, Entry> entries;
  private final Map<String, Map<String, Integer>> postings;
  private final double avgLength;
  private final LexicalTokenizer tokenizer;

  private LexicalIndex(
      long version,
      Map<String, Entry> entries,
      Map<String, Map<String, Integer>> postings,
      double avgLength,
      LexicalTokenizer tokenizer) {
    this.version = version;
    this.entries = entries;
    this.postings = postings;
    this.avgLength = avgLength;
    this.tokenizer = tokenizer;
  }

  public static LexicalIndex empty(LexicalTokenizer tokenizer) {
    return new LexicalIndex(0L, Map.of(), Map.of(), 0.0, tokenizer);
  }

  /**
   * Builds a snapshot. The input is not retained.
   *
   * @param version monotonically increasing snapshot version
   * @param documents chunks to index
   * @param tokenizer term extraction
   * @return the snapshot
   */
  public static LexicalIndex build(
      long version, Collection<LexicalDocument> documents, LexicalTokenizer tokenizer) {
    Map<String, Entry> entries = new HashMap<>(documents.size() * 2);
    Map<String, Map<String, Integer>> postings = new HashMap<>();
    long totalLength = 0;
    for (LexicalDocument document : documents) {
      List<String> terms = tokenizer.tokenize(document.text());
      Map<String, Integer> frequencies = new HashMap<>();
      for (String term : terms) {
        frequencies.merge(term, 1, Integer::sum);
      }
      for (Map.Entry<String, Integer> tf : frequencies.entrySet()) {
        postings
            .computeIfAbsent(tf.getKey(), t -> new HashMap<>())
            .put(document.id(), tf.getValue());
      }
      entries.put(document.id(), new Entry(document, terms.size()));
      totalLength += terms.size();
    }
    double avgLength = entries.isEmpty() ? 0.0 : (double) totalLength / entries.size();
    return new LexicalIndex(version, Map.copyOf(entries), postings, avgLength, tokenizer);
  }

  /**
   * Scores every chunk against the query.
   *
   * @param query raw query text
   * @param k maximum results
   * @param filter exact-match metadata filter, empty for none
   * @return chunks with a positive score, best first, ties broken by id
   */
  public List<LexicalHit> search(String query, int k, Map<String, Object> filter) {
    if (entries.isEmpty() || k <= 0) {
      return List.of();
    }
    int n = entries.size();
    Map<String, Double> scores = new HashMap<>();
    // repeated query terms count once
    for (String term : new LinkedHashSet<>(tokenizer.tokenize(query))) {
      Map<String, Integer> termPostings = postings.get(term);
      if (termPostings == null) {
        continue;
      }
      int df = termPostings.size();
      double idf = Math.log((n - df + 0.5) / (df + 0.5) + 1);
      for (Map.Entry<String, Integer> posting : termPostings.entrySet()) {
        Entry entry = entries.get(posting.getKey());
        if (!MetadataFilter.matches(entry.document().metadata(), filter)) {
          continue;
        }
        int tf = posting.getValue();
        double lengthNorm = 1 - B + B * (entry.length() / avgLength);
        scores.merge(posting.getKey(), idf * (tf * (K1 + 1)) / (tf + K1 * lengthNorm), Double::sum);
      }
    }
    return scores.entrySet().stream()
        .filter(e -> e.getValue() > 0)
        .map(e -> new LexicalHit(entries.get(e.getKey()).document(), e.getValue()))
        .sorted(
            Comparator.comparingDouble(LexicalHit::score)
                .reversed()
                .thenComparing(hit -> hit.document().id()))
        .limit(k)
        .toList();
  }

  public long version() {
    return version;
  }

  public int size() {
    return entries.size();
  }

  public boolean isEmpty() {
    return entries.isEmpty();
  }

  public int vocabularySize() {
    return postings.size();
  }

  private record Entry(LexicalDocument document, int length) {}
}
