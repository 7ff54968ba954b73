package com.flamingo.ai.retrieval.service.rag;

import com.flamingo.ai.retrieval.service.rag.chunking.ChunkingEngine;
import com.flamingo.ai.retrieval.service.rag.index.LexicalHit;
import com.flamingo.ai.retrieval.service.rag.model.IndexedVector;
import com.flamingo.ai.retrieval.service.rag.model.ScoredChunk;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Weighted linear fusion of lexical and vector candidates.
 *
 * <p>Each list is normalized by its own maximum score, so both sides land in [0, 1]. A list whose
 * scores are all zero stays zero, and negative similarities count as zero. The fused score of a
 * candidate is {@code alpha * lexical + (1 - alpha) * vector}, with 0 for the side that did not
 * return it.
 */
@Component
@Slf4j
public class ScoreFusion {

  private static final Comparator<ScoredChunk> BY_SCORE_THEN_ID =
      Comparator.comparingDouble(ScoredChunk::score).reversed().thenComparing(ScoredChunk::id);

  /**
   * Fuses both candidate lists.
   *
   * @param lexicalHits BM25 hits, any order
   * @param vectorHits similarity hits with scores set
   * @param alpha lexical weight in [0, 1]
   * @return the union of candidates, best first, ties broken by id
   */
  public List<ScoredChunk> fuse(
      List<LexicalHit> lexicalHits, List<IndexedVector> vectorHits, double alpha) {
    if (alpha < 0.0 || alpha > 1.0) {
      throw new IllegalArgumentException("alpha must be within [0, 1], was " + alpha);
    }
    double lexicalMax = lexicalHits.stream().mapToDouble(LexicalHit::score).max().orElse(0.0);
    double vectorMax = vectorHits.stream().mapToDouble(ScoreFusion::vectorScore).max().orElse(0.0);

    Map<String, Candidate> candidates = new LinkedHashMap<>();
    for (LexicalHit hit : lexicalHits) {
      var doc = hit.document();
      Candidate candidate =
          candidates.computeIfAbsent(
              doc.id(), id -> new Candidate(id, doc.documentId(), doc.text(), doc.metadata()));
      candidate.lexical = normalize(hit.score(), lexicalMax);
    }
    for (IndexedVector hit : vectorHits) {
      Candidate candidate =
          candidates.computeIfAbsent(
              hit.id(), id -> new Candidate(id, documentId(hit), hit.text(), hit.metadata()));
      candidate.vector = normalize(vectorScore(hit), vectorMax);
    }

    List<ScoredChunk> fused =
        candidates.values().stream()
            .map(c -> c.toScoredChunk(alpha))
            .sorted(BY_SCORE_THEN_ID)
            .toList();
    log.debug(
        "Fused {} lexical and {} vector candidates into {} (alpha={})",
        lexicalHits.size(),
        vectorHits.size(),
        fused.size(),
        alpha);
    return fused;
  }

  private static double normalize(double score, double max) {
    return max > 0.0 ? Math.max(0.0, score / max) : 0.0;
  }

  private static double vectorScore(IndexedVector hit) {
    return hit.score() == null ? 0.0 : hit.score();
  }

  private static String documentId(IndexedVector hit) {
    Object documentId = hit.metadata().get(ChunkingEngine.DOCUMENT_ID);
    return documentId == null ? null : documentId.toString();
  }

  private static final class Candidate {
    private final String id;
    private final String documentId;
    private final String text;
    private final Map<String, Object> metadata;
    private double lexical;
    private double vector;

    private Candidate(String id, String documentId, String text, Map<String, Object> metadata) {
      this.id = id;
      this.documentId = documentId;
      this.text = text;
      this.metadata = metadata;
    }

    private ScoredChunk toScoredChunk(double alpha) {
      double score = alpha * lexical + (1.0 - alpha) * vector;
      return new ScoredChunk(id, documentId, text, metadata, score, lexical, vector);
    }
  }
}
