package com.flamingo.ai.retrieval.service.rag.rerank;

import com.flamingo.ai.retrieval.exception.ProviderUnavailableException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.Comparator;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

/**
 * Cross-encoder reranker served by TEI. There is no fallback here: when TEI fails or the circuit
 * is open the exception reaches the retrieval pipeline, which keeps the fused ranking.
 */
@Service
@ConditionalOnProperty(name = "rag.reranking.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class TeiReranker implements Reranker {

  private final TeiRerankerClient teiRerankerClient;
  private final MeterRegistry meterRegistry;

  @Override
  @Timed(value = "rag.reranker.tei", description = "Time for TEI cross-encoder reranking")
  @CircuitBreaker(name = "tei")
  public List<RerankScore> rerank(String query, List<String> texts, int topN) {
    if (texts.isEmpty() || topN <= 0) {
      return List.of();
    }
    log.debug("TEI reranking {} candidates", texts.size());

    List<TeiRerankerClient.RerankResult> results;
    try {
      results = teiRerankerClient.rerank(query, texts);
    } catch (RuntimeException e) {
      meterRegistry.counter("rag.reranker.tei.failures").increment();
      throw new ProviderUnavailableException("reranker", "TEI rerank call failed", e);
    }
    if (results == null) {
      meterRegistry.counter("rag.reranker.tei.failures").increment();
      throw new ProviderUnavailableException("reranker", "TEI returned no rerank results");
    }

    List<RerankScore> scores =
        results.stream()
            .filter(r -> r.index() >= 0 && r.index() < texts.size())
            .map(r -> new RerankScore(r.index(), r.score()))
            .sorted(Comparator.comparingDouble(RerankScore::relevanceScore).reversed())
            .limit(topN)
            .toList();
    meterRegistry.counter("rag.reranker.tei.invocations").increment();
    log.debug(
        "TEI reranking complete, top score: {}",
        scores.isEmpty() ? "N/A" : String.format("%.3f", scores.get(0).relevanceScore()));
    return scores;
  }
}
