package com.flamingo.ai.retrieval.service.rag.rerank;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flamingo.ai.retrieval.config.RagConfig;
import java.time.Duration;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * Blocking client for the {@code /rerank} endpoint of a Hugging Face TEI (Text Embeddings
 * Inference) cross-encoder container.
 */
@Component
@ConditionalOnProperty(name = "rag.reranking.enabled", havingValue = "true", matchIfMissing = true)
@Slf4j
public class TeiRerankerClient {

  static final String RERANK_PATH = "/rerank";

  private static final int MAX_RESPONSE_BYTES = 2 * 1024 * 1024;
  private static final ParameterizedTypeReference<List<RerankResult>> RESULT_LIST =
      new ParameterizedTypeReference<>() {};

  private final WebClient webClient;
  private final RagConfig.Reranking.Tei tei;

  public TeiRerankerClient(RagConfig ragConfig, WebClient.Builder webClientBuilder) {
    this.tei = ragConfig.getReranking().getTei();
    this.webClient =
        webClientBuilder
            .clone()
            .baseUrl(tei.getBaseUrl())
            .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(MAX_RESPONSE_BYTES))
            .build();
    log.info("TEI reranker client for {} at {}", tei.getModelId(), tei.getBaseUrl());
  }

  /**
   * Scores every text against the query in a single request.
   *
   * @param query the search query
   * @param texts candidate texts, addressed by position in the response
   * @return one result per text in TEI's order, or {@code null} when TEI sent no body
   */
  public List<RerankResult> rerank(String query, List<String> texts) {
    RerankRequest request =
        new RerankRequest(query, texts, tei.isRawScores(), tei.isTruncate());
    List<RerankResult> results =
        webClient
            .post()
            .uri(RERANK_PATH)
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(request)
            .retrieve()
            .bodyToMono(RESULT_LIST)
            .timeout(Duration.ofMillis(tei.getReadTimeoutMs()))
            .block();
    log.debug(
        "TEI scored {} texts, {} results", texts.size(), results == null ? 0 : results.size());
    return results;
  }

  record RerankRequest(
      String query,
      List<String> texts,
      @JsonProperty("raw_scores") boolean rawScores,
      boolean truncate) {}

  /** One element of the TEI rerank response. */
  public record RerankResult(int index, double score) {}
}
