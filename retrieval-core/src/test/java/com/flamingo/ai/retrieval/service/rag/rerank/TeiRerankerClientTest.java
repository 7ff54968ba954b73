package com.flamingo.ai.retrieval.service.rag.rerank;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.flamingo.ai.retrieval.config.RagConfig;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

@DisplayName("TeiRerankerClient Tests")
class TeiRerankerClientTest {

  private RagConfig ragConfig;
  private AtomicReference<ClientRequest> lastRequest;

  @BeforeEach
  void setUp() {
    ragConfig = new RagConfig();
    ragConfig.getReranking().getTei().setBaseUrl("http://tei.local:8090");
    lastRequest = new AtomicReference<>();
  }

  private TeiRerankerClient clientAnswering(HttpStatus status, String body) {
    WebClient.Builder builder =
        WebClient.builder()
            .exchangeFunction(
                request -> {
                  lastRequest.set(request);
                  return Mono.just(
                      ClientResponse.create(status)
                          .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                          .body(body)
                          .build());
                });
    return new TeiRerankerClient(ragConfig, builder);
  }

  @Test
  @DisplayName("Should post to the rerank endpoint and parse index-score pairs")
  void shouldParseRerankResponse() {
    String body = "[{\"index\":1,\"score\":0.91},{\"index\":0,\"score\":0.2}]";
    TeiRerankerClient client = clientAnswering(HttpStatus.OK, body);

    List<TeiRerankerClient.RerankResult> results =
        client.rerank("what is bm25", List.of("unrelated", "bm25 ranks documents"));

    assertThat(results)
        .containsExactly(
            new TeiRerankerClient.RerankResult(1, 0.91),
            new TeiRerankerClient.RerankResult(0, 0.2));
    assertThat(lastRequest.get().method()).isEqualTo(HttpMethod.POST);
    assertThat(lastRequest.get().url().toString())
        .isEqualTo("http://tei.local:8090" + TeiRerankerClient.RERANK_PATH);
  }

  @Test
  @DisplayName("Should surface server errors to the caller")
  void shouldPropagateServerErrors() {
    TeiRerankerClient client = clientAnswering(HttpStatus.SERVICE_UNAVAILABLE, "{}");

    assertThatThrownBy(() -> client.rerank("query", List.of("text")))
        .isInstanceOf(WebClientResponseException.class);
  }
}
