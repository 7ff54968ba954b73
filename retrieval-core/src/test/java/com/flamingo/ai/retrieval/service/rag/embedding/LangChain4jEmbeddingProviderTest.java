package com.flamingo.ai.retrieval.service.rag.embedding;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.when;

import com.flamingo.ai.retrieval.exception.ProviderUnavailableException;
import com.flamingo.ai.retrieval.service.rag.chunking.CharacterRatioTokenCounter;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import dev.langchain4j.model.output.TokenUsage;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("LangChain4jEmbeddingProvider Tests")
class LangChain4jEmbeddingProviderTest {

  @Mock private EmbeddingModel embeddingModel;

  private SimpleMeterRegistry meterRegistry;
  private LangChain4jEmbeddingProvider provider;

  @BeforeEach
  void setUp() {
    meterRegistry = new SimpleMeterRegistry();
    provider =
        new LangChain4jEmbeddingProvider(
            embeddingModel, new CharacterRatioTokenCounter(4), meterRegistry);
  }

  @Test
  @DisplayName("Should return vectors and reported token usage")
  void shouldReturnVectorsAndUsage() {
    when(embeddingModel.embedAll(anyList()))
        .thenReturn(
            Response.from(
                List.of(Embedding.from(new float[] {1f, 2f}), Embedding.from(new float[] {3f, 4f})),
                new TokenUsage(7)));

    EmbeddingProvider.ProviderBatch batch = provider.embed("model", List.of("first", "second"));

    assertThat(batch.vectors()).hasSize(2);
    assertThat(batch.vectors().get(1)).containsExactly(3f, 4f);
    assertThat(batch.tokenUsage()).isEqualTo(7L);
  }

  @Test
  @DisplayName("Should estimate tokens when the provider reports no usage")
  void shouldEstimateTokensWithoutUsage() {
    when(embeddingModel.embedAll(anyList()))
        .thenReturn(Response.from(List.of(Embedding.from(new float[] {1f, 2f}))));

    EmbeddingProvider.ProviderBatch batch = provider.embed("model", List.of("12345678"));

    assertThat(batch.tokenUsage()).isEqualTo(2L);
  }

  @Test
  @DisplayName("Should wrap provider failures")
  void shouldWrapProviderFailures() {
    when(embeddingModel.embedAll(anyList())).thenThrow(new RuntimeException("429 Too Many"));

    assertThatThrownBy(() -> provider.embed("model", List.of("text")))
        .isInstanceOf(ProviderUnavailableException.class)
        .hasCauseInstanceOf(RuntimeException.class);
    assertThat(meterRegistry.counter("embedding.requests.failure", "model", "model").count())
        .isEqualTo(1.0);
  }

  @Test
  @DisplayName("Should fail when the vector count does not match")
  void shouldFailOnCountMismatch() {
    when(embeddingModel.embedAll(anyList()))
        .thenReturn(Response.from(List.of(Embedding.from(new float[] {1f}))));

    assertThatThrownBy(() -> provider.embed("model", List.of("a", "b")))
        .isInstanceOf(ProviderUnavailableException.class);
  }
}
