package com.flamingo.ai.retrieval.service.rag.chunking;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.flamingo.ai.retrieval.config.RagConfig;
import com.flamingo.ai.retrieval.service.rag.model.Chunk;
import com.flamingo.ai.retrieval.service.rag.model.ChunkStats;
import com.flamingo.ai.retrieval.service.rag.model.ChunkingStrategy;
import com.flamingo.ai.retrieval.service.rag.model.ConversationMessage;
import com.flamingo.ai.retrieval.service.rag.model.Document;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("ChunkingEngine Tests")
class ChunkingEngineTest {

  private static final String THREE_SENTENCES =
      "The cat sat on the mat. The dog ran in the park. The bird flew over the tree.";

  private RagConfig ragConfig;
  private SimpleMeterRegistry meterRegistry;
  private CharacterRatioTokenCounter tokenCounter;
  private ChunkingEngine chunkingEngine;

  @BeforeEach
  void setUp() {
    ragConfig = new RagConfig();
    ragConfig.getChunking().setMinChunkTokens(0);
    meterRegistry = new SimpleMeterRegistry();
    tokenCounter = new CharacterRatioTokenCounter(4);
    chunkingEngine = new ChunkingEngine(tokenCounter, ragConfig, meterRegistry);
  }

  @Nested
  @DisplayName("Sliding window")
  class SlidingWindow {

    @Test
    @DisplayName("Should share the last overlap tokens of a chunk with the next one")
    void shouldShareOverlapTokensBetweenConsecutiveChunks() {
      Document document = new Document("doc-1", THREE_SENTENCES);

      List<Chunk> chunks =
          chunkingEngine.chunk(document, 8, 2, ChunkingStrategy.SLIDING_WINDOW);

      assertThat(chunks).hasSizeGreaterThanOrEqualTo(2);
      for (Chunk chunk : chunks) {
        assertThat(chunk.tokenCount()).isLessThanOrEqualTo(8);
      }
      for (int i = 0; i + 1 < chunks.size(); i++) {
        List<String> current = tokenCounter.split(chunks.get(i).text());
        List<String> next = tokenCounter.split(chunks.get(i + 1).text());
        assertThat(current.subList(current.size() - 2, current.size()))
            .isEqualTo(next.subList(0, 2));
      }
    }

    @Test
    @DisplayName("Should cover the whole document")
    void shouldCoverWholeDocument() {
      Document document = new Document("doc-1", THREE_SENTENCES);

      List<Chunk> chunks =
          chunkingEngine.chunk(document, 8, 2, ChunkingStrategy.SLIDING_WINDOW);

      assertThat(reconstruct(chunks)).isEqualTo(THREE_SENTENCES);
    }
  }

  @Nested
  @DisplayName("Recursive splitting")
  class Recursive {

    @Test
    @DisplayName("Should reconstruct plain text from chunk offsets")
    void shouldReconstructPlainText() {
      String text =
          "Retrieval systems combine lexical and semantic signals.\n\n"
              + "Lexical search rewards exact term matches. It is fast and predictable.\n\n"
              + "Vector search finds paraphrases. It needs an embedding model! "
              + "Fusion blends both; reranking refines the head of the list.";
      Document document = new Document("doc-2", text);

      List<Chunk> chunks = chunkingEngine.chunk(document, 12, 3, ChunkingStrategy.RECURSIVE);

      assertThat(chunks).hasSizeGreaterThan(1);
      assertThat(reconstruct(chunks)).isEqualTo(text);
      for (Chunk chunk : chunks) {
        assertThat(chunk.text()).isEqualTo(text.substring(chunk.startOffset(), chunk.endOffset()));
        assertThat(chunk.tokenCount()).isLessThanOrEqualTo(12);
      }
    }

    @Test
    @DisplayName("Should keep a document below the target as a single chunk")
    void shouldKeepSmallDocumentWhole() {
      Document document = new Document("doc-3", "A short note.");

      List<Chunk> chunks = chunkingEngine.chunk(document, ChunkingStrategy.RECURSIVE);

      assertThat(chunks).hasSize(1);
      Chunk chunk = chunks.get(0);
      assertThat(chunk.text()).isEqualTo("A short note.");
      assertThat(chunk.index()).isZero();
      assertThat(chunk.totalInDocument()).isEqualTo(1);
      assertThat(chunk.documentId()).isEqualTo("doc-3");
    }

    @Test
    @DisplayName("Should split code at function boundaries first")
    void shouldSplitCodeAtFunctionBoundaries() {
      String code =
          "import os\n\ndef first():\n    return 1\n\ndef second():\n    return 2\n";
      Document document = new Document("code-1", code);

      List<Chunk> chunks = chunkingEngine.chunk(document, 8, 0, ChunkingStrategy.RECURSIVE);

      assertThat(chunks).isNotEmpty();
      assertThat(chunks.get(0).metadata()).containsEntry(ChunkingEngine.CONTENT_TYPE, "code");
      assertThat(chunks).anySatisfy(c -> assertThat(c.text()).startsWith("def second"));
      assertThat(reconstruct(chunks)).isEqualTo(code);
    }

    @Test
    @DisplayName("Should merge a chunk below the minimum size into its successor")
    void shouldMergeSmallChunks() {
      String text =
          "Hi.\n\nShort line one.\nAnother short line.\nA third line of text here.";
      Document document = new Document("doc-4", text);
      assertThat(chunkingEngine.chunk(document, 12, 0, ChunkingStrategy.PARAGRAPH)).hasSize(3);

      ragConfig.getChunking().setMinChunkTokens(3);
      List<Chunk> chunks = chunkingEngine.chunk(document, 12, 0, ChunkingStrategy.PARAGRAPH);

      assertThat(chunks).hasSize(2);
      Chunk merged = chunks.get(0);
      assertThat(merged.text()).isEqualTo("Hi.\n\nShort line one.\nAnother short line.\n");
      assertThat(merged.id()).isEqualTo(ChunkingEngine.chunkId("doc-4", 0));
      assertThat(merged.index()).isZero();
      assertThat(merged.totalInDocument()).isEqualTo(2);
      assertThat(merged.tokenCount()).isEqualTo(tokenCounter.count(merged.text()));
      assertThat(reconstruct(chunks)).isEqualTo(text);
    }

    @Test
    @DisplayName("Should not merge when the merged chunk would exceed the target")
    void shouldNotMergePastTarget() {
      String text = "Hi.\n\nThis is paragraph two.\n\nAnd paragraph three here.";
      Document document = new Document("doc-4", text);
      ragConfig.getChunking().setMinChunkTokens(9);

      List<Chunk> chunks = chunkingEngine.chunk(document, 12, 0, ChunkingStrategy.PARAGRAPH);

      assertThat(chunks).hasSize(2);
      assertThat(chunks).allSatisfy(c -> assertThat(c.tokenCount()).isLessThanOrEqualTo(12));
    }
  }

  @Nested
  @DisplayName("Default configuration")
  class DefaultConfiguration {

    private ChunkingEngine defaultEngine;

    @BeforeEach
    void setUp() {
      defaultEngine = new ChunkingEngine(tokenCounter, new RagConfig(), meterRegistry);
    }

    @Test
    @DisplayName("Should keep sliding windows within a target below the minimum chunk size")
    void shouldKeepSlidingWindowsWithinSmallTarget() {
      List<Chunk> chunks =
          defaultEngine.chunk(
              new Document("doc-9", THREE_SENTENCES), 8, 2, ChunkingStrategy.SLIDING_WINDOW);

      assertThat(chunks).hasSizeGreaterThanOrEqualTo(2);
      assertThat(chunks).allSatisfy(c -> assertThat(c.tokenCount()).isLessThanOrEqualTo(8));
      for (int i = 0; i + 1 < chunks.size(); i++) {
        List<String> current = tokenCounter.split(chunks.get(i).text());
        List<String> next = tokenCounter.split(chunks.get(i + 1).text());
        assertThat(current.subList(current.size() - 2, current.size()))
            .isEqualTo(next.subList(0, 2));
      }
    }

    @Test
    @DisplayName("Should keep recursive chunks within a target below the minimum chunk size")
    void shouldKeepRecursiveChunksWithinSmallTarget() {
      List<Chunk> chunks =
          defaultEngine.chunk(
              new Document("doc-10", THREE_SENTENCES), 8, 2, ChunkingStrategy.RECURSIVE);

      assertThat(chunks).hasSizeGreaterThanOrEqualTo(2);
      assertThat(chunks).allSatisfy(c -> assertThat(c.tokenCount()).isLessThanOrEqualTo(8));
      assertThat(reconstruct(chunks)).isEqualTo(THREE_SENTENCES);
    }
  }

  @Nested
  @DisplayName("Metadata and ids")
  class MetadataAndIds {

    @Test
    @DisplayName("Should carry document metadata and chunking labels")
    void shouldCarryMetadata() {
      Document document = new Document("doc-5", "Plain prose only.", Map.of("source", "wiki"));

      Chunk chunk = chunkingEngine.chunk(document, ChunkingStrategy.SENTENCE).get(0);

      assertThat(chunk.metadata())
          .containsEntry("source", "wiki")
          .containsEntry(ChunkingEngine.DOCUMENT_ID, "doc-5")
          .containsEntry(ChunkingEngine.CONTENT_TYPE, "plain")
          .containsEntry(ChunkingEngine.STRATEGY, "sentence");
    }

    @Test
    @DisplayName("Should accept metadata with null values")
    void shouldAcceptNullMetadataValues() {
      Map<String, Object> metadata = new HashMap<>();
      metadata.put("source", "wiki");
      metadata.put("author", null);
      Document document = new Document("doc-11", "Plain prose only.", metadata);

      Chunk chunk = chunkingEngine.chunk(document, ChunkingStrategy.SENTENCE).get(0);

      assertThat(document.metadata()).containsKey("author");
      assertThat(chunk.metadata()).containsEntry("source", "wiki").containsKey("author");
      assertThat(chunk.metadata().get("author")).isNull();
    }

    @Test
    @DisplayName("Should derive stable 16 character ids")
    void shouldDeriveStableIds() {
      String first = ChunkingEngine.chunkId("doc-1", 0);

      assertThat(first).hasSize(16).matches("[0-9a-f]{16}");
      assertThat(ChunkingEngine.chunkId("doc-1", 0)).isEqualTo(first);
      assertThat(ChunkingEngine.chunkId("doc-1", 1)).isNotEqualTo(first);
    }

    @Test
    @DisplayName("Should count produced chunks per strategy")
    void shouldCountChunks() {
      chunkingEngine.chunk(
          new Document("doc-6", THREE_SENTENCES), 8, 2, ChunkingStrategy.SLIDING_WINDOW);

      assertThat(
              meterRegistry
                  .counter("rag.chunking.chunks", "strategy", "sliding_window")
                  .count())
          .isGreaterThanOrEqualTo(2.0);
    }
  }

  @Nested
  @DisplayName("Edge cases")
  class EdgeCases {

    @Test
    @DisplayName("Should return no chunks for a blank document")
    void shouldReturnNoChunksForBlankDocument() {
      assertThat(chunkingEngine.chunk(new Document("empty", ""))).isEmpty();
      assertThat(chunkingEngine.chunk(new Document("blank", "  \n\t "))).isEmpty();
    }

    @Test
    @DisplayName("Should reject overlap not smaller than the target")
    void shouldRejectOverlapNotSmallerThanTarget() {
      Document document = new Document("doc-7", THREE_SENTENCES);

      assertThatThrownBy(
              () -> chunkingEngine.chunk(document, 10, 10, ChunkingStrategy.RECURSIVE))
          .isInstanceOf(IllegalArgumentException.class);
      assertThatThrownBy(() -> chunkingEngine.chunk(document, 0, 0, ChunkingStrategy.RECURSIVE))
          .isInstanceOf(IllegalArgumentException.class);
    }
  }

  @Nested
  @DisplayName("Conversations")
  class Conversations {

    @Test
    @DisplayName("Should group messages into role prefixed chunks")
    void shouldGroupMessages() {
      List<ConversationMessage> messages =
          List.of(
              new ConversationMessage("user", "What is BM25?"),
              new ConversationMessage("assistant", "A lexical ranking function."),
              new ConversationMessage("user", "Thanks."));

      List<Chunk> chunks = chunkingEngine.chunkConversation("conv-1", messages, 2);

      assertThat(chunks).hasSize(2);
      assertThat(chunks.get(0).text())
          .isEqualTo("user: What is BM25?\n\nassistant: A lexical ranking function.");
      assertThat(chunks.get(0).metadata())
          .containsEntry(ChunkingEngine.MESSAGE_COUNT, 2)
          .containsEntry(ChunkingEngine.CONTENT_TYPE, "conversation")
          .containsEntry(ChunkingEngine.DOCUMENT_ID, "conv-1");
      assertThat(chunks.get(1).text()).isEqualTo("user: Thanks.");
      assertThat(chunks.get(1).metadata()).containsEntry(ChunkingEngine.MESSAGE_COUNT, 1);
    }

    @Test
    @DisplayName("Should return no chunks for an empty conversation")
    void shouldReturnNoChunksForEmptyConversation() {
      assertThat(chunkingEngine.chunkConversation("conv-2", List.of(), 5)).isEmpty();
    }
  }

  @Test
  @DisplayName("Should summarize token counts")
  void shouldSummarizeTokenCounts() {
    List<Chunk> chunks =
        chunkingEngine.chunk(
            new Document("doc-8", THREE_SENTENCES), 8, 2, ChunkingStrategy.SLIDING_WINDOW);

    ChunkStats stats = chunkingEngine.stats(chunks);

    assertThat(stats.totalChunks()).isEqualTo(chunks.size());
    assertThat(stats.maxTokens()).isLessThanOrEqualTo(8);
    assertThat(stats.minTokens()).isPositive();
    assertThat(stats.totalTokens())
        .isEqualTo(chunks.stream().mapToInt(Chunk::tokenCount).sum());
    assertThat(chunkingEngine.stats(List.of())).isEqualTo(ChunkStats.empty());
  }

  /** Rebuilds the source by appending the part of each chunk not covered by its predecessor. */
  private static String reconstruct(List<Chunk> chunks) {
    StringBuilder rebuilt = new StringBuilder();
    int covered = 0;
    for (Chunk chunk : chunks) {
      assertThat(chunk.startOffset()).isLessThanOrEqualTo(covered);
      if (chunk.endOffset() > covered) {
        rebuilt.append(chunk.text().substring(covered - chunk.startOffset()));
        covered = chunk.endOffset();
      }
    }
    return rebuilt.toString();
  }
}
