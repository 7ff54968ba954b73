package com.flamingo.ai.retrieval.service.rag.chunking;

import com.flamingo.ai.retrieval.config.RagConfig;
import com.flamingo.ai.retrieval.service.rag.model.Chunk;
import com.flamingo.ai.retrieval.service.rag.model.ChunkStats;
import com.flamingo.ai.retrieval.service.rag.model.ChunkingStrategy;
import com.flamingo.ai.retrieval.service.rag.model.ContentType;
import com.flamingo.ai.retrieval.service.rag.model.ConversationMessage;
import com.flamingo.ai.retrieval.service.rag.model.Document;
import com.google.common.hash.Hashing;
import io.micrometer.core.instrument.MeterRegistry;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.IntSummaryStatistics;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Splits documents into token-bounded, overlapping chunks.
 *
 * <p>Every chunk is an exact substring of its document: {@code text ==
 * document.text().substring(startOffset, endOffset)}. Consecutive chunks cover the document without
 * gaps and share at most {@code overlapTokens} tokens.
 */
@Service
@Slf4j
public class ChunkingEngine {

  public static final String DOCUMENT_ID = "document_id";
  public static final String CONTENT_TYPE = "content_type";
  public static final String STRATEGY = "strategy";
  public static final String MESSAGE_COUNT = "message_count";

  private static final String CONVERSATION = "conversation";
  private static final List<String> PARAGRAPH_SEPARATORS = List.of("\n\n\n", "\n\n", "\n", "");
  private static final List<String> SENTENCE_SEPARATORS =
      List.of("\n\n", "\n", ". ", "! ", "? ", "; ", "");

  private final TokenCounter tokenCounter;
  private final RagConfig ragConfig;
  private final MeterRegistry meterRegistry;
  private final ContentTypeDetector contentTypeDetector = new ContentTypeDetector();
  private final RecursiveTextSplitter splitter;

  public ChunkingEngine(
      TokenCounter tokenCounter, RagConfig ragConfig, MeterRegistry meterRegistry) {
    this.tokenCounter = tokenCounter;
    this.ragConfig = ragConfig;
    this.meterRegistry = meterRegistry;
    this.splitter = new RecursiveTextSplitter(tokenCounter);
  }

  /**
   * Chunks a document with the configured size, overlap and strategy.
   *
   * @param document the document
   * @return chunks in document order, empty for blank documents
   */
  public List<Chunk> chunk(Document document) {
    return chunk(document, ChunkingStrategy.fromName(ragConfig.getChunking().getStrategy()));
  }

  /**
   * Chunks a document with the configured size and overlap.
   *
   * @param document the document
   * @param strategy chunking strategy
   * @return chunks in document order, empty for blank documents
   */
  public List<Chunk> chunk(Document document, ChunkingStrategy strategy) {
    RagConfig.Chunking cfg = ragConfig.getChunking();
    return chunk(document, cfg.getSize(), cfg.getOverlap(), strategy);
  }

  /**
   * Chunks a document.
   *
   * @param document the document
   * @param targetChunkTokens maximum tokens per chunk; small chunks are only merged while the
   *     merged chunk stays within it, and sliding windows are never merged
   * @param overlapTokens maximum tokens shared by consecutive chunks, less than the target
   * @param strategy chunking strategy
   * @return chunks in document order, empty for blank documents
   * @throws IllegalArgumentException if the size parameters are inconsistent
   */
  public List<Chunk> chunk(
      Document document, int targetChunkTokens, int overlapTokens, ChunkingStrategy strategy) {
    validateSizes(targetChunkTokens, overlapTokens);
    String text = document.text();
    if (text == null || text.isBlank()) {
      log.debug("Document {} is blank, no chunks produced", document.id());
      return List.of();
    }

    ContentType contentType = contentTypeDetector.detect(text);
    TextSpan whole = new TextSpan(0, text.length());
    List<TextSpan> spans =
        switch (strategy) {
          case RECURSIVE -> splitter.split(
              text, whole, contentType.separators(), targetChunkTokens, overlapTokens);
          case PARAGRAPH -> splitter.split(
              text, whole, PARAGRAPH_SEPARATORS, targetChunkTokens, overlapTokens);
          case SENTENCE -> splitter.split(
              text, whole, SENTENCE_SEPARATORS, targetChunkTokens, overlapTokens);
          case SLIDING_WINDOW -> slidingWindow(text, targetChunkTokens, overlapTokens);
        };

    Map<String, Object> metadata = new HashMap<>(document.metadata());
    metadata.put(DOCUMENT_ID, document.id());
    metadata.put(CONTENT_TYPE, contentType.label());
    metadata.put(STRATEGY, strategy.label());

    List<Chunk> chunks = toChunks(document.id(), text, spans, metadata);
    if (strategy != ChunkingStrategy.SLIDING_WINDOW) {
      chunks =
          mergeSmallChunks(
              text, chunks, ragConfig.getChunking().getMinChunkTokens(), targetChunkTokens);
    }

    meterRegistry
        .counter("rag.chunking.chunks", "strategy", strategy.label())
        .increment(chunks.size());
    log.debug(
        "Chunked document {} ({}, {}) into {} chunks",
        document.id(),
        contentType.label(),
        strategy.label(),
        chunks.size());
    return chunks;
  }

  /**
   * Chunks a conversation transcript. Messages render as {@code role: content} blocks joined by a
   * blank line; each chunk holds up to {@code maxMessagesPerChunk} messages and a group that
   * exceeds the token target is split further.
   *
   * @param conversationId id used as the chunks' document id
   * @param messages transcript in order
   * @param maxMessagesPerChunk messages per chunk, at least 1
   * @return chunks whose offsets refer to the rendered transcript
   */
  public List<Chunk> chunkConversation(
      String conversationId, List<ConversationMessage> messages, int maxMessagesPerChunk) {
    if (maxMessagesPerChunk < 1) {
      throw new IllegalArgumentException("maxMessagesPerChunk must be at least 1");
    }
    if (messages.isEmpty()) {
      return List.of();
    }
    RagConfig.Chunking cfg = ragConfig.getChunking();
    validateSizes(cfg.getSize(), cfg.getOverlap());

    StringBuilder transcript = new StringBuilder();
    List<TextSpan> groups = new ArrayList<>();
    List<Integer> groupSizes = new ArrayList<>();
    for (int i = 0; i < messages.size(); i += maxMessagesPerChunk) {
      List<ConversationMessage> group =
          messages.subList(i, Math.min(i + maxMessagesPerChunk, messages.size()));
      if (transcript.length() > 0) {
        transcript.append("\n\n");
      }
      int start = transcript.length();
      for (int m = 0; m < group.size(); m++) {
        if (m > 0) {
          transcript.append("\n\n");
        }
        transcript.append(group.get(m).role()).append(": ").append(group.get(m).content());
      }
      groups.add(new TextSpan(start, transcript.length()));
      groupSizes.add(group.size());
    }

    String text = transcript.toString();
    List<TextSpan> spans = new ArrayList<>();
    List<Integer> spanMessageCounts = new ArrayList<>();
    for (int g = 0; g < groups.size(); g++) {
      List<TextSpan> parts =
          splitter.split(
              text, groups.get(g), ContentType.PLAIN.separators(), cfg.getSize(), cfg.getOverlap());
      spans.addAll(parts);
      for (int p = 0; p < parts.size(); p++) {
        spanMessageCounts.add(groupSizes.get(g));
      }
    }

    Map<String, Object> metadata = new HashMap<>();
    metadata.put(DOCUMENT_ID, conversationId);
    metadata.put(CONTENT_TYPE, CONVERSATION);
    metadata.put(STRATEGY, CONVERSATION);
    List<Chunk> chunks = new ArrayList<>(toChunks(conversationId, text, spans, metadata));
    for (int i = 0; i < chunks.size(); i++) {
      Map<String, Object> withCount = new HashMap<>(chunks.get(i).metadata());
      withCount.put(MESSAGE_COUNT, spanMessageCounts.get(i));
      chunks.set(i, chunks.get(i).withMetadata(withCount));
    }
    log.debug(
        "Chunked conversation {} ({} messages) into {} chunks",
        conversationId,
        messages.size(),
        chunks.size());
    return List.copyOf(chunks);
  }

  /**
   * Summarizes the token distribution of a chunk list.
   *
   * @param chunks chunks to summarize
   * @return statistics, all zero for an empty list
   */
  public ChunkStats stats(List<Chunk> chunks) {
    if (chunks.isEmpty()) {
      return ChunkStats.empty();
    }
    IntSummaryStatistics summary =
        chunks.stream().mapToInt(Chunk::tokenCount).summaryStatistics();
    return new ChunkStats(
        chunks.size(), summary.getAverage(), summary.getMin(), summary.getMax(), summary.getSum());
  }

  /**
   * Stable chunk id: the first 16 hex characters of SHA-256 over {@code "<documentId>:<index>"}.
   *
   * @param documentId owning document
   * @param index chunk position
   * @return 16-character hex id
   */
  public static String chunkId(String documentId, int index) {
    return Hashing.sha256()
        .hashString(documentId + ":" + index, StandardCharsets.UTF_8)
        .toString()
        .substring(0, 16);
  }

  private List<TextSpan> slidingWindow(String text, int targetTokens, int overlapTokens) {
    List<String> tokens = tokenCounter.split(text);
    List<TextSpan> spans = new ArrayList<>();
    int[] offsets = new int[tokens.size() + 1];
    for (int i = 0; i < tokens.size(); i++) {
      offsets[i + 1] = offsets[i] + tokens.get(i).length();
    }
    int start = 0;
    while (start < tokens.size()) {
      int end = Math.min(start + targetTokens, tokens.size());
      spans.add(new TextSpan(offsets[start], offsets[end]));
      if (end == tokens.size()) {
        break;
      }
      start = end - overlapTokens;
    }
    return spans;
  }

  private List<Chunk> toChunks(
      String documentId, String text, List<TextSpan> spans, Map<String, Object> metadata) {
    List<Chunk> chunks = new ArrayList<>(spans.size());
    for (int i = 0; i < spans.size(); i++) {
      TextSpan span = spans.get(i);
      String chunkText = span.of(text);
      chunks.add(
          new Chunk(
              chunkId(documentId, i),
              documentId,
              chunkText,
              span.start(),
              span.end(),
              i,
              spans.size(),
              tokenCounter.count(chunkText),
              metadata));
    }
    return chunks;
  }

  /**
   * Folds every chunk below {@code minTokens} into its successor as long as the merged chunk has
   * at most {@code maxTokens}. The merged chunk keeps the earlier id and index and spans both
   * originals. A small final chunk has no successor and stays.
   */
  private List<Chunk> mergeSmallChunks(
      String text, List<Chunk> chunks, int minTokens, int maxTokens) {
    if (minTokens <= 0 || chunks.size() < 2) {
      return chunks;
    }
    List<Chunk> merged = new ArrayList<>();
    Chunk current = null;
    for (Chunk chunk : chunks) {
      if (current == null) {
        current = chunk;
        continue;
      }
      if (current.tokenCount() < minTokens) {
        int start = Math.min(current.startOffset(), chunk.startOffset());
        int end = Math.max(current.endOffset(), chunk.endOffset());
        String union = text.substring(start, end);
        int unionTokens = tokenCounter.count(union);
        if (unionTokens <= maxTokens) {
          current =
              new Chunk(
                  current.id(),
                  current.documentId(),
                  union,
                  start,
                  end,
                  current.index(),
                  current.totalInDocument(),
                  unionTokens,
                  current.metadata());
          continue;
        }
      }
      merged.add(current);
      current = chunk;
    }
    merged.add(current);

    int total = merged.size();
    return merged.stream().map(c -> c.withTotalInDocument(total)).toList();
  }

  private static void validateSizes(int targetChunkTokens, int overlapTokens) {
    if (targetChunkTokens < 1) {
      throw new IllegalArgumentException(
          "targetChunkTokens must be positive: " + targetChunkTokens);
    }
    if (overlapTokens < 0 || overlapTokens >= targetChunkTokens) {
      throw new IllegalArgumentException(
          "overlapTokens must be in [0, targetChunkTokens): " + overlapTokens);
    }
  }
}
