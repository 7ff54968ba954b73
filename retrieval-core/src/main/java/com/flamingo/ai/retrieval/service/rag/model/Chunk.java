package com.flamingo.ai.retrieval.service.rag.model;

import java.util.Map;

/**
 * A contiguous fragment of a document and the unit of indexing.
 *
 * @param id first 16 hex chars of SHA-256 over {@code "<documentId>:<index>"}
 * @param documentId owning document
 * @param text exactly {@code source.substring(startOffset, endOffset)}
 * @param startOffset inclusive character offset in the source document
 * @param endOffset exclusive character offset in the source document
 * @param index 0-based position within the document
 * @param totalInDocument number of chunks the document produced
 * @param tokenCount token count of {@code text}
 * @param metadata document metadata plus chunking annotations
 */
public record Chunk(
    String id,
    String documentId,
    String text,
    int startOffset,
    int endOffset,
    int index,
    int totalInDocument,
    int tokenCount,
    Map<String, Object> metadata) {

  public Chunk {
    metadata = MetadataMaps.copyOf(metadata);
  }

  public Chunk withTotalInDocument(int total) {
    return new Chunk(
        id, documentId, text, startOffset, endOffset, index, total, tokenCount, metadata);
  }

  public Chunk withMetadata(Map<String, Object> newMetadata) {
    return new Chunk(
        id,
        documentId,
        text,
        startOffset,
        endOffset,
        index,
        totalInDocument,
        tokenCount,
        newMetadata);
  }
}
