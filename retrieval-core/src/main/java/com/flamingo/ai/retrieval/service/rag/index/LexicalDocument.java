package com.flamingo.ai.retrieval.service.rag.index;

import java.util.Map;

/**
 * A chunk as seen by the lexical index.
 *
 * @param id chunk id, shared with the vector index
 * @param documentId owning document, {@code null} when unknown
 * @param text chunk text
 * @param metadata chunk metadata for filtering
 */
public record LexicalDocument(
    String id, String documentId, String text, Map<String, Object> metadata) {}
