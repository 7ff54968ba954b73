package com.flamingo.ai.retrieval.service.rag.index;

/** A BM25 match. */
public record LexicalHit(LexicalDocument document, double score) {}
