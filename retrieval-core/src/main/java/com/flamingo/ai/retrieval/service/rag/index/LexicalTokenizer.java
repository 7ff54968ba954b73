package com.flamingo.ai.retrieval.service.rag.index;

import java.util.List;

/** Turns text into index terms for BM25 scoring. Queries and documents use the same tokenizer. */
public interface LexicalTokenizer {

  List<String> tokenize(String text);
}
