package com.flamingo.ai.retrieval.service.rag.chunking;

import java.util.List;

/**
 * Counts and splits text in model tokens. Implementations are approximate and swappable; the only
 * hard contract is that {@link #split(String)} returns pieces that concatenate back to the input.
 */
public interface TokenCounter {

  /**
   * Counts the tokens in a text.
   *
   * @param text the text, may be empty
   * @return token count, 0 for empty text
   */
  int count(String text);

  /**
   * Splits a text into one string per token.
   *
   * @param text the text, may be empty
   * @return token pieces whose concatenation equals {@code text}
   */
  List<String> split(String text);
}
