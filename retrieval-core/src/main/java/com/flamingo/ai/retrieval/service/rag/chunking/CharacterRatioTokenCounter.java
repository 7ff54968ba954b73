package com.flamingo.ai.retrieval.service.rag.chunking;

import java.util.ArrayList;
import java.util.List;

/** Estimates one token per fixed number of characters. */
public class CharacterRatioTokenCounter implements TokenCounter {

  private final int charsPerToken;

  public CharacterRatioTokenCounter(int charsPerToken) {
    if (charsPerToken < 1) {
      throw new IllegalArgumentException("charsPerToken must be positive: " + charsPerToken);
    }
    this.charsPerToken = charsPerToken;
  }

  @Override
  public int count(String text) {
    if (text == null || text.isEmpty()) {
      return 0;
    }
    return (text.length() + charsPerToken - 1) / charsPerToken;
  }

  @Override
  public List<String> split(String text) {
    List<String> pieces = new ArrayList<>();
    if (text == null || text.isEmpty()) {
      return pieces;
    }
    int start = 0;
    while (start < text.length()) {
      int end = Math.min(start + charsPerToken, text.length());
      // never separate a surrogate pair
      if (end < text.length() && Character.isHighSurrogate(text.charAt(end - 1))) {
        end++;
      }
      pieces.add(text.substring(start, end));
      start = end;
    }
    return pieces;
  }
}
