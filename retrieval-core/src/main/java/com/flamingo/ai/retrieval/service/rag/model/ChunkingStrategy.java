package com.flamingo.ai.retrieval.service.rag.model;

import java.util.Locale;

/** How a document is cut into chunks. */
public enum ChunkingStrategy {
  /** Separator recursion in content-type priority order. */
  RECURSIVE,
  /** Fixed token window with token overlap. */
  SLIDING_WINDOW,
  /** Paragraph boundaries first, characters as a last resort. */
  PARAGRAPH,
  /** Sentence boundaries first, characters as a last resort. */
  SENTENCE;

  /**
   * Parses a configuration value such as {@code sliding_window} or {@code sliding-window}.
   *
   * @param name strategy name, case-insensitive
   * @return the strategy
   * @throws IllegalArgumentException if the name is unknown
   */
  public static ChunkingStrategy fromName(String name) {
    return valueOf(name.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
  }

  public String label() {
    return name().toLowerCase(Locale.ROOT);
  }
}
