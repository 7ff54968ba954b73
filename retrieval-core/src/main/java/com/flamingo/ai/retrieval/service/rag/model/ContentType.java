package com.flamingo.ai.retrieval.service.rag.model;

import java.util.List;
import java.util.Locale;

/** Detected content type of a document, each with its separator priority list. */
public enum ContentType {
  CODE(
      List.of(
          "\n\nclass ",
          "\n\ndef ",
          "\n\nasync def ",
          "\n\nfunction ",
          "\n\npublic ",
          "\n\n",
          "\n",
          " ",
          "")),
  MARKDOWN(
      List.of(
          "\n# ",
          "\n## ",
          "\n### ",
          "\n#### ",
          "\n\n\n",
          "\n\n",
          "\n",
          ". ",
          "! ",
          "? ",
          "; ",
          ", ",
          " ",
          "")),
  PLAIN(List.of("\n\n\n", "\n\n", "\n", ". ", "! ", "? ", "; ", ", ", " ", ""));

  private final List<String> separators;

  ContentType(List<String> separators) {
    this.separators = separators;
  }

  /** Separators from highest to lowest priority; the empty string means raw characters. */
  public List<String> separators() {
    return separators;
  }

  public String label() {
    return name().toLowerCase(Locale.ROOT);
  }
}
