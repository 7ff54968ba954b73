package com.flamingo.ai.retrieval.service.rag.chunking;

/** Half-open character range {@code [start, end)} of a source text. */
record TextSpan(int start, int end) {

  TextSpan {
    if (start < 0 || end < start) {
      throw new IllegalArgumentException("Invalid span [" + start + ", " + end + ")");
    }
  }

  int length() {
    return end - start;
  }

  String of(String source) {
    return source.substring(start, end);
  }
}
