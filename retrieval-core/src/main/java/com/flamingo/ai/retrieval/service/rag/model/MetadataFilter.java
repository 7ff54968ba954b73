package com.flamingo.ai.retrieval.service.rag.model;

import java.util.Map;
import java.util.Objects;

/** Exact-match conjunctive metadata filtering shared by the lexical and vector sides. */
public final class MetadataFilter {

  private MetadataFilter() {}

  /**
   * Checks whether the metadata satisfies every filter entry. Values are compared with {@link
   * Objects#equals}, falling back to string form so {@code 3} matches {@code "3"}.
   *
   * @param metadata candidate metadata
   * @param filter required key/value pairs; {@code null} or empty matches everything
   * @return true when all entries match
   */
  public static boolean matches(Map<String, Object> metadata, Map<String, Object> filter) {
    if (filter == null || filter.isEmpty()) {
      return true;
    }
    for (Map.Entry<String, Object> entry : filter.entrySet()) {
      Object actual = metadata.get(entry.getKey());
      if (actual == null) {
        return false;
      }
      Object expected = entry.getValue();
      if (!Objects.equals(actual, expected)
          && !String.valueOf(actual).equals(String.valueOf(expected))) {
        return false;
      }
    }
    return true;
  }
}
