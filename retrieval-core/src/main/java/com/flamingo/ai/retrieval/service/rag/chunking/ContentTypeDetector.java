package com.flamingo.ai.retrieval.service.rag.chunking;

import com.flamingo.ai.retrieval.service.rag.model.ContentType;
import java.util.List;
import java.util.regex.Pattern;

/** Classifies text as code, markdown or plain prose by surface patterns. */
public class ContentTypeDetector {

  private static final List<Pattern> CODE_PATTERNS =
      List.of(
          Pattern.compile(
              "^\\s*(def |class |import |from |function |const |let |var )", Pattern.MULTILINE),
          Pattern.compile("\\{[\\s\\S]*\\}"),
          Pattern.compile("^\\s*#include", Pattern.MULTILINE));

  private static final Pattern MARKDOWN_HEADING = Pattern.compile("^#{1,6}\\s", Pattern.MULTILINE);

  /**
   * Detects the content type. Code wins over markdown when both match.
   *
   * @param text the text to classify
   * @return detected type, {@link ContentType#PLAIN} when nothing matches
   */
  public ContentType detect(String text) {
    if (text == null || text.isBlank()) {
      return ContentType.PLAIN;
    }
    for (Pattern pattern : CODE_PATTERNS) {
      if (pattern.matcher(text).find()) {
        return ContentType.CODE;
      }
    }
    if (MARKDOWN_HEADING.matcher(text).find()) {
      return ContentType.MARKDOWN;
    }
    return ContentType.PLAIN;
  }
}
