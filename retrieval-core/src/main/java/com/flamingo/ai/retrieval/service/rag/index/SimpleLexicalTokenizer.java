package com.flamingo.ai.retrieval.service.rag.index;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/** Lowercases and splits on anything that is not a letter or digit, in any script. */
@Component
public class SimpleLexicalTokenizer implements LexicalTokenizer {

  private static final Pattern NON_WORD = Pattern.compile("[^\\p{L}\\p{N}]+");

  @Override
  public List<String> tokenize(String text) {
    List<String> terms = new ArrayList<>();
    if (text == null || text.isBlank()) {
      return terms;
    }
    for (String term : NON_WORD.split(text.toLowerCase(Locale.ROOT))) {
      if (!term.isEmpty()) {
        terms.add(term);
      }
    }
    return terms;
  }
}
