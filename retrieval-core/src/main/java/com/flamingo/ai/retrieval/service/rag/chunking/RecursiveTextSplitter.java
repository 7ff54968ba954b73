package com.flamingo.ai.retrieval.service.rag.chunking;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Splits text at the highest-priority separator present, merges the pieces greedily up to the
 * token target and recurses with lower-priority separators into pieces that are still too large.
 *
 * <p>Works purely on character offsets: every piece is a span of the source and the spans of one
 * split cover the source without gaps, so chunk text can always be recovered with {@code
 * substring}. Overlap comes from re-using trailing pieces of the previous chunk.
 */
public class RecursiveTextSplitter {

  private final TokenCounter tokenCounter;

  public RecursiveTextSplitter(TokenCounter tokenCounter) {
    this.tokenCounter = tokenCounter;
  }

  /**
   * Splits {@code text[start, end)} into chunk spans.
   *
   * @param text the full source text
   * @param range range of the source to split
   * @param separators separators from highest to lowest priority; {@code ""} splits into tokens
   * @param targetTokens maximum tokens per chunk
   * @param overlapTokens maximum tokens shared by consecutive chunks
   * @return chunk spans in source order
   */
  List<TextSpan> split(
      String text, TextSpan range, List<String> separators, int targetTokens, int overlapTokens) {
    List<TextSpan> result = new ArrayList<>();
    if (range.length() == 0) {
      return result;
    }
    if (tokens(text, range) <= targetTokens) {
      result.add(range);
      return result;
    }

    int chosen = separators.size() - 1;
    for (int i = 0; i < separators.size(); i++) {
      String separator = separators.get(i);
      if (separator.isEmpty() || text.substring(range.start(), range.end()).contains(separator)) {
        chosen = i;
        break;
      }
    }
    String separator = separators.isEmpty() ? "" : separators.get(chosen);
    List<String> remaining =
        separators.isEmpty() ? List.of() : separators.subList(chosen + 1, separators.size());

    List<TextSpan> pieces =
        separator.isEmpty() ? tokenPieces(text, range) : separatorPieces(text, range, separator);

    List<TextSpan> fitting = new ArrayList<>();
    for (TextSpan piece : pieces) {
      if (tokens(text, piece) <= targetTokens) {
        fitting.add(piece);
        continue;
      }
      if (!fitting.isEmpty()) {
        result.addAll(merge(text, fitting, targetTokens, overlapTokens));
        fitting.clear();
      }
      if (remaining.isEmpty()) {
        result.add(piece);
      } else {
        result.addAll(split(text, piece, remaining, targetTokens, overlapTokens));
      }
    }
    if (!fitting.isEmpty()) {
      result.addAll(merge(text, fitting, targetTokens, overlapTokens));
    }
    return result;
  }

  /**
   * Cuts a range at every occurrence of the separator. Structural separators that open with line
   * breaks ({@code "\n\nclass "}, {@code "\n# "}) are cut after the line breaks so the marker
   * starts the next piece; all others stay at the end of the preceding piece.
   */
  List<TextSpan> separatorPieces(String text, TextSpan range, String separator) {
    int cut = cutOffset(separator);
    List<TextSpan> pieces = new ArrayList<>();
    int pieceStart = range.start();
    int from = range.start();
    while (true) {
      int found = text.indexOf(separator, from);
      if (found < 0 || found + separator.length() > range.end()) {
        break;
      }
      int boundary = found + cut;
      if (boundary > pieceStart) {
        pieces.add(new TextSpan(pieceStart, boundary));
        pieceStart = boundary;
      }
      from = found + separator.length();
    }
    if (pieceStart < range.end()) {
      pieces.add(new TextSpan(pieceStart, range.end()));
    }
    return pieces;
  }

  private List<TextSpan> tokenPieces(String text, TextSpan range) {
    List<TextSpan> pieces = new ArrayList<>();
    int offset = range.start();
    for (String token : tokenCounter.split(range.of(text))) {
      pieces.add(new TextSpan(offset, offset + token.length()));
      offset += token.length();
    }
    return pieces;
  }

  private List<TextSpan> merge(
      String text, List<TextSpan> pieces, int targetTokens, int overlapTokens) {
    List<TextSpan> chunks = new ArrayList<>();
    Deque<TextSpan> current = new ArrayDeque<>();
    Deque<Integer> currentTokens = new ArrayDeque<>();
    int total = 0;
    for (TextSpan piece : pieces) {
      int pieceTokens = tokens(text, piece);
      if (total + pieceTokens > targetTokens && !current.isEmpty()) {
        chunks.add(new TextSpan(current.getFirst().start(), current.getLast().end()));
        while (total > overlapTokens || (total + pieceTokens > targetTokens && total > 0)) {
          current.removeFirst();
          total -= currentTokens.removeFirst();
        }
      }
      current.addLast(piece);
      currentTokens.addLast(pieceTokens);
      total += pieceTokens;
    }
    if (!current.isEmpty()) {
      chunks.add(new TextSpan(current.getFirst().start(), current.getLast().end()));
    }
    return chunks;
  }

  private int tokens(String text, TextSpan span) {
    return tokenCounter.count(span.of(text));
  }

  static int cutOffset(String separator) {
    int leading = 0;
    while (leading < separator.length() && separator.charAt(leading) == '\n') {
      leading++;
    }
    if (leading > 0 && leading < separator.length() && !separator.substring(leading).isBlank()) {
      return leading;
    }
    return separator.length();
  }
}
