package com.flamingo.ai.retrieval.service.rag.chunking;

import com.knuddels.jtokkit.Encodings;
import com.knuddels.jtokkit.api.Encoding;
import com.knuddels.jtokkit.api.EncodingType;
import com.knuddels.jtokkit.api.IntArrayList;
import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;

/**
 * cl100k_base BPE token counter. Text the encoder cannot process is estimated with a character
 * ratio so that chunking of a document never fails on tokenization.
 */
@Slf4j
public class JTokkitTokenCounter implements TokenCounter {

  private final Encoding encoding;
  private final CharacterRatioTokenCounter fallback;

  public JTokkitTokenCounter(int fallbackCharsPerToken) {
    this.encoding = Encodings.newDefaultEncodingRegistry().getEncoding(EncodingType.CL100K_BASE);
    this.fallback = new CharacterRatioTokenCounter(fallbackCharsPerToken);
  }

  @Override
  public int count(String text) {
    if (text == null || text.isEmpty()) {
      return 0;
    }
    try {
      return encoding.countTokensOrdinary(text);
    } catch (RuntimeException e) {
      log.warn("BPE token count failed, using estimate: {}", e.getMessage());
      return fallback.count(text);
    }
  }

  /**
   * Decodes token by token. A token may end inside a multi-byte character, so bytes are buffered
   * until they form valid UTF-8.
   */
  @Override
  public List<String> split(String text) {
    if (text == null || text.isEmpty()) {
      return new ArrayList<>();
    }
    try {
      IntArrayList tokens = encoding.encodeOrdinary(text);
      List<String> pieces = new ArrayList<>(tokens.size());
      ByteBuffer pending = ByteBuffer.allocate(0);
      for (int i = 0; i < tokens.size(); i++) {
        IntArrayList single = new IntArrayList(1);
        single.add(tokens.get(i));
        pending = append(pending, encoding.decodeBytes(single));
        String decoded = tryDecode(pending);
        if (decoded != null) {
          pieces.add(decoded);
          pending = ByteBuffer.allocate(0);
        }
      }
      if (pending.remaining() > 0 || !String.join("", pieces).equals(text)) {
        log.warn("BPE split did not reproduce the input, using estimate");
        return fallback.split(text);
      }
      return pieces;
    } catch (RuntimeException e) {
      log.warn("BPE split failed, using estimate: {}", e.getMessage());
      return fallback.split(text);
    }
  }

  private static ByteBuffer append(ByteBuffer pending, byte[] next) {
    ByteBuffer merged = ByteBuffer.allocate(pending.remaining() + next.length);
    merged.put(pending.duplicate());
    merged.put(next);
    merged.flip();
    return merged;
  }

  private static String tryDecode(ByteBuffer bytes) {
    CharsetDecoder decoder =
        StandardCharsets.UTF_8
            .newDecoder()
            .onMalformedInput(CodingErrorAction.REPORT)
            .onUnmappableCharacter(CodingErrorAction.REPORT);
    try {
      CharBuffer chars = decoder.decode(bytes.duplicate());
      return chars.toString();
    } catch (CharacterCodingException e) {
      // incomplete multi-byte sequence, completed by a following token
      return null;
    }
  }
}
