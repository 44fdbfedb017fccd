package ca.gc.cra.scribe.infrastructure.decode;

import ca.gc.cra.scribe.application.port.RichTextDecoder;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.Optional;

/**
 * <strong>What:</strong> Extracts the string content of a {@code streamtyped} archived attributed string.
 * <p><strong>Format:</strong> after the {@code NSString} class reference the archive holds a {@code '+'} marker, a
 * length (one byte below {@code 0x80}; {@code 0x81} followed by a 2-byte little-endian length; {@code 0x82} followed
 * by a 4-byte little-endian length) and that many UTF-8 bytes.</p>
 * <p><strong>Thread-safety:</strong> Stateless.</p>
 *
 * @since 0.1.0
 */
public final class TypedStreamDecoder implements RichTextDecoder {
  static final byte[] HEADER = "streamtyped".getBytes(StandardCharsets.US_ASCII);
  static final byte[] STRING_CLASS = "NSString".getBytes(StandardCharsets.US_ASCII);
  private static final int HEADER_WINDOW = 32;
  private static final int MARKER_WINDOW = 16;
  private static final byte STRING_MARKER = 0x2B;

  @Override
  public String name() {
    return "typedstream";
  }

  @Override
  public Optional<String> decode(byte[] payload) {
    if (payload == null || indexOf(payload, HEADER, 0, Math.min(payload.length, HEADER_WINDOW)) < 0) {
      return Optional.empty();
    }
    int classAt = indexOf(payload, STRING_CLASS, 0, payload.length);
    if (classAt < 0) {
      return Optional.empty();
    }
    int from = classAt + STRING_CLASS.length;
    int limit = Math.min(payload.length, from + MARKER_WINDOW);
    int marker = -1;
    for (int i = from; i < limit; i++) {
      if (payload[i] == STRING_MARKER) {
        marker = i;
        break;
      }
    }
    if (marker < 0 || marker + 1 >= payload.length) {
      return Optional.empty();
    }
    int cursor = marker + 1;
    int prefix = payload[cursor] & 0xFF;
    long length;
    if (prefix == 0x81) {
      if (cursor + 3 > payload.length) {
        return Optional.empty();
      }
      length = (payload[cursor + 1] & 0xFF) | ((payload[cursor + 2] & 0xFF) << 8);
      cursor += 3;
    } else if (prefix == 0x82) {
      if (cursor + 5 > payload.length) {
        return Optional.empty();
      }
      length = (payload[cursor + 1] & 0xFFL)
          | ((payload[cursor + 2] & 0xFFL) << 8)
          | ((payload[cursor + 3] & 0xFFL) << 16)
          | ((payload[cursor + 4] & 0xFFL) << 24);
      cursor += 5;
    } else if (prefix < 0x80) {
      length = prefix;
      cursor += 1;
    } else {
      return Optional.empty();
    }
    if (length <= 0 || cursor + length > payload.length) {
      return Optional.empty();
    }
    return utf8(payload, cursor, (int) length).filter(text -> !text.isBlank());
  }

  static Optional<String> utf8(byte[] bytes, int offset, int length) {
    try {
      return Optional.of(StandardCharsets.UTF_8.newDecoder()
          .onMalformedInput(CodingErrorAction.REPORT)
          .onUnmappableCharacter(CodingErrorAction.REPORT)
          .decode(ByteBuffer.wrap(bytes, offset, length))
          .toString());
    } catch (CharacterCodingException ex) {
      return Optional.empty();
    }
  }

  static int indexOf(byte[] haystack, byte[] needle, int from, int to) {
    outer:
    for (int i = Math.max(0, from); i <= to - needle.length; i++) {
      for (int j = 0; j < needle.length; j++) {
        if (haystack[i + j] != needle[j]) {
          continue outer;
        }
      }
      return i;
    }
    return -1;
  }
}
