package ca.gc.cra.scribe.infrastructure.decode;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.scribe.testutil.RichTextFixtures;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class TypedStreamDecoderTest {
  private final TypedStreamDecoder decoder = new TypedStreamDecoder();

  @Test
  void decodesShortString() {
    assertEquals(Optional.of("Hello there"), decoder.decode(RichTextFixtures.typedStream("Hello there")));
  }

  @Test
  void decodesTwoByteLengthAndMultibyteText() {
    String text = "café 😀 ".repeat(30);
    assertEquals(Optional.of(text), decoder.decode(RichTextFixtures.typedStream(text)));
  }

  @Test
  void rejectsPayloadWithoutHeader() {
    byte[] payload = RichTextFixtures.typedStream("hi");
    payload[3] = 'X';
    assertTrue(decoder.decode(payload).isEmpty());
  }

  @Test
  void rejectsTruncatedPayload() {
    byte[] payload = RichTextFixtures.typedStream("a longer message body");
    byte[] truncated = Arrays.copyOf(payload, payload.length - 12);
    assertTrue(decoder.decode(truncated).isEmpty());
  }

  @Test
  void rejectsInvalidUtf8() {
    byte[] payload = RichTextFixtures.typedStream("ab");
    int at = indexOf(payload, "ab".getBytes(StandardCharsets.US_ASCII));
    payload[at] = (byte) 0xC3;
    payload[at + 1] = (byte) 0x28;
    assertTrue(decoder.decode(payload).isEmpty());
  }

  @Test
  void rejectsBlankTextAndNull() {
    assertTrue(decoder.decode(RichTextFixtures.typedStream("   ")).isEmpty());
    assertTrue(decoder.decode(null).isEmpty());
    assertTrue(decoder.decode(new byte[0]).isEmpty());
  }

  private static int indexOf(byte[] haystack, byte[] needle) {
    return TypedStreamDecoder.indexOf(haystack, needle, 0, haystack.length);
  }
}
