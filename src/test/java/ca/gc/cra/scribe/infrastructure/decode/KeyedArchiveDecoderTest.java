package ca.gc.cra.scribe.infrastructure.decode;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.scribe.testutil.RichTextFixtures;
import com.dd.plist.NSArray;
import com.dd.plist.NSDictionary;
import com.dd.plist.NSString;
import java.nio.charset.StandardCharsets;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class KeyedArchiveDecoderTest {
  private final KeyedArchiveDecoder decoder = new KeyedArchiveDecoder();

  @Test
  void decodesArchivedRootString() {
    assertEquals(Optional.of("See you at 6"), decoder.decode(RichTextFixtures.keyedArchive("See you at 6")));
  }

  @Test
  void ignoresTypedStreamPayloads() {
    assertTrue(decoder.decode(RichTextFixtures.typedStream("not a plist")).isEmpty());
  }

  @Test
  void rejectsCorruptBinaryPlist() {
    byte[] garbage = "bplist00 this is not a property list".getBytes(StandardCharsets.US_ASCII);
    assertTrue(decoder.decode(garbage).isEmpty());
  }

  @Test
  void rejectsDictionaryWithoutObjectTable() {
    NSDictionary plain = new NSDictionary();
    plain.put("NS.string", new NSString("loose"));
    assertTrue(decoder.decode(RichTextFixtures.binary(plain)).isEmpty());
  }

  @Test
  void fallsBackToFirstArchivedStringHolder() {
    NSDictionary holder = new NSDictionary();
    holder.put("NS.string", new NSString("inline text"));
    NSDictionary archive = new NSDictionary();
    archive.put("$objects", new NSArray(new NSString("$null"), new NSString(" "), holder));
    assertEquals(Optional.of("inline text"), decoder.decode(RichTextFixtures.binary(archive)));
  }

  @Test
  void selfReferencingArchiveYieldsNoText() {
    assertTrue(decoder.decode(RichTextFixtures.selfReferencingKeyedArchive()).isEmpty());
  }
}
