package ca.gc.cra.scribe.infrastructure.decode;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.scribe.testutil.RichTextFixtures;
import com.dd.plist.NSArray;
import com.dd.plist.NSData;
import com.dd.plist.NSDictionary;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class EditHistoryDecoderTest {
  private final EditHistoryDecoder decoder = new EditHistoryDecoder();

  @Test
  void picksMostRecentEdit() {
    byte[] summary = RichTextFixtures.editHistory(700_000_100d, "second", 700_000_000d, "first");
    assertEquals(Optional.of("second"), decoder.decode(summary));
  }

  @Test
  void picksLastEntryWhenTimesTie() {
    byte[] summary = RichTextFixtures.editHistory(5d, "original", 5d, "edited");
    assertEquals(Optional.of("edited"), decoder.decode(summary));
  }

  @Test
  void readsLowestNumberedPart() {
    NSDictionary later = entry("part ten");
    NSDictionary earlier = entry("part two");
    NSDictionary parts = new NSDictionary();
    parts.put("10", new NSArray(later));
    parts.put("2", new NSArray(earlier));
    NSDictionary summary = new NSDictionary();
    summary.put("ec", parts);
    assertEquals(Optional.of("part two"), decoder.decode(RichTextFixtures.binary(summary)));
  }

  @Test
  void emptyWithoutEditHistory() {
    NSDictionary summary = new NSDictionary();
    summary.put("amc", new NSArray());
    assertTrue(decoder.decode(RichTextFixtures.binary(summary)).isEmpty());
    assertTrue(decoder.decode(null).isEmpty());
  }

  private static NSDictionary entry(String text) {
    NSDictionary entry = new NSDictionary();
    entry.put("t", new NSData(RichTextFixtures.typedStream(text)));
    return entry;
  }
}
