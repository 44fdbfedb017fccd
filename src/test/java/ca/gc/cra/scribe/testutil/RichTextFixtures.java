package ca.gc.cra.scribe.testutil;

import com.dd.plist.BinaryPropertyListWriter;
import com.dd.plist.NSArray;
import com.dd.plist.NSData;
import com.dd.plist.NSDictionary;
import com.dd.plist.NSNumber;
import com.dd.plist.NSObject;
import com.dd.plist.NSString;
import com.dd.plist.UID;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

/** Builds archived rich-text payloads the way Messages stores them. */
public final class RichTextFixtures {
  private RichTextFixtures() {}

  /** Returns a {@code streamtyped} attributed string holding {@code text}. */
  public static byte[] typedStream(String text) {
    byte[] utf8 = text.getBytes(StandardCharsets.UTF_8);
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    out.write(0x04);
    out.write(0x0B);
    ascii(out, "streamtyped");
    bytes(out, 0x81, 0xE8, 0x03, 0x84, 0x01, 0x40, 0x84, 0x84, 0x84, 0x12);
    ascii(out, "NSAttributedString");
    bytes(out, 0x00, 0x84, 0x84, 0x08);
    ascii(out, "NSObject");
    bytes(out, 0x00, 0x85, 0x92, 0x84, 0x84, 0x84, 0x08);
    ascii(out, "NSString");
    bytes(out, 0x01, 0x94, 0x84, 0x01, 0x2B);
    if (utf8.length < 0x80) {
      out.write(utf8.length);
    } else {
      bytes(out, 0x81, utf8.length & 0xFF, (utf8.length >> 8) & 0xFF);
    }
    out.write(utf8, 0, utf8.length);
    bytes(out, 0x86, 0x84, 0x02, 0x69, 0x49, 0x01);
    return out.toByteArray();
  }

  /** Returns a binary keyed archive whose root object is an attributed string holding {@code text}. */
  public static byte[] keyedArchive(String text) {
    NSDictionary attributed = new NSDictionary();
    attributed.put("NS.string", new UID("string", new byte[] {2}));
    attributed.put("$class", new UID("class", new byte[] {3}));
    NSDictionary classInfo = new NSDictionary();
    classInfo.put("$classname", new NSString("NSAttributedString"));
    NSArray objects = new NSArray(new NSString("$null"), attributed, new NSString(text), classInfo);

    NSDictionary top = new NSDictionary();
    top.put("root", new UID("root", new byte[] {1}));
    NSDictionary archive = new NSDictionary();
    archive.put("$archiver", new NSString("NSKeyedArchiver"));
    archive.put("$version", new NSNumber(100000));
    archive.put("$top", top);
    archive.put("$objects", objects);
    return binary(archive);
  }

  /** Returns a keyed archive whose root attributed string references itself as its {@code NS.string}. */
  public static byte[] selfReferencingKeyedArchive() {
    NSDictionary attributed = new NSDictionary();
    attributed.put("NS.string", new UID("string", new byte[] {1}));
    NSDictionary top = new NSDictionary();
    top.put("root", new UID("root", new byte[] {1}));
    NSDictionary archive = new NSDictionary();
    archive.put("$archiver", new NSString("NSKeyedArchiver"));
    archive.put("$top", top);
    archive.put("$objects", new NSArray(new NSString("$null"), attributed));
    return binary(archive);
  }

  /**
   * Returns a {@code message_summary_info} property list with one edit-history part.
   *
   * @param edits alternating edit time (seconds) and text pairs
   */
  public static byte[] editHistory(Object... edits) {
    NSObject[] entries = new NSObject[edits.length / 2];
    for (int i = 0; i < entries.length; i++) {
      NSDictionary entry = new NSDictionary();
      entry.put("d", new NSNumber(((Number) edits[2 * i]).doubleValue()));
      entry.put("t", new NSData(typedStream((String) edits[2 * i + 1])));
      entries[i] = entry;
    }
    NSDictionary parts = new NSDictionary();
    parts.put("0", new NSArray(entries));
    NSDictionary summary = new NSDictionary();
    summary.put("ec", parts);
    summary.put("ep", new NSArray(new NSNumber(0)));
    return binary(summary);
  }

  /** Serializes a property list in binary form. */
  public static byte[] binary(NSObject root) {
    try {
      return BinaryPropertyListWriter.writeToArray(root);
    } catch (IOException ex) {
      throw new UncheckedIOException(ex);
    }
  }

  private static void ascii(ByteArrayOutputStream out, String value) {
    byte[] data = value.getBytes(StandardCharsets.US_ASCII);
    out.write(data, 0, data.length);
  }

  private static void bytes(ByteArrayOutputStream out, int... values) {
    for (int value : values) {
      out.write(value);
    }
  }
}
