package ca.gc.cra.scribe.infrastructure.plist;

import com.dd.plist.NSArray;
import com.dd.plist.NSDictionary;
import com.dd.plist.NSObject;
import com.dd.plist.PropertyListFormatException;
import com.dd.plist.PropertyListParser;
import com.dd.plist.UID;
import java.io.IOException;
import java.text.ParseException;
import java.util.Optional;
import javax.xml.parsers.ParserConfigurationException;
import org.xml.sax.SAXException;

/**
 * Helpers for property lists and {@code NSKeyedArchiver} archives: parsing with uniform error handling and
 * following {@code UID} references into {@code $objects}.
 *
 * @since 0.1.0
 */
public final class KeyedArchives {
  /** Magic prefix of binary property lists. */
  public static final String BINARY_MAGIC = "bplist00";

  private KeyedArchives() {
    // Utility
  }

  /**
   * Parses a property list in any supported format.
   *
   * @param bytes encoded property list
   * @param name label used in error messages
   * @return root object
   * @throws IOException when the bytes are not a property list
   */
  public static NSObject parse(byte[] bytes, String name) throws IOException {
    try {
      return PropertyListParser.parse(bytes);
    } catch (PropertyListFormatException | ParseException | ParserConfigurationException | SAXException ex) {
      throw new IOException("Malformed property list " + name + ": " + ex.getMessage(), ex);
    } catch (RuntimeException ex) {
      throw new IOException("Malformed property list " + name, ex);
    }
  }

  /**
   * Reports whether bytes start with the binary property list magic.
   *
   * @param bytes candidate payload
   * @return {@code true} for {@code bplist00} payloads
   */
  public static boolean isBinaryPlist(byte[] bytes) {
    if (bytes == null || bytes.length < BINARY_MAGIC.length()) {
      return false;
    }
    for (int i = 0; i < BINARY_MAGIC.length(); i++) {
      if (bytes[i] != BINARY_MAGIC.charAt(i)) {
        return false;
      }
    }
    return true;
  }

  /**
   * Returns the {@code $objects} table of an archive.
   *
   * @param archive archive root dictionary
   * @return object table, or empty when the dictionary is not a keyed archive
   */
  public static Optional<NSArray> objects(NSDictionary archive) {
    NSObject objects = archive.objectForKey("$objects");
    return objects instanceof NSArray array ? Optional.of(array) : Optional.empty();
  }

  /**
   * Returns the archived root object ({@code $top.root}), falling back to the first real object.
   *
   * @param archive archive root dictionary
   * @param objects object table
   * @return root object, or {@code null}
   */
  public static NSObject root(NSDictionary archive, NSArray objects) {
    NSObject top = archive.objectForKey("$top");
    if (top instanceof NSDictionary topDictionary) {
      NSObject root = dereference(topDictionary.objectForKey("root"), objects);
      if (root != null) {
        return root;
      }
    }
    return objects.count() > 1 ? objects.objectAtIndex(1) : null;
  }

  /**
   * Resolves a {@code UID} reference; other values are returned unchanged.
   *
   * @param value value or reference
   * @param objects object table
   * @return referenced object, {@code value} itself, or {@code null} for dangling references
   */
  public static NSObject dereference(NSObject value, NSArray objects) {
    if (value instanceof UID uid) {
      long index = uidIndex(uid);
      if (index >= 0 && index < objects.count()) {
        return objects.objectAtIndex((int) index);
      }
      return null;
    }
    return value;
  }

  static long uidIndex(UID uid) {
    long index = 0;
    for (byte b : uid.getBytes()) {
      index = (index << 8) | (b & 0xFF);
    }
    return index;
  }
}
