package ca.gc.cra.scribe.infrastructure.decode;

import ca.gc.cra.scribe.application.port.RichTextDecoder;
import ca.gc.cra.scribe.infrastructure.plist.KeyedArchives;
import com.dd.plist.NSArray;
import com.dd.plist.NSDictionary;
import com.dd.plist.NSObject;
import com.dd.plist.NSString;
import java.io.IOException;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Extracts string content from {@code bplist00} keyed archives of attributed strings.
 *
 * <p>The archived root is tried first; otherwise the first archived object carrying {@code NS.string} wins.
 * Each dictionary is visited at most once per lookup, so self-referencing archives yield no text.</p>
 *
 * @since 0.1.0
 */
public final class KeyedArchiveDecoder implements RichTextDecoder {
  private static final Logger log = LoggerFactory.getLogger(KeyedArchiveDecoder.class);
  private static final List<String> STRING_KEYS = List.of("NS.string", "NSString");

  @Override
  public String name() {
    return "keyed_archive";
  }

  @Override
  public Optional<String> decode(byte[] payload) {
    if (!KeyedArchives.isBinaryPlist(payload)) {
      return Optional.empty();
    }
    NSObject parsed;
    try {
      parsed = KeyedArchives.parse(payload, "attributedBody");
    } catch (IOException ex) {
      log.debug("Keyed archive rejected: {}", ex.getMessage());
      return Optional.empty();
    }
    if (!(parsed instanceof NSDictionary archive)) {
      return Optional.empty();
    }
    Optional<NSArray> table = KeyedArchives.objects(archive);
    if (table.isEmpty()) {
      return Optional.empty();
    }
    NSArray objects = table.get();
    Optional<String> fromRoot = stringOf(KeyedArchives.root(archive, objects), objects, newVisitedSet());
    if (fromRoot.isPresent()) {
      return fromRoot;
    }
    for (NSObject candidate : objects.getArray()) {
      if (candidate instanceof NSDictionary) {
        Optional<String> text = stringOf(candidate, objects, newVisitedSet());
        if (text.isPresent()) {
          return text;
        }
      }
    }
    return Optional.empty();
  }

  private static Optional<String> stringOf(NSObject object, NSArray objects, Set<NSObject> visited) {
    if (object instanceof NSString text) {
      return nonBlank(text.getContent());
    }
    if (!(object instanceof NSDictionary dictionary) || !visited.add(dictionary)) {
      return Optional.empty();
    }
    for (String key : STRING_KEYS) {
      NSObject value = KeyedArchives.dereference(dictionary.objectForKey(key), objects);
      if (value instanceof NSString text) {
        return nonBlank(text.getContent());
      }
      if (value instanceof NSDictionary nested) {
        Optional<String> inner = stringOf(nested, objects, visited);
        if (inner.isPresent()) {
          return inner;
        }
      }
    }
    return Optional.empty();
  }

  private static Set<NSObject> newVisitedSet() {
    return Collections.newSetFromMap(new IdentityHashMap<>());
  }

  private static Optional<String> nonBlank(String value) {
    return value == null || value.isBlank() ? Optional.empty() : Optional.of(value);
  }
}
