package ca.gc.cra.scribe.infrastructure.decode;

import ca.gc.cra.scribe.application.port.RichTextDecoder;
import ca.gc.cra.scribe.infrastructure.plist.KeyedArchives;
import com.dd.plist.NSArray;
import com.dd.plist.NSData;
import com.dd.plist.NSDate;
import com.dd.plist.NSDictionary;
import com.dd.plist.NSNumber;
import com.dd.plist.NSObject;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Recovers the latest edited text from a {@code message_summary_info} property list.
 *
 * <p>Edits live under {@code ec}, keyed by message part, each a list of entries whose {@code t} value is a
 * typed-stream archive. The lowest part with entries is read and its most recent entry (by {@code d}, else by
 * position) wins.</p>
 *
 * @since 0.1.0
 */
public final class EditHistoryDecoder implements RichTextDecoder {
  private static final Logger log = LoggerFactory.getLogger(EditHistoryDecoder.class);

  private final RichTextDecoder entryDecoder;

  public EditHistoryDecoder() {
    this(new TypedStreamDecoder());
  }

  public EditHistoryDecoder(RichTextDecoder entryDecoder) {
    this.entryDecoder = Objects.requireNonNull(entryDecoder, "entryDecoder");
  }

  @Override
  public String name() {
    return "edit_history";
  }

  @Override
  public Optional<String> decode(byte[] payload) {
    if (!KeyedArchives.isBinaryPlist(payload)) {
      return Optional.empty();
    }
    NSObject parsed;
    try {
      parsed = KeyedArchives.parse(payload, "message_summary_info");
    } catch (IOException ex) {
      log.debug("Edit history rejected: {}", ex.getMessage());
      return Optional.empty();
    }
    if (!(parsed instanceof NSDictionary summary)) {
      return Optional.empty();
    }
    NSObject edits = summary.objectForKey("ec");
    if (!(edits instanceof NSDictionary parts)) {
      return Optional.empty();
    }
    List<String> keys = new ArrayList<>(parts.keySet());
    keys.sort(EditHistoryDecoder::comparePartKeys);
    for (String key : keys) {
      NSObject value = parts.objectForKey(key);
      if (!(value instanceof NSArray entries) || entries.count() == 0) {
        continue;
      }
      NSDictionary latest = latest(entries);
      if (latest == null) {
        continue;
      }
      NSObject text = latest.objectForKey("t");
      if (text instanceof NSData data) {
        return entryDecoder.decode(data.bytes());
      }
      return Optional.empty();
    }
    return Optional.empty();
  }

  private static NSDictionary latest(NSArray entries) {
    NSDictionary best = null;
    double bestTime = Double.NEGATIVE_INFINITY;
    for (NSObject entry : entries.getArray()) {
      if (!(entry instanceof NSDictionary dictionary)) {
        continue;
      }
      double time = timeOf(dictionary.objectForKey("d"));
      if (best == null || time >= bestTime) {
        best = dictionary;
        bestTime = time;
      }
    }
    return best;
  }

  private static double timeOf(NSObject value) {
    if (value instanceof NSNumber number) {
      return number.doubleValue();
    }
    if (value instanceof NSDate date) {
      return date.getDate().getTime();
    }
    return Double.NEGATIVE_INFINITY;
  }

  private static int comparePartKeys(String left, String right) {
    try {
      return Long.compare(Long.parseLong(left), Long.parseLong(right));
    } catch (NumberFormatException ex) {
      return left.compareTo(right);
    }
  }
}
