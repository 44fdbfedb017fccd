package ca.gc.cra.scribe.domain.msg;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * <strong>What:</strong> Frozen output unit of the canonicalization pipeline.
 * <p><strong>Why:</strong> Downstream redaction and enrichment stages consume records read-only, so every collection
 * is deep-copied into unmodifiable form at construction.</p>
 * <p><strong>Invariants:</strong> traces to exactly one {@link RawRow} through {@link #sourceRef()}; never produced for
 * reaction rows.</p>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * @param id stable message id (row GUID, or {@code row:<ROWID>})
 * @param conversationId chat GUID; {@code null} fails validation
 * @param platform platform tag, always {@code imessage}
 * @param timestamp normalized UTC timestamp; {@code null} fails validation
 * @param sender resolved sender identity or {@code self}
 * @param fromSelf whether the device owner sent the message
 * @param text decoded text; empty when every decoder failed
 * @param attachments ordered attachment references
 * @param reactions ordered reactions
 * @param replyTo target message id, or {@code null}
 * @param sourceRef provenance pointer
 * @param sourceMeta sorted bag of every unmodelled platform field
 * @since 0.1.0
 */
public record CanonicalMessage(
    String id,
    String conversationId,
    String platform,
    Instant timestamp,
    String sender,
    boolean fromSelf,
    String text,
    List<AttachmentRef> attachments,
    List<Reaction> reactions,
    String replyTo,
    SourceRef sourceRef,
    Map<String, Object> sourceMeta) {

  /** Platform tag emitted for every record. */
  public static final String PLATFORM = "imessage";

  public CanonicalMessage {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(sourceRef, "sourceRef");
    platform = Objects.requireNonNullElse(platform, PLATFORM);
    text = Objects.requireNonNullElse(text, "");
    attachments = attachments == null ? List.of() : List.copyOf(attachments);
    reactions = reactions == null ? List.of() : List.copyOf(reactions);
    sourceMeta = freezeMap(sourceMeta == null ? Map.of() : sourceMeta);
  }

  /**
   * Copies a metadata value into an unmodifiable, key-sorted structure.
   *
   * @param value scalar, map, list or byte array
   * @return frozen value; byte arrays become Base64 strings
   */
  static Object freezeValue(Object value) {
    if (value instanceof Map<?, ?> map) {
      return freezeMap(map);
    }
    if (value instanceof List<?> list) {
      List<Object> copy = new ArrayList<>(list.size());
      for (Object element : list) {
        copy.add(freezeValue(element));
      }
      return Collections.unmodifiableList(copy);
    }
    if (value instanceof byte[] bytes) {
      return Base64.getEncoder().encodeToString(bytes);
    }
    return value;
  }

  private static Map<String, Object> freezeMap(Map<?, ?> source) {
    TreeMap<String, Object> copy = new TreeMap<>();
    for (Map.Entry<?, ?> entry : source.entrySet()) {
      copy.put(String.valueOf(entry.getKey()), freezeValue(entry.getValue()));
    }
    return Collections.unmodifiableMap(copy);
  }
}
