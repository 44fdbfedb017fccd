package ca.gc.cra.scribe.domain.msg;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.ListIterator;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Canonical message under construction.
 *
 * <p>The Row Decoder fills identity, timestamp, sender and text. After that only the relationship,
 * attachment and transcription stages touch it, and {@link #freeze()} produces the immutable record.
 * Not thread-safe; attachment workers only mutate their own {@link DraftAttachment}.</p>
 *
 * @since 0.1.0
 */
public final class DraftMessage {
  /** Reserved sender identity for the device owner. */
  public static final String SELF = "self";

  private final String id;
  private final String conversationId;
  private final Instant timestamp;
  private final String sender;
  private final boolean fromSelf;
  private final String text;
  private final SourceRef sourceRef;
  private final Map<String, Object> sourceMeta;
  private final List<Reaction> reactions = new ArrayList<>();
  private final List<DraftAttachment> attachments = new ArrayList<>();
  private final List<Transcript> transcripts = new ArrayList<>();
  private String replyTo;

  public DraftMessage(
      String id,
      String conversationId,
      Instant timestamp,
      String sender,
      boolean fromSelf,
      String text,
      SourceRef sourceRef,
      Map<String, Object> sourceMeta) {
    this.id = Objects.requireNonNull(id, "id");
    this.conversationId = conversationId;
    this.timestamp = timestamp;
    this.sender = Objects.requireNonNull(sender, "sender");
    this.fromSelf = fromSelf;
    this.text = Objects.requireNonNullElse(text, "");
    this.sourceRef = Objects.requireNonNull(sourceRef, "sourceRef");
    this.sourceMeta = new TreeMap<>(sourceMeta == null ? Map.of() : sourceMeta);
  }

  public String id() {
    return id;
  }

  public String conversationId() {
    return conversationId;
  }

  public Instant timestamp() {
    return timestamp;
  }

  public String sender() {
    return sender;
  }

  public boolean fromSelf() {
    return fromSelf;
  }

  public String text() {
    return text;
  }

  public SourceRef sourceRef() {
    return sourceRef;
  }

  public String replyTo() {
    return replyTo;
  }

  public List<Reaction> reactions() {
    return List.copyOf(reactions);
  }

  public List<DraftAttachment> attachments() {
    return attachments;
  }

  public Object meta(String key) {
    return sourceMeta.get(key);
  }

  public void putMeta(String key, Object value) {
    sourceMeta.put(Objects.requireNonNull(key, "key"), value);
  }

  public void replyTo(String targetId) {
    this.replyTo = targetId;
  }

  /**
   * Appends a reaction unless an identical one (actor, kind, timestamp) is already present.
   *
   * @param reaction reaction to fold
   * @return {@code true} when appended
   */
  public boolean addReaction(Reaction reaction) {
    Objects.requireNonNull(reaction, "reaction");
    if (reactions.contains(reaction)) {
      return false;
    }
    reactions.add(reaction);
    return true;
  }

  /**
   * Removes the most recently folded reaction with the same actor and kind.
   *
   * @param removal reaction describing the removal
   * @return {@code true} when a reaction was removed
   */
  public boolean removeLatestReaction(Reaction removal) {
    ListIterator<Reaction> it = reactions.listIterator(reactions.size());
    while (it.hasPrevious()) {
      if (it.previous().sameActorAndKind(removal)) {
        it.remove();
        return true;
      }
    }
    return false;
  }

  public void addAttachment(DraftAttachment attachment) {
    attachments.add(Objects.requireNonNull(attachment, "attachment"));
  }

  public void addTranscript(Transcript transcript) {
    transcripts.add(Objects.requireNonNull(transcript, "transcript"));
  }

  /**
   * Produces the immutable canonical record.
   *
   * @return frozen message
   */
  public CanonicalMessage freeze() {
    Map<String, Object> meta = new TreeMap<>(sourceMeta);
    if (!transcripts.isEmpty()) {
      List<Map<String, Object>> entries = new ArrayList<>(transcripts.size());
      for (Transcript transcript : transcripts) {
        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("attachment", transcript.attachment());
        entry.put("engine", transcript.engine());
        entry.put("model", transcript.model());
        entry.put("text", transcript.text());
        entries.add(entry);
      }
      meta.put("transcript", entries);
    }
    List<AttachmentRef> refs = new ArrayList<>(attachments.size());
    for (DraftAttachment attachment : attachments) {
      refs.add(attachment.toRef());
    }
    return new CanonicalMessage(id, conversationId, CanonicalMessage.PLATFORM, timestamp, sender,
        fromSelf, text, refs, reactions, replyTo, sourceRef, meta);
  }
}
