package ca.gc.cra.scribe.domain.msg;

import java.util.Arrays;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Platform-native message row as read from the staged database.
 *
 * <p>Immutable: binary payloads are copied on construction and on access. {@code extras} holds
 * every message column that is not modelled by a dedicated component, with BLOBs Base64-encoded.</p>
 *
 * @param rowId {@code message.ROWID}
 * @param guid message GUID; may be {@code null} on damaged rows
 * @param associationKey raw {@code associated_message_guid}, prefixes included
 * @param associationType {@code associated_message_type}; {@code 0} when absent
 * @param rawDate raw {@code date} value; {@code null} when the column is null
 * @param text plain {@code text} column
 * @param attributedBody archived rich-text payload
 * @param messageSummaryInfo edit-history payload
 * @param fromSelf {@code is_from_me}
 * @param service service tag such as {@code iMessage} or {@code SMS}
 * @param conversationId chat GUID joined through {@code chat_message_join}
 * @param handleId {@code handle_id}
 * @param handleAddress {@code handle.id} address for the handle
 * @param threadOriginatorGuid inline-reply thread origin
 * @param associatedEmoji custom emoji for emoji reactions
 * @param extras remaining columns keyed by column name
 * @since 0.1.0
 */
public record RawRow(
    long rowId,
    String guid,
    String associationKey,
    int associationType,
    Long rawDate,
    String text,
    byte[] attributedBody,
    byte[] messageSummaryInfo,
    boolean fromSelf,
    String service,
    String conversationId,
    Long handleId,
    String handleAddress,
    String threadOriginatorGuid,
    String associatedEmoji,
    Map<String, Object> extras) {

  public RawRow {
    attributedBody = copy(attributedBody);
    messageSummaryInfo = copy(messageSummaryInfo);
    extras = extras == null
        ? Map.of()
        : Collections.unmodifiableMap(new TreeMap<>(Objects.requireNonNull(extras)));
  }

  @Override
  public byte[] attributedBody() {
    return copy(attributedBody);
  }

  @Override
  public byte[] messageSummaryInfo() {
    return copy(messageSummaryInfo);
  }

  /**
   * Reports whether the row references another row through the association columns.
   *
   * @return {@code true} when an association key is present
   */
  public boolean hasAssociation() {
    return associationKey != null && !associationKey.isBlank();
  }

  /**
   * Returns a builder seeded with the row identifier.
   *
   * @param rowId message row identifier
   * @return new builder
   */
  public static Builder builder(long rowId) {
    return new Builder(rowId);
  }

  private static byte[] copy(byte[] value) {
    return value == null ? null : Arrays.copyOf(value, value.length);
  }

  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    }
    if (!(other instanceof RawRow row)) {
      return false;
    }
    return rowId == row.rowId
        && associationType == row.associationType
        && fromSelf == row.fromSelf
        && Objects.equals(guid, row.guid)
        && Objects.equals(associationKey, row.associationKey)
        && Objects.equals(rawDate, row.rawDate)
        && Objects.equals(text, row.text)
        && Arrays.equals(attributedBody, row.attributedBody)
        && Arrays.equals(messageSummaryInfo, row.messageSummaryInfo)
        && Objects.equals(service, row.service)
        && Objects.equals(conversationId, row.conversationId)
        && Objects.equals(handleId, row.handleId)
        && Objects.equals(handleAddress, row.handleAddress)
        && Objects.equals(threadOriginatorGuid, row.threadOriginatorGuid)
        && Objects.equals(associatedEmoji, row.associatedEmoji)
        && Objects.equals(extras, row.extras);
  }

  @Override
  public int hashCode() {
    int result = Objects.hash(rowId, guid, associationKey, associationType, rawDate, text, fromSelf,
        service, conversationId, handleId, handleAddress, threadOriginatorGuid, associatedEmoji, extras);
    result = 31 * result + Arrays.hashCode(attributedBody);
    return 31 * result + Arrays.hashCode(messageSummaryInfo);
  }

  @Override
  public String toString() {
    return "RawRow[rowId=" + rowId + ", guid=" + guid + ", associationType=" + associationType + "]";
  }

  /** Mutable builder used by database readers and tests. */
  public static final class Builder {
    private final long rowId;
    private String guid;
    private String associationKey;
    private int associationType;
    private Long rawDate;
    private String text;
    private byte[] attributedBody;
    private byte[] messageSummaryInfo;
    private boolean fromSelf;
    private String service;
    private String conversationId;
    private Long handleId;
    private String handleAddress;
    private String threadOriginatorGuid;
    private String associatedEmoji;
    private Map<String, Object> extras = new TreeMap<>();

    private Builder(long rowId) {
      this.rowId = rowId;
    }

    public Builder guid(String value) {
      this.guid = value;
      return this;
    }

    public Builder association(String key, int type) {
      this.associationKey = key;
      this.associationType = type;
      return this;
    }

    public Builder rawDate(Long value) {
      this.rawDate = value;
      return this;
    }

    public Builder text(String value) {
      this.text = value;
      return this;
    }

    public Builder attributedBody(byte[] value) {
      this.attributedBody = value;
      return this;
    }

    public Builder messageSummaryInfo(byte[] value) {
      this.messageSummaryInfo = value;
      return this;
    }

    public Builder fromSelf(boolean value) {
      this.fromSelf = value;
      return this;
    }

    public Builder service(String value) {
      this.service = value;
      return this;
    }

    public Builder conversationId(String value) {
      this.conversationId = value;
      return this;
    }

    public Builder handle(Long id, String address) {
      this.handleId = id;
      this.handleAddress = address;
      return this;
    }

    public Builder threadOriginatorGuid(String value) {
      this.threadOriginatorGuid = value;
      return this;
    }

    public Builder associatedEmoji(String value) {
      this.associatedEmoji = value;
      return this;
    }

    public Builder extra(String column, Object value) {
      this.extras.put(Objects.requireNonNull(column, "column"), value);
      return this;
    }

    public RawRow build() {
      return new RawRow(rowId, guid, associationKey, associationType, rawDate, text, attributedBody,
          messageSummaryInfo, fromSelf, service, conversationId, handleId, handleAddress,
          threadOriginatorGuid, associatedEmoji, extras);
    }
  }
}
