package ca.gc.cra.scribe.application.pipeline;

import ca.gc.cra.scribe.application.port.RichTextDecoder;
import ca.gc.cra.scribe.domain.msg.DraftMessage;
import ca.gc.cra.scribe.domain.msg.RawRow;
import ca.gc.cra.scribe.domain.msg.SourceRef;
import ca.gc.cra.scribe.domain.report.RunCounter;
import ca.gc.cra.scribe.domain.report.RunReport;
import ca.gc.cra.scribe.domain.schema.SchemaGeneration;
import ca.gc.cra.scribe.domain.time.AppleTimestamps;
import java.time.DateTimeException;
import java.time.Instant;
import java.util.Base64;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Converts one {@link RawRow} into a {@link DraftMessage}.
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Normalize the raw date into a UTC instant.</li>
 *   <li>Resolve text through the fallback chain: plain column, rich-text decoders, edit history.</li>
 *   <li>Resolve the sender and preserve every unmodelled column under {@code source_meta}.</li>
 * </ul>
 * <p>Rows are never dropped: a row whose payloads all fail to decode keeps empty text and carries the raw
 * payloads Base64-encoded under {@code source_meta.raw}.</p>
 * <p><strong>Thread-safety:</strong> Stateless apart from the shared {@link RunReport}; safe to reuse.</p>
 *
 * @since 0.1.0
 */
public final class RowDecoder {
  private static final Logger log = LoggerFactory.getLogger(RowDecoder.class);

  static final String ATTRIBUTED_BODY_COLUMN = "attributedBody";
  static final String SUMMARY_INFO_COLUMN = "message_summary_info";

  private final List<RichTextDecoder> richTextDecoders;
  private final RichTextDecoder editHistoryDecoder;
  private final String sourcePath;
  private final RunReport report;

  /**
   * Creates a decoder.
   *
   * @param richTextDecoders decoders for the archived rich-text payload, tried in order
   * @param editHistoryDecoder decoder for the edit-history payload
   * @param sourcePath operator-supplied source path recorded in {@code source_ref}
   * @param report run report receiving decode counters
   */
  public RowDecoder(
      List<RichTextDecoder> richTextDecoders,
      RichTextDecoder editHistoryDecoder,
      String sourcePath,
      RunReport report) {
    this.richTextDecoders = List.copyOf(Objects.requireNonNull(richTextDecoders, "richTextDecoders"));
    this.editHistoryDecoder = Objects.requireNonNull(editHistoryDecoder, "editHistoryDecoder");
    this.sourcePath = Objects.requireNonNull(sourcePath, "sourcePath");
    this.report = Objects.requireNonNull(report, "report");
  }

  /**
   * Decodes one row.
   *
   * @param row raw row
   * @param generation detected schema generation
   * @return draft message; never {@code null}
   */
  public DraftMessage decode(RawRow row, SchemaGeneration generation) {
    Objects.requireNonNull(row, "row");
    Objects.requireNonNull(generation, "generation");
    Map<String, Object> meta = new TreeMap<>();
    if (row.service() != null) {
      meta.put("service", row.service());
    }
    if (row.handleId() != null) {
      meta.put("handle_id", row.handleId());
    }
    if (row.rawDate() != null) {
      meta.put("date_raw", row.rawDate());
    }
    if (row.threadOriginatorGuid() != null) {
      meta.put("thread_originator_guid", row.threadOriginatorGuid());
    }
    if (!row.extras().isEmpty()) {
      meta.put("columns", row.extras());
    }

    String text = resolveText(row, generation, meta);
    DraftMessage draft = new DraftMessage(
        messageId(row),
        row.conversationId(),
        normalizeTimestamp(row),
        sender(row),
        row.fromSelf(),
        text,
        new SourceRef(sourcePath, row.guid(), row.rowId()),
        meta);
    report.increment(RunCounter.MESSAGES_DECODED);
    return draft;
  }

  /**
   * Returns the stable canonical id for a row.
   *
   * @param row raw row
   * @return GUID, or {@code row:<ROWID>} when the GUID is blank
   */
  public static String messageId(RawRow row) {
    String guid = row.guid();
    return guid == null || guid.isBlank() ? "row:" + row.rowId() : guid;
  }

  /**
   * Resolves the sender identity without normalizing addresses.
   *
   * @param row raw row
   * @return {@code self}, the handle address verbatim, or {@code unknown:<handle_id>}
   */
  public static String sender(RawRow row) {
    if (row.fromSelf()) {
      return DraftMessage.SELF;
    }
    String address = row.handleAddress();
    if (address != null && !address.isBlank()) {
      return address;
    }
    return row.handleId() == null ? "unknown" : "unknown:" + row.handleId();
  }

  private Instant normalizeTimestamp(RawRow row) {
    Long raw = row.rawDate();
    if (raw == null) {
      report.increment(RunCounter.TIMESTAMPS_MISSING);
      return null;
    }
    try {
      return AppleTimestamps.normalize(raw);
    } catch (DateTimeException | ArithmeticException ex) {
      log.debug("Row {} has an out-of-range date {}", row.rowId(), raw);
      report.increment(RunCounter.TIMESTAMPS_MISSING);
      return null;
    }
  }

  private String resolveText(RawRow row, SchemaGeneration generation, Map<String, Object> meta) {
    String plain = row.text();
    if (plain != null && !plain.isBlank()) {
      meta.put("text_source", "text");
      return plain;
    }

    byte[] body = generation.declares(ATTRIBUTED_BODY_COLUMN) ? row.attributedBody() : null;
    if (body != null && body.length > 0) {
      for (RichTextDecoder decoder : richTextDecoders) {
        Optional<String> decoded = attempt(decoder, body, row.rowId());
        if (decoded.isPresent()) {
          meta.put("text_source", "attributed_body");
          meta.put("text_decoder", decoder.name());
          return decoded.get();
        }
      }
    }

    byte[] summary = generation.declares(SUMMARY_INFO_COLUMN) ? row.messageSummaryInfo() : null;
    if (summary != null && summary.length > 0) {
      Optional<String> decoded = attempt(editHistoryDecoder, summary, row.rowId());
      if (decoded.isPresent()) {
        meta.put("text_source", "edit_history");
        meta.put("text_decoder", editHistoryDecoder.name());
        return decoded.get();
      }
    }

    meta.put("text_source", "none");
    boolean hadPayload = (body != null && body.length > 0) || (summary != null && summary.length > 0);
    if (hadPayload) {
      Map<String, Object> raw = new TreeMap<>();
      if (body != null && body.length > 0) {
        raw.put("attributed_body_b64", Base64.getEncoder().encodeToString(body));
      }
      if (summary != null && summary.length > 0) {
        raw.put("message_summary_info_b64", Base64.getEncoder().encodeToString(summary));
      }
      meta.put("raw", raw);
      report.increment(RunCounter.TEXT_DECODE_FAILURES);
      log.debug("Row {} kept raw payloads; no decoder produced text", row.rowId());
    }
    return plain == null ? "" : plain;
  }

  private static Optional<String> attempt(RichTextDecoder decoder, byte[] payload, long rowId) {
    try {
      return decoder.decode(payload);
    } catch (RuntimeException ex) {
      log.debug("Decoder {} failed on row {}: {}", decoder.name(), rowId, ex.toString());
      return Optional.empty();
    }
  }
}
