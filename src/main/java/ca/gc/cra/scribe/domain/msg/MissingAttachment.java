package ca.gc.cra.scribe.domain.msg;

/**
 * Attachment whose bytes were reachable through neither the live nor the backup path.
 *
 * @param conversationId owning conversation; may be {@code null}
 * @param messageId owning canonical message id
 * @param attachmentRowId {@code attachment.ROWID}
 * @param filename stored filename
 * @param reason {@code not_found} or {@code unreadable}
 * @since 0.1.0
 */
public record MissingAttachment(
    String conversationId, String messageId, long attachmentRowId, String filename, String reason) {}
