package ca.gc.cra.scribe.domain.msg;

import java.util.Objects;

/**
 * Reference to an attachment owned by one canonical message. Never embeds attachment bytes.
 *
 * @param type coarse classification
 * @param filename display file name
 * @param absPath resolved byte-source path, or {@code null} when unresolved
 * @param contentHash {@code sha256:<hex>} of the bytes, or {@code null}
 * @param mimeType MIME hint
 * @param uti UTI hint
 * @param transferName original transfer name
 * @param totalBytes declared size
 * @param attachmentRowId source {@code attachment.ROWID}
 * @since 0.1.0
 */
public record AttachmentRef(
    AttachmentType type,
    String filename,
    String absPath,
    String contentHash,
    String mimeType,
    String uti,
    String transferName,
    Long totalBytes,
    long attachmentRowId) {

  public AttachmentRef {
    type = Objects.requireNonNullElse(type, AttachmentType.UNKNOWN);
  }

  /**
   * Reports whether a byte source was found.
   *
   * @return {@code true} when {@code absPath} is set
   */
  public boolean resolved() {
    return absPath != null;
  }
}
