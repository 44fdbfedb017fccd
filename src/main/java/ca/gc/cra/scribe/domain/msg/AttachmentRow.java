package ca.gc.cra.scribe.domain.msg;

/**
 * Attachment record joined to its owning message row.
 *
 * @param rowId {@code attachment.ROWID}
 * @param messageRowId owning {@code message.ROWID}
 * @param guid attachment GUID
 * @param filename stored path, usually {@code ~/Library/Messages/Attachments/...}
 * @param mimeType MIME type hint
 * @param uti uniform type identifier hint
 * @param transferName original file name shown to the user
 * @param totalBytes declared size; {@code null} when unknown
 * @since 0.1.0
 */
public record AttachmentRow(
    long rowId,
    long messageRowId,
    String guid,
    String filename,
    String mimeType,
    String uti,
    String transferName,
    Long totalBytes) {

  /**
   * Returns the best display name: the transfer name, else the last path segment of the filename.
   *
   * @return display name, or {@code null} when neither is known
   */
  public String displayName() {
    if (transferName != null && !transferName.isBlank()) {
      return transferName;
    }
    if (filename == null || filename.isBlank()) {
      return null;
    }
    int slash = filename.lastIndexOf('/');
    return slash >= 0 ? filename.substring(slash + 1) : filename;
  }
}
