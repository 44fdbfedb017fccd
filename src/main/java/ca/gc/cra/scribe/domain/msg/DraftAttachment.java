package ca.gc.cra.scribe.domain.msg;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Mutable attachment state while the Attachment Resolver and transcription stage run.
 *
 * <p>{@code readablePath} is the plaintext copy used for hashing and transcription; it can differ from
 * {@code absPath} for encrypted backups and is never emitted.</p>
 *
 * @since 0.1.0
 */
public final class DraftAttachment {
  private final AttachmentRow row;
  private final AttachmentType type;
  private String absPath;
  private String contentHash;
  private Path readablePath;

  public DraftAttachment(AttachmentRow row) {
    this.row = Objects.requireNonNull(row, "row");
    this.type = AttachmentType.classify(row.mimeType(), row.uti(), row.filename());
  }

  public AttachmentRow row() {
    return row;
  }

  public AttachmentType type() {
    return type;
  }

  public String absPath() {
    return absPath;
  }

  public String contentHash() {
    return contentHash;
  }

  public Path readablePath() {
    return readablePath;
  }

  public boolean resolved() {
    return absPath != null;
  }

  /**
   * Records a resolved byte source.
   *
   * @param sourcePath path emitted as {@code abs_path}
   * @param readable plaintext path for hashing and transcription
   * @param hash {@code sha256:<hex>} or {@code null}
   */
  public void resolve(String sourcePath, Path readable, String hash) {
    this.absPath = Objects.requireNonNull(sourcePath, "sourcePath");
    this.readablePath = readable;
    this.contentHash = hash;
  }

  public AttachmentRef toRef() {
    return new AttachmentRef(type, row.displayName(), absPath, contentHash, row.mimeType(), row.uti(),
        row.transferName(), row.totalBytes(), row.rowId());
  }
}
