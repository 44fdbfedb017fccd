package ca.gc.cra.scribe.application.port;

import ca.gc.cra.scribe.domain.msg.AttachmentRow;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Maps an attachment record to a retrievable byte source.
 *
 * @since 0.1.0
 */
public interface AttachmentLocator {
  /**
   * Locates the bytes for an attachment.
   *
   * @param attachment attachment record
   * @return resolved byte source, or empty when this locator cannot find it
   * @throws IOException when a source exists but cannot be read or decrypted
   */
  Optional<ResolvedAttachment> locate(AttachmentRow attachment) throws IOException;

  /**
   * Located attachment bytes.
   *
   * @param sourcePath path of the byte source as stored (live file or backup blob)
   * @param readablePath plaintext copy; equals {@code sourcePath} unless the blob was decrypted
   * @param origin {@code live} or {@code backup}
   */
  record ResolvedAttachment(Path sourcePath, Path readablePath, String origin) {
    public ResolvedAttachment {
      Objects.requireNonNull(sourcePath, "sourcePath");
      Objects.requireNonNull(readablePath, "readablePath");
      Objects.requireNonNull(origin, "origin");
    }
  }
}
