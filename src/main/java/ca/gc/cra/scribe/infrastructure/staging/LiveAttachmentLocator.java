package ca.gc.cra.scribe.infrastructure.staging;

import ca.gc.cra.scribe.application.port.AttachmentLocator;
import ca.gc.cra.scribe.domain.msg.AttachmentRow;
import java.io.IOException;
import java.nio.file.AccessDeniedException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Resolves attachment filenames against the local filesystem.
 *
 * <p>A leading {@code ~} expands to the configured attachments home; relative names resolve against
 * the directory holding the source database.</p>
 *
 * @since 0.1.0
 */
public final class LiveAttachmentLocator implements AttachmentLocator {
  static final String ORIGIN = "live";

  private final Path attachmentsHome;
  private final Path databaseDirectory;

  /**
   * Creates the locator.
   *
   * @param attachmentsHome replacement for a leading {@code ~}
   * @param databaseDirectory base for relative filenames; may be {@code null}
   */
  public LiveAttachmentLocator(Path attachmentsHome, Path databaseDirectory) {
    this.attachmentsHome = Objects.requireNonNull(attachmentsHome, "attachmentsHome");
    this.databaseDirectory = databaseDirectory;
  }

  @Override
  public Optional<ResolvedAttachment> locate(AttachmentRow attachment) throws IOException {
    Optional<Path> candidate = expand(attachment.filename());
    if (candidate.isEmpty()) {
      return Optional.empty();
    }
    Path path = candidate.get();
    if (!Files.exists(path)) {
      return Optional.empty();
    }
    if (!Files.isRegularFile(path)) {
      return Optional.empty();
    }
    if (!Files.isReadable(path)) {
      throw new AccessDeniedException(path.toString(), null, "attachment is not readable");
    }
    return Optional.of(new ResolvedAttachment(path, path, ORIGIN));
  }

  Optional<Path> expand(String filename) {
    if (filename == null || filename.isBlank()) {
      return Optional.empty();
    }
    try {
      if (filename.equals("~")) {
        return Optional.of(attachmentsHome);
      }
      if (filename.startsWith("~/")) {
        return Optional.of(attachmentsHome.resolve(filename.substring(2)).normalize());
      }
      Path path = Path.of(filename);
      if (path.isAbsolute() || databaseDirectory == null) {
        return Optional.of(path.normalize());
      }
      return Optional.of(databaseDirectory.resolve(path).normalize());
    } catch (InvalidPathException ex) {
      return Optional.empty();
    }
  }
}
