package ca.gc.cra.scribe.infrastructure.backup;

import ca.gc.cra.scribe.application.port.AttachmentLocator;
import ca.gc.cra.scribe.domain.msg.AttachmentRow;
import ca.gc.cra.scribe.infrastructure.backup.BackupManifest.ManifestEntry;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Maps device attachment paths to backup blobs through the manifest.
 *
 * <p>{@code ~/Library/SMS/Attachments/...} and {@code /var/mobile/Library/SMS/Attachments/...} both map to
 * {@code MediaDomain / Library/SMS/Attachments/...}. Encrypted blobs are decrypted once into the run's working
 * directory.</p>
 *
 * @since 0.1.0
 */
final class BackupAttachmentLocator implements AttachmentLocator {
  static final String ORIGIN = "backup";
  private static final List<String> DEVICE_HOMES = List.of("~/", "/private/var/mobile/", "/var/mobile/");

  private final BackupManifest manifest;
  private final BackupFiles files;
  private final Path decryptedDirectory;

  BackupAttachmentLocator(BackupManifest manifest, BackupFiles files, Path decryptedDirectory) {
    this.manifest = Objects.requireNonNull(manifest, "manifest");
    this.files = Objects.requireNonNull(files, "files");
    this.decryptedDirectory = Objects.requireNonNull(decryptedDirectory, "decryptedDirectory");
  }

  @Override
  public Optional<ResolvedAttachment> locate(AttachmentRow attachment) throws IOException {
    Optional<String> relative = relativePath(attachment.filename());
    if (relative.isEmpty()) {
      return Optional.empty();
    }
    Optional<ManifestEntry> entry = manifest.find(BackupLayout.MEDIA_DOMAIN, relative.get());
    if (entry.isEmpty()) {
      return Optional.empty();
    }
    Path blob = files.blob(entry.get());
    if (!Files.isRegularFile(blob)) {
      return Optional.empty();
    }
    if (!files.encrypted()) {
      return Optional.of(new ResolvedAttachment(blob, blob, ORIGIN));
    }
    Path plaintext = decryptedDirectory.resolve(entry.get().fileId());
    if (!Files.isRegularFile(plaintext)) {
      files.extract(entry.get(), plaintext);
    }
    return Optional.of(new ResolvedAttachment(blob, plaintext, ORIGIN));
  }

  static Optional<String> relativePath(String filename) {
    if (filename == null || filename.isBlank()) {
      return Optional.empty();
    }
    for (String home : DEVICE_HOMES) {
      if (filename.startsWith(home)) {
        String relative = filename.substring(home.length());
        return relative.isEmpty() ? Optional.empty() : Optional.of(relative);
      }
    }
    if (filename.startsWith("Library/")) {
      return Optional.of(filename);
    }
    return Optional.empty();
  }
}
