package ca.gc.cra.scribe.infrastructure.backup;

import ca.gc.cra.scribe.infrastructure.backup.BackupManifest.ManifestEntry;
import ca.gc.cra.scribe.infrastructure.backup.BackupPlists.WrappedFileKey;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.security.GeneralSecurityException;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Copies logical backup files out of the blob store, decrypting them when the backup is encrypted.
 *
 * @since 0.1.0
 */
final class BackupFiles {
  private final Path root;
  private final Map<Integer, byte[]> classKeys;

  /**
   * Creates an extractor.
   *
   * @param root backup root
   * @param classKeys unlocked class keys, or {@code null} for a plain backup
   */
  BackupFiles(Path root, Map<Integer, byte[]> classKeys) {
    this.root = Objects.requireNonNull(root, "root");
    this.classKeys = classKeys == null ? null : Map.copyOf(classKeys);
  }

  boolean encrypted() {
    return classKeys != null;
  }

  Path blob(ManifestEntry entry) {
    return BackupLayout.blobPath(root, entry.fileId());
  }

  /**
   * Writes the plaintext of a logical file to {@code target}.
   *
   * @param entry manifest entry
   * @param target destination; replaced when present
   * @throws NoSuchFileException when the blob is absent
   * @throws BackupDecryptionException when the per-file key is missing or does not decrypt the blob
   * @throws IOException when copying fails
   */
  void extract(ManifestEntry entry, Path target) throws IOException {
    Path blob = blob(entry);
    if (!Files.isRegularFile(blob)) {
      throw new NoSuchFileException(blob.toString());
    }
    Files.createDirectories(target.toAbsolutePath().getParent());
    if (!encrypted()) {
      Files.copy(blob, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.COPY_ATTRIBUTES);
      return;
    }
    byte[] fileKey = fileKey(entry);
    Path partial = Files.createTempFile(target.toAbsolutePath().getParent(), entry.fileId(), ".part");
    try (InputStream in = Files.newInputStream(blob);
        OutputStream out = Files.newOutputStream(partial)) {
      BackupCrypto.decryptPadded(fileKey, in, out);
    } catch (GeneralSecurityException ex) {
      Files.deleteIfExists(partial);
      throw new BackupDecryptionException("Unable to decrypt backup file " + entry.fileId(), ex);
    } catch (IOException ex) {
      Files.deleteIfExists(partial);
      throw ex;
    }
    Files.move(partial, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
  }

  private byte[] fileKey(ManifestEntry entry) throws IOException {
    Optional<WrappedFileKey> wrapped = BackupPlists.fileKey(entry.file());
    if (wrapped.isEmpty()) {
      throw new BackupDecryptionException("Manifest entry " + entry.fileId() + " carries no encryption key");
    }
    byte[] classKey = classKeys.get(wrapped.get().protectionClass());
    if (classKey == null) {
      throw new BackupDecryptionException(
          "No unlocked key for protection class " + wrapped.get().protectionClass());
    }
    try {
      return BackupCrypto.unwrap(classKey, wrapped.get().wrapped());
    } catch (GeneralSecurityException ex) {
      throw new BackupDecryptionException("Unable to unwrap key for " + entry.fileId(), ex);
    }
  }
}
