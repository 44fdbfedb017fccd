package ca.gc.cra.scribe.infrastructure.backup;

import ca.gc.cra.scribe.application.port.AttachmentLocator;
import ca.gc.cra.scribe.application.port.StagedSource;
import ca.gc.cra.scribe.domain.problem.PipelineFailure;
import ca.gc.cra.scribe.domain.problem.ProblemCode;
import ca.gc.cra.scribe.domain.source.SourceDescriptor;
import ca.gc.cra.scribe.infrastructure.backup.BackupManifest.ManifestEntry;
import ca.gc.cra.scribe.infrastructure.staging.ChainedAttachmentLocator;
import ca.gc.cra.scribe.infrastructure.staging.LiveAttachmentLocator;
import ca.gc.cra.scribe.infrastructure.staging.LiveSourceStager;
import ca.gc.cra.scribe.infrastructure.staging.StagedDirectory;
import ca.gc.cra.scribe.infrastructure.staging.WalInspector;
import ca.gc.cra.scribe.infrastructure.staging.WorkDirStager;
import ca.gc.cra.scribe.logging.Logs;
import com.dd.plist.NSDictionary;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.security.GeneralSecurityException;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Stages the message database out of a plain or encrypted device backup.
 * <p><strong>Flow:</strong>
 * <ol>
 *   <li>Require {@code Manifest.db} and determine encryption from the backup plists.</li>
 *   <li>Encrypted: unlock the keybag with the passphrase, unwrap the manifest key and decrypt the manifest into the
 *   working directory. Plain: copy the manifest.</li>
 *   <li>Resolve {@code HomeDomain / Library/SMS/sms.db} and its log companions through the manifest and extract
 *   them next to each other.</li>
 * </ol>
 * <p><strong>Ownership:</strong> the opened manifest is handed to the staged source and closed with it, so attachment
 * lookups reuse it.</p>
 * <p><strong>Security:</strong> the passphrase is never logged or stored beyond key derivation.</p>
 *
 * @since 0.1.0
 */
public final class BackupSourceStager implements WorkDirStager {
  private static final Logger log = LoggerFactory.getLogger(BackupSourceStager.class);
  private static final byte[] SQLITE_HEADER = "SQLite format 3\0".getBytes(StandardCharsets.US_ASCII);

  private final Path attachmentsHome;
  private final boolean retain;

  /**
   * Creates the stager.
   *
   * @param attachmentsHome expansion of {@code ~} for the live locator consulted before the backup
   * @param retain keep the working directory after the run
   */
  public BackupSourceStager(Path attachmentsHome, boolean retain) {
    this.attachmentsHome = Objects.requireNonNull(attachmentsHome, "attachmentsHome");
    this.retain = retain;
  }

  @Override
  public StagedSource stage(SourceDescriptor descriptor, Path workDirectory) {
    Path root = descriptor.location();
    Path manifestDb = root.resolve(BackupLayout.MANIFEST_DB);
    if (!Files.isRegularFile(manifestDb)) {
      throw new PipelineFailure(ProblemCode.BACKUP_MANIFEST_MISSING,
          "Backup has no " + BackupLayout.MANIFEST_DB, root.toString());
    }
    boolean encrypted = BackupPlists.isEncrypted(root).orElse(false);
    log.info("Staging {} backup {}", encrypted ? "encrypted" : "plain", Logs.redactPath(root.toString()));

    Map<Integer, byte[]> classKeys = null;
    Path stagedManifest = workDirectory.resolve(BackupLayout.MANIFEST_DB);
    if (encrypted) {
      String passphrase = descriptor.passphrase().orElseThrow(() -> new PipelineFailure(
          ProblemCode.BACKUP_PASSPHRASE_REQUIRED, "Backup is encrypted and no passphrase was supplied",
          root.toString()));
      NSDictionary manifestPlist = readManifestPlist(root);
      classKeys = unlock(manifestPlist, passphrase, root);
      decryptManifest(manifestPlist, classKeys, manifestDb, stagedManifest, root);
    } else {
      copyManifest(manifestDb, stagedManifest, root);
    }

    BackupManifest manifest;
    try {
      manifest = BackupManifest.open(stagedManifest);
    } catch (IOException ex) {
      throw new PipelineFailure(ProblemCode.BACKUP_MANIFEST_MISSING,
          "Backup manifest is unreadable: " + ex.getMessage(), manifestDb.toString(), ex);
    }
    boolean handedOver = false;
    try {
      BackupFiles files = new BackupFiles(root, classKeys);
      Path stagedDatabase = workDirectory.resolve(LiveSourceStager.STAGED_DATABASE);
      extractDatabase(manifest, files, stagedDatabase, root);
      long frames = WalInspector.frameCount(stagedDatabase.resolveSibling(LiveSourceStager.STAGED_DATABASE + "-wal"));
      Path decrypted = workDirectory.resolve("attachments");
      AttachmentLocator locator = new ChainedAttachmentLocator(List.of(
          new LiveAttachmentLocator(attachmentsHome, null),
          new BackupAttachmentLocator(manifest, files, decrypted)));
      log.info("Staged backup database with {} WAL frames", frames);
      StagedDirectory staged = new StagedDirectory(descriptor, stagedDatabase, workDirectory, frames, locator,
          retain, List.of(manifest));
      handedOver = true;
      return staged;
    } catch (IOException ex) {
      throw new PipelineFailure(ProblemCode.DATABASE_UNREADABLE,
          "Unable to stage backup database: " + ex.getMessage(), root.toString(), ex);
    } finally {
      if (!handedOver) {
        manifest.close();
      }
    }
  }

  private static void extractDatabase(BackupManifest manifest, BackupFiles files, Path target, Path root)
      throws IOException {
    Optional<ManifestEntry> primary = manifest.find(BackupLayout.HOME_DOMAIN, BackupLayout.SMS_DATABASE);
    if (primary.isEmpty() || !Files.isRegularFile(files.blob(primary.get()))) {
      throw new PipelineFailure(ProblemCode.DATABASE_NOT_FOUND,
          "Backup does not contain " + BackupLayout.HOME_DOMAIN + "/" + BackupLayout.SMS_DATABASE, root.toString());
    }
    extract(files, primary.get(), target, root);
    for (String suffix : List.of("-wal", "-shm")) {
      Optional<ManifestEntry> companion =
          manifest.find(BackupLayout.HOME_DOMAIN, BackupLayout.SMS_DATABASE + suffix);
      if (companion.isPresent() && Files.isRegularFile(files.blob(companion.get()))) {
        extract(files, companion.get(), target.resolveSibling(target.getFileName() + suffix), root);
      }
    }
  }

  private static void extract(BackupFiles files, ManifestEntry entry, Path target, Path root) throws IOException {
    try {
      files.extract(entry, target);
    } catch (BackupDecryptionException ex) {
      throw new PipelineFailure(ProblemCode.BACKUP_DECRYPTION_FAILED, ex.getMessage(), root.toString(), ex);
    }
  }

  private static NSDictionary readManifestPlist(Path root) {
    Path plist = root.resolve(BackupLayout.MANIFEST_PLIST);
    try {
      return BackupPlists.readDictionary(plist);
    } catch (IOException ex) {
      throw new PipelineFailure(ProblemCode.BACKUP_MANIFEST_MISSING,
          "Encrypted backup has no readable " + BackupLayout.MANIFEST_PLIST, plist.toString(), ex);
    }
  }

  private static Map<Integer, byte[]> unlock(NSDictionary manifestPlist, String passphrase, Path root) {
    byte[] keyBagBytes = BackupPlists.data(manifestPlist, "BackupKeyBag").orElseThrow(() -> new PipelineFailure(
        ProblemCode.BACKUP_DECRYPTION_FAILED, "Manifest.plist carries no BackupKeyBag", root.toString()));
    byte[] secret = passphrase.getBytes(StandardCharsets.UTF_8);
    try {
      return BackupKeyBag.parse(keyBagBytes).unlock(secret);
    } catch (GeneralSecurityException | IllegalArgumentException ex) {
      throw new PipelineFailure(ProblemCode.BACKUP_DECRYPTION_FAILED,
          "Passphrase did not unlock the backup keybag", root.toString(), ex);
    } finally {
      Arrays.fill(secret, (byte) 0);
    }
  }

  private static void decryptManifest(
      NSDictionary manifestPlist, Map<Integer, byte[]> classKeys, Path manifestDb, Path target, Path root) {
    byte[] manifestKey = BackupPlists.data(manifestPlist, "ManifestKey").orElseThrow(() -> new PipelineFailure(
        ProblemCode.BACKUP_DECRYPTION_FAILED, "Manifest.plist carries no ManifestKey", root.toString()));
    if (manifestKey.length <= 4) {
      throw new PipelineFailure(ProblemCode.BACKUP_DECRYPTION_FAILED, "ManifestKey is truncated", root.toString());
    }
    int protectionClass = BackupPlists.littleEndianInt(manifestKey);
    byte[] classKey = classKeys.get(protectionClass);
    if (classKey == null) {
      throw new PipelineFailure(ProblemCode.BACKUP_DECRYPTION_FAILED,
          "No unlocked key for manifest protection class " + protectionClass, root.toString());
    }
    try {
      byte[] key = BackupCrypto.unwrap(classKey, Arrays.copyOfRange(manifestKey, 4, manifestKey.length));
      byte[] plaintext = BackupCrypto.decryptUnpadded(key, Files.readAllBytes(manifestDb));
      if (plaintext.length < SQLITE_HEADER.length
          || !Arrays.equals(Arrays.copyOf(plaintext, SQLITE_HEADER.length), SQLITE_HEADER)) {
        throw new PipelineFailure(ProblemCode.BACKUP_DECRYPTION_FAILED,
            "Decrypted manifest is not a database", manifestDb.toString());
      }
      Files.write(target, plaintext);
    } catch (GeneralSecurityException ex) {
      throw new PipelineFailure(ProblemCode.BACKUP_DECRYPTION_FAILED,
          "Unable to decrypt " + BackupLayout.MANIFEST_DB, manifestDb.toString(), ex);
    } catch (IOException ex) {
      throw new PipelineFailure(ProblemCode.BACKUP_MANIFEST_MISSING,
          "Unable to read " + BackupLayout.MANIFEST_DB, manifestDb.toString(), ex);
    }
  }

  private static void copyManifest(Path manifestDb, Path target, Path root) {
    try {
      Files.copy(manifestDb, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.COPY_ATTRIBUTES);
    } catch (IOException ex) {
      throw new PipelineFailure(ProblemCode.BACKUP_MANIFEST_MISSING,
          "Unable to copy " + BackupLayout.MANIFEST_DB, root.toString(), ex);
    }
  }
}
