package ca.gc.cra.scribe.infrastructure.backup;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.scribe.application.pipeline.AttachmentResolver;
import ca.gc.cra.scribe.application.port.AttachmentLocator.ResolvedAttachment;
import ca.gc.cra.scribe.application.port.AttachmentMaterializer.Materialized;
import ca.gc.cra.scribe.application.port.StagedSource;
import ca.gc.cra.scribe.domain.msg.AttachmentRow;
import ca.gc.cra.scribe.domain.msg.DraftMessage;
import ca.gc.cra.scribe.domain.msg.MissingAttachment;
import ca.gc.cra.scribe.domain.msg.RawRow;
import ca.gc.cra.scribe.domain.msg.SourceRef;
import ca.gc.cra.scribe.domain.problem.PipelineFailure;
import ca.gc.cra.scribe.domain.problem.ProblemCode;
import ca.gc.cra.scribe.domain.report.RunReport;
import ca.gc.cra.scribe.domain.schema.SchemaGenerations;
import ca.gc.cra.scribe.domain.source.SourceDescriptor;
import ca.gc.cra.scribe.infrastructure.attachments.ContentAddressedAttachmentStore;
import ca.gc.cra.scribe.infrastructure.sqlite.SqliteChatDatabase;
import ca.gc.cra.scribe.testutil.BackupFixture;
import ca.gc.cra.scribe.testutil.ChatDbFixture;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class BackupSourceStagerTest {
  private static final String PASSPHRASE = "correct horse";
  private static final String PHOTO = "Library/SMS/Attachments/ab/01/photo.jpg";

  @TempDir Path tempDir;

  private Path smsDb;

  @BeforeEach
  void setUp() throws Exception {
    smsDb = tempDir.resolve("sms.db");
    try (ChatDbFixture db = ChatDbFixture.create(smsDb, ChatDbFixture.Layout.LEGACY)) {
      db.message(1, "A").text("from the backup").insert();
      db.attachment(10, 1, "~/" + PHOTO, "image/jpeg");
    }
  }

  @Test
  void stagesPlainBackupAndLocatesAttachments() throws Exception {
    Path root = BackupFixture.plain(tempDir.resolve("backup"))
        .file(BackupFixture.HOME_DOMAIN, BackupFixture.SMS_DATABASE, smsDb)
        .file(BackupFixture.MEDIA_DOMAIN, PHOTO, "jpeg!".getBytes(StandardCharsets.US_ASCII))
        .write();

    try (StagedSource staged = stage(SourceDescriptor.backup(root, null))) {
      assertEquals(List.of("from the backup"), texts(staged.databasePath()));
      Optional<ResolvedAttachment> photo = staged.attachmentLocator().locate(attachment("~/" + PHOTO));
      assertEquals("backup", photo.orElseThrow().origin());
      assertEquals("jpeg!", Files.readString(photo.get().readablePath(), StandardCharsets.US_ASCII));
    }
  }

  @Test
  void decryptsEncryptedBackupWithPassphrase() throws Exception {
    Path root = BackupFixture.encrypted(tempDir.resolve("backup"), PASSPHRASE)
        .file(BackupFixture.HOME_DOMAIN, BackupFixture.SMS_DATABASE, smsDb)
        .file(BackupFixture.MEDIA_DOMAIN, PHOTO, "secret jpeg".getBytes(StandardCharsets.US_ASCII))
        .write();

    Path work;
    try (StagedSource staged = stage(SourceDescriptor.backup(root, PASSPHRASE))) {
      work = staged.workDirectory();
      assertEquals(List.of("from the backup"), texts(staged.databasePath()));
      ResolvedAttachment photo = staged.attachmentLocator().locate(attachment("~/" + PHOTO)).orElseThrow();
      assertTrue(photo.readablePath().startsWith(work), "decrypted copies live in the staging directory");
      assertEquals("secret jpeg", Files.readString(photo.readablePath(), StandardCharsets.US_ASCII));
    }
    assertFalse(Files.exists(work));
  }

  @Test
  void materializingTheSameBackupAttachmentTwiceIsIdempotent() throws Exception {
    Path root = BackupFixture.encrypted(tempDir.resolve("backup"), PASSPHRASE)
        .file(BackupFixture.HOME_DOMAIN, BackupFixture.SMS_DATABASE, smsDb)
        .file(BackupFixture.MEDIA_DOMAIN, PHOTO, "secret jpeg".getBytes(StandardCharsets.US_ASCII))
        .write();
    ContentAddressedAttachmentStore first = new ContentAddressedAttachmentStore(tempDir.resolve("out-1"));
    ContentAddressedAttachmentStore second = new ContentAddressedAttachmentStore(tempDir.resolve("out-2"));

    Materialized a = materialize(root, first);
    Materialized b = materialize(root, first);
    Materialized c = materialize(root, second);

    assertEquals(a, b);
    assertEquals(a.contentHash(), c.contentHash());
    assertEquals(-1L, Files.mismatch(a.path(), c.path()));
    assertEquals("secret jpeg", Files.readString(c.path(), StandardCharsets.US_ASCII));
  }

  @Test
  void encryptedBackupWithoutPassphraseIsRejected() throws Exception {
    Path root = BackupFixture.encrypted(tempDir.resolve("backup"), PASSPHRASE)
        .file(BackupFixture.HOME_DOMAIN, BackupFixture.SMS_DATABASE, smsDb)
        .write();

    PipelineFailure failure = assertThrows(PipelineFailure.class, () -> stage(SourceDescriptor.backup(root, null)));

    assertEquals(ProblemCode.BACKUP_PASSPHRASE_REQUIRED, failure.code());
  }

  @Test
  void wrongPassphraseFailsDecryption() throws Exception {
    Path root = BackupFixture.encrypted(tempDir.resolve("backup"), PASSPHRASE)
        .file(BackupFixture.HOME_DOMAIN, BackupFixture.SMS_DATABASE, smsDb)
        .write();

    PipelineFailure failure = assertThrows(PipelineFailure.class,
        () -> stage(SourceDescriptor.backup(root, "battery staple")));

    assertEquals(ProblemCode.BACKUP_DECRYPTION_FAILED, failure.code());
    assertFalse(failure.getMessage().contains("battery staple"));
  }

  @Test
  void missingManifestAndMissingDatabaseAreDistinct() throws Exception {
    Path empty = Files.createDirectories(tempDir.resolve("empty"));
    PipelineFailure noManifest = assertThrows(PipelineFailure.class,
        () -> stage(SourceDescriptor.backup(empty, null)));
    assertEquals(ProblemCode.BACKUP_MANIFEST_MISSING, noManifest.code());

    Path root = BackupFixture.plain(tempDir.resolve("backup"))
        .file(BackupFixture.MEDIA_DOMAIN, PHOTO, new byte[] {1})
        .write();
    PipelineFailure noDatabase = assertThrows(PipelineFailure.class,
        () -> stage(SourceDescriptor.backup(root, null)));
    assertEquals(ProblemCode.DATABASE_NOT_FOUND, noDatabase.code());
  }

  @Test
  void manifestEntryWithShortFileIdIsReportedMissing() throws Exception {
    Path root = BackupFixture.plain(tempDir.resolve("backup"))
        .file(BackupFixture.HOME_DOMAIN, BackupFixture.SMS_DATABASE, smsDb)
        .write();
    String damaged = "Library/SMS/Attachments/x.jpg";
    try (Connection connection =
            DriverManager.getConnection("jdbc:sqlite:" + root.resolve("Manifest.db").toAbsolutePath());
        PreparedStatement insert = connection.prepareStatement(
            "INSERT INTO Files (fileID, domain, relativePath, flags, file) VALUES ('a', ?, ?, 1, NULL)")) {
      insert.setString(1, BackupFixture.MEDIA_DOMAIN);
      insert.setString(2, damaged);
      insert.executeUpdate();
    }
    RunReport report = new RunReport("run-test", "backup", () -> Instant.EPOCH, RunReport.CounterListener.NONE);
    DraftMessage message = new DraftMessage("A", "chat", Instant.EPOCH, "self", true, "",
        new SourceRef("sms.db", "A", 1), Map.of());

    List<MissingAttachment> missing;
    try (StagedSource staged = stage(SourceDescriptor.backup(root, null))) {
      AttachmentResolver resolver = new AttachmentResolver(
          new ContentAddressedAttachmentStore(tempDir.resolve("out")), false, true, null, report);
      missing = resolver.resolve(
          List.of(message), Map.of(1L, List.of(attachment("~/" + damaged))), staged.attachmentLocator());
    }

    assertEquals(1, missing.size());
    assertEquals("not_found", missing.get(0).reason());
    assertEquals(Boolean.TRUE, message.meta("attachment_unresolved"));
  }

  @Test
  void fileIdsThatCannotNameABlobAreUnusable() {
    assertTrue(BackupManifest.isUsableFileId("3d0d7e5fb2ce288813306e4d4636395e047a3d28"));
    assertFalse(BackupManifest.isUsableFileId("a"));
    assertFalse(BackupManifest.isUsableFileId(null));
    assertFalse(BackupManifest.isUsableFileId("../etc"));
    assertFalse(BackupManifest.isUsableFileId("ab/cd"));
  }

  @Test
  void relativePathStripsDeviceHome() {
    assertEquals(Optional.of(PHOTO), BackupAttachmentLocator.relativePath("~/" + PHOTO));
    assertEquals(Optional.of(PHOTO), BackupAttachmentLocator.relativePath("/var/mobile/" + PHOTO));
    assertEquals(Optional.of(PHOTO), BackupAttachmentLocator.relativePath(PHOTO));
    assertTrue(BackupAttachmentLocator.relativePath("/tmp/x.jpg").isEmpty());
  }

  private StagedSource stage(SourceDescriptor descriptor) throws Exception {
    Path work = Files.createTempDirectory(tempDir, "work-");
    return new BackupSourceStager(tempDir.resolve("no-home"), false).stage(descriptor, work);
  }

  private static List<String> texts(Path database) {
    List<String> texts = new ArrayList<>();
    try (SqliteChatDatabase db = SqliteChatDatabase.open(database)) {
      db.forEachMessage(SchemaGenerations.LEGACY_PLAIN_TEXT, (RawRow row) -> texts.add(row.text()));
    }
    return texts;
  }

  private static AttachmentRow attachment(String filename) {
    return new AttachmentRow(10, 1, "att-10", filename, "image/jpeg", null, null, null);
  }

  private Materialized materialize(Path root, ContentAddressedAttachmentStore store) throws Exception {
    try (StagedSource staged = stage(SourceDescriptor.backup(root, PASSPHRASE))) {
      ResolvedAttachment photo = staged.attachmentLocator().locate(attachment("~/" + PHOTO)).orElseThrow();
      return store.materialize(photo.readablePath(), "photo.jpg");
    }
  }
}
