package ca.gc.cra.scribe.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.scribe.infrastructure.output.CanonicalJson;
import ca.gc.cra.scribe.testutil.BackupFixture;
import ca.gc.cra.scribe.testutil.ChatDbFixture;
import com.fasterxml.jackson.databind.JsonNode;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Path;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class InspectCliTest {
  @TempDir Path tempDir;

  private StringWriter stdout;
  private StringWriter stderr;

  @BeforeEach
  void setUp() {
    stdout = new StringWriter();
    stderr = new StringWriter();
    CliPrinter.setWriterForTesting(new PrintWriter(stdout, true));
    CliPrinter.setErrorWriterForTesting(new PrintWriter(stderr, true));
  }

  @AfterEach
  void tearDown() {
    CliPrinter.clearTestWriter();
  }

  @Test
  void printsGenerationAndTableCounts() throws Exception {
    Path db = tempDir.resolve("chat.db");
    try (ChatDbFixture fixture = ChatDbFixture.create(db, ChatDbFixture.Layout.EDIT_HISTORY)) {
      fixture.message(1, "A").text("one").insert();
    }

    ExitCode code = InspectCli.run(new String[] {"db=" + db, "workDir=" + tempDir.resolve("work")});

    assertEquals(ExitCode.SUCCESS, code);
    JsonNode printed = CanonicalJson.mapper().readTree(stdout.toString());
    assertEquals("live", printed.get("source_kind").asText());
    assertEquals("binary_text_edit_history", printed.get("schema_generation").asText());
    assertEquals(1, printed.get("tables").get("message").asInt());
  }

  @Test
  void encryptedBackupWithoutPassphraseFails() throws Exception {
    Path backup = BackupFixture.encrypted(tempDir.resolve("backup"), "pw").write();

    ExitCode code = InspectCli.run(new String[] {
        "backup=" + backup, "passphraseEnv=SCRIBE_TEST_UNSET_VARIABLE", "workDir=" + tempDir.resolve("work")},
        name -> null);

    assertEquals(ExitCode.SOURCE_ERROR, code);
    assertTrue(stderr.toString().contains("BACKUP_PASSPHRASE_REQUIRED"));
  }

  @Test
  void missingSourceArgumentIsInvalid() {
    assertEquals(ExitCode.INVALID_ARGS, InspectCli.run(new String[0]));
  }
}
