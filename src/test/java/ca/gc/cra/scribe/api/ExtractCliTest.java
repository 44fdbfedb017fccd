package ca.gc.cra.scribe.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.scribe.infrastructure.output.NdjsonMessageOutputAdapter;
import ca.gc.cra.scribe.testutil.ChatDbFixture;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;

class ExtractCliTest {
  private static final String SECRET = "s3cr3t-passphrase";

  @TempDir Path tempDir;

  private ListAppender<ILoggingEvent> appender;
  private Logger root;
  private StringWriter stdout;
  private StringWriter stderr;

  @BeforeEach
  void setUp() {
    root = (Logger) LoggerFactory.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
    appender = new ListAppender<>();
    appender.start();
    root.addAppender(appender);
    stdout = new StringWriter();
    stderr = new StringWriter();
    CliPrinter.setWriterForTesting(new PrintWriter(stdout, true));
    CliPrinter.setErrorWriterForTesting(new PrintWriter(stderr, true));
  }

  @AfterEach
  void tearDown() {
    root.detachAppender(appender);
    CliPrinter.clearTestWriter();
  }

  @Test
  void helpPrintsUsage() {
    assertEquals(ExitCode.SUCCESS, ExtractCli.run(new String[] {"--help"}));
    assertTrue(stdout.toString().contains("SCRIBE extract pipeline"));
  }

  @Test
  void extractsLiveDatabase() throws Exception {
    Path db = tempDir.resolve("chat.db");
    try (ChatDbFixture fixture = ChatDbFixture.create(db, ChatDbFixture.Layout.BINARY_TEXT)) {
      fixture.chat(1, "chat-1");
      fixture.message(1, "A").text("hello").date(700_000_000_000_000_000L).fromSelf().chat(1).insert();
    }
    Path out = tempDir.resolve("out");

    ExitCode code = ExtractCli.run(args("db=" + db, "out=" + out));

    assertEquals(ExitCode.SUCCESS, code);
    assertTrue(stdout.toString().contains("Extract finished: success"));
    assertTrue(stdout.toString().contains("Messages emitted  : 1"));
    assertEquals(1, Files.readAllLines(out.resolve(NdjsonMessageOutputAdapter.MESSAGES)).size());
  }

  @Test
  void noValidRowsMapsToDedicatedExitCode() throws Exception {
    Path db = tempDir.resolve("chat.db");
    try (ChatDbFixture fixture = ChatDbFixture.create(db, ChatDbFixture.Layout.LEGACY)) {
      fixture.message(1, "A").text("no chat").date(700_000_000_000_000_000L).insert();
    }

    ExitCode code = ExtractCli.run(args("db=" + db, "out=" + tempDir.resolve("out")));

    assertEquals(ExitCode.NO_VALID_ROWS, code);
    assertTrue(stderr.toString().contains("\"code\":\"NO_VALID_ROWS\""));
  }

  @Test
  void missingDatabaseIsSourceError() {
    ExitCode code = ExtractCli.run(args("db=" + tempDir.resolve("absent.db"), "out=" + tempDir.resolve("out")));

    assertEquals(ExitCode.SOURCE_ERROR, code);
    assertTrue(stderr.toString().contains("DATABASE_NOT_FOUND"));
  }

  @Test
  void passphraseNeverReachesOutputOrLogs() throws Exception {
    Path backup = Files.createDirectories(tempDir.resolve("backup"));

    ExitCode code = ExtractCli.run(args("backup=" + backup, "passphrase=" + SECRET, "out=" + tempDir.resolve("out")));

    assertEquals(ExitCode.SOURCE_ERROR, code);
    assertTrue(stderr.toString().contains("BACKUP_MANIFEST_MISSING"));
    assertFalse(stdout.toString().contains(SECRET));
    assertFalse(stderr.toString().contains(SECRET));
    assertTrue(appender.list.stream().noneMatch(event -> event.getFormattedMessage().contains(SECRET)));
  }

  @Test
  void passphraseFromEnvironmentIsUsed() throws Exception {
    Path backup = Files.createDirectories(tempDir.resolve("backup"));

    ExitCode code = ExtractCli.run(
        args("backup=" + backup, "passphraseEnv=TEST_PASS", "out=" + tempDir.resolve("out")),
        Map.of("TEST_PASS", SECRET)::get);

    assertEquals(ExitCode.SOURCE_ERROR, code);
    assertFalse(stderr.toString().contains(SECRET));
  }

  @Test
  void populatedOutputRequiresAllowOverwrite() throws Exception {
    Path out = Files.createDirectories(tempDir.resolve("out"));
    Files.writeString(out.resolve("previous.txt"), "x");

    ExitCode code = ExtractCli.run(args("db=" + tempDir.resolve("chat.db"), "out=" + out));

    assertEquals(ExitCode.INVALID_ARGS, code);
    assertTrue(stdout.toString().contains("usage: extract"));
  }

  @Test
  void dryRunPrintsPlanWithoutTouchingOutput() {
    Path out = tempDir.resolve("planned");

    ExitCode code = ExtractCli.run(args("backup=" + tempDir.resolve("backup"), "out=" + out,
        "attachmentWorkers=3", "--dry-run"));

    assertEquals(ExitCode.SUCCESS, code);
    String printed = stdout.toString();
    assertTrue(printed.contains("Extract dry-run"));
    assertTrue(printed.contains("Passphrase        : $SCRIBE_BACKUP_PASSPHRASE"));
    assertTrue(printed.contains("Attachment workers: 3"));
    assertFalse(Files.exists(out));
  }

  @Test
  void ambiguousSourceIsInvalid() {
    ExitCode code = ExtractCli.run(args("db=/a/chat.db", "backup=/b", "out=" + tempDir.resolve("out")));

    assertEquals(ExitCode.INVALID_ARGS, code);
  }

  @Test
  void badYamlIsConfigError() throws Exception {
    Path yaml = Files.writeString(tempDir.resolve("scribe.yaml"), "extract: [unclosed");

    ExitCode code = ExtractCli.run(args("config=" + yaml, "db=" + tempDir.resolve("chat.db")));

    assertEquals(ExitCode.CONFIG_ERROR, code);
  }

  @Test
  void passphraseInYamlIsConfigError() throws Exception {
    Path yaml = Files.writeString(tempDir.resolve("scribe.yaml"), """
        extract:
          backup: /b
          passphrase: nope
        """);

    ExitCode code = ExtractCli.run(args("config=" + yaml, "out=" + tempDir.resolve("out")));

    assertEquals(ExitCode.CONFIG_ERROR, code);
  }

  private String[] args(String... values) {
    String[] all = new String[values.length + 2];
    System.arraycopy(values, 0, all, 0, values.length);
    all[values.length] = "workDir=" + tempDir.resolve("work");
    all[values.length + 1] = "attachmentsHome=" + tempDir;
    return all;
  }
}
