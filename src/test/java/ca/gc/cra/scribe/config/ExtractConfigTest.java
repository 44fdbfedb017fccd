package ca.gc.cra.scribe.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.scribe.domain.source.SourceDescriptor;
import ca.gc.cra.scribe.domain.source.SourceKind;
import java.nio.file.Path;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ExtractConfigTest {
  @TempDir Path tempDir;

  @Test
  void defaultsProduceLiveConfiguration() {
    Map<String, String> kv = new HashMap<>(DefaultsForMode.asFlatMap("extract"));
    kv.put("db", tempDir.resolve("chat.db").toString());
    kv.put("out", tempDir.resolve("out").toString());

    ExtractConfig config = ExtractConfig.fromMap(kv);

    assertEquals(SourceKind.LIVE, config.sourceKind());
    assertEquals(1, config.attachmentWorkers());
    assertTrue(config.hashAttachments());
    assertFalse(config.copyAttachments());
    assertEquals(Duration.ofMinutes(10), config.stagingTimeout());
    assertEquals(TranscriptionMode.OFF, config.transcription().mode());
    assertEquals(tempDir.resolve("out").toAbsolutePath().normalize(), config.outputDirectory());
    assertEquals(Optional.empty(), config.contact());
  }

  @Test
  void contactIsKeptAsGiven() {
    Map<String, String> kv = new HashMap<>(DefaultsForMode.asFlatMap("extract"));
    kv.put("db", tempDir.resolve("chat.db").toString());
    kv.put("contact", "+1 (555) 123-4567");

    assertEquals(Optional.of("+1 (555) 123-4567"), ExtractConfig.fromMap(kv).contact());
  }

  @Test
  void parsesTypedValues() {
    Map<String, String> kv = new HashMap<>();
    kv.put("backup", tempDir.resolve("backup").toString());
    kv.put("out", tempDir.resolve("out").toString());
    kv.put("attachmentWorkers", "4");
    kv.put("copyAttachments", "yes");
    kv.put("stagingTimeout", "90s");
    kv.put("transcription.mode", "fixed");
    kv.put("transcription.timeout", "PT30S");

    ExtractConfig config = ExtractConfig.fromMap(kv);

    assertEquals(SourceKind.BACKUP, config.sourceKind());
    assertEquals(4, config.attachmentWorkers());
    assertTrue(config.copyAttachments());
    assertEquals(Duration.ofSeconds(90), config.stagingTimeout());
    assertEquals(TranscriptionMode.FIXED, config.transcription().mode());
    assertEquals(Duration.ofSeconds(30), config.transcription().timeout());
    assertEquals(TranscriptionConfig.DEFAULT_FIXED_TEXT, config.transcription().fixedText());
  }

  @Test
  void rejectsInvalidValues() {
    Map<String, String> base = Map.of("db", tempDir.resolve("chat.db").toString());

    assertThrows(IllegalArgumentException.class, () -> ExtractConfig.fromMap(with(base, "attachmentWorkers", "0")));
    assertThrows(IllegalArgumentException.class, () -> ExtractConfig.fromMap(with(base, "copyAttachments", "maybe")));
    assertThrows(IllegalArgumentException.class, () -> ExtractConfig.fromMap(with(base, "stagingTimeout", "-5s")));
    assertThrows(IllegalArgumentException.class, () -> ExtractConfig.fromMap(with(base, "transcription.mode", "cloud")));
    assertThrows(IllegalArgumentException.class,
        () -> ExtractConfig.fromMap(with(base, "transcription.mode", "whisper-cpp")));
    assertThrows(IllegalArgumentException.class, () -> ExtractConfig.fromMap(Map.of()));
  }

  @Test
  void backupPassphraseComesFromArgumentThenEnvironment() {
    ExtractConfig config = ExtractConfig.fromMap(Map.of(
        "backup", tempDir.toString(),
        "out", tempDir.resolve("out").toString(),
        "passphraseEnv", "MY_PASS"));
    Map<String, String> env = Map.of("MY_PASS", "from-env");

    SourceDescriptor fromEnv = config.toDescriptor(Optional.empty(), env::get);
    SourceDescriptor explicit = config.toDescriptor(Optional.of("typed"), env::get);

    assertEquals(Optional.of("from-env"), fromEnv.passphrase());
    assertEquals(Optional.of("typed"), explicit.passphrase());
    assertFalse(fromEnv.toString().contains("from-env"));
  }

  private static Map<String, String> with(Map<String, String> base, String key, String value) {
    Map<String, String> copy = new HashMap<>(base);
    copy.put(key, value);
    copy.putIfAbsent("out", "/tmp/scribe-out");
    return copy;
  }
}
