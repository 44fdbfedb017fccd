package ca.gc.cra.scribe.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class ConfigMergerTest {

  @Test
  void cliOverridesYamlAndEmitsWarning() {
    Map<String, String> defaults = Map.of("attachmentWorkers", "1", "db", "");
    Map<String, String> yaml = Map.of("attachmentWorkers", "2", "db", "/yaml/chat.db");
    Map<String, String> cli = Map.of("attachmentWorkers", "8");
    List<String> warnings = new ArrayList<>();

    Map<String, String> merged = ConfigMerger.buildEffectiveConfig(
        "extract", Optional.of(yaml), cli, defaults, warnings::add);

    assertEquals("8", merged.get("attachmentWorkers"));
    assertEquals("/yaml/chat.db", merged.get("db"));
    assertEquals(List.of("CLI overrides YAML for key: attachmentWorkers"), warnings);
  }

  @Test
  void cliBackupReplacesYamlDatabase() {
    Map<String, String> merged = ConfigMerger.buildEffectiveConfig(
        "extract",
        Optional.of(Map.of("db", "/yaml/chat.db")),
        Map.of("backup", "/backups/device"),
        DefaultsForMode.asFlatMap("extract"),
        msg -> {});

    assertEquals("/backups/device", merged.get("backup"));
    assertFalse(merged.containsKey("db"));
  }

  @Test
  void bothSourcesAreRejected() {
    assertThrows(IllegalArgumentException.class, () -> ConfigMerger.buildEffectiveConfig(
        "extract", Optional.empty(), Map.of("db", "/a/chat.db", "backup", "/b"), Map.of(), msg -> {}));
  }

  @Test
  void missingSourceIsRejected() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> ConfigMerger.buildEffectiveConfig(
            "inspect", Optional.empty(), Map.of(), DefaultsForMode.asFlatMap("inspect"), msg -> {}));

    assertTrue(ex.getMessage().contains("db or backup"));
  }

  @Test
  void passphraseInConfigurationIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> ConfigMerger.buildEffectiveConfig(
        "extract",
        Optional.of(Map.of("passphrase", "hunter2")),
        Map.of("backup", "/b"),
        Map.of(),
        msg -> {}));
  }
}
