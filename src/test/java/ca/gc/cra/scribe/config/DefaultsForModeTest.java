package ca.gc.cra.scribe.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Map;
import org.junit.jupiter.api.Test;

class DefaultsForModeTest {

  @Test
  void extractDefaultsCoverOutputsAndTranscription() {
    Map<String, String> defaults = DefaultsForMode.asFlatMap("extract");

    assertEquals("none", defaults.get("metricsExporter"));
    assertEquals("off", defaults.get("transcription.mode"));
    assertEquals("true", defaults.get("hashAttachments"));
    assertEquals("false", defaults.get("copyAttachments"));
    assertEquals("SCRIBE_BACKUP_PASSPHRASE", defaults.get("passphraseEnv"));
    assertEquals("", defaults.get("db"));
  }

  @Test
  void inspectDefaultsOmitOutputSettings() {
    Map<String, String> defaults = DefaultsForMode.asFlatMap(" Inspect ");

    assertFalse(defaults.containsKey("out"));
    assertFalse(defaults.containsKey("transcription.mode"));
    assertEquals("false", defaults.get("retainStaging"));
  }

  @Test
  void unknownModeIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> DefaultsForMode.asFlatMap("capture"));
  }
}
