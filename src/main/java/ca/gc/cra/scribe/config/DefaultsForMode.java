package ca.gc.cra.scribe.config;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Supplies flattened default configuration maps for each SCRIBE command.
 *
 * <p>Keys listed here are the documented configuration surface; YAML and CLI values layer on top.</p>
 */
public final class DefaultsForMode {
  private static final Map<String, String> COMMON_DEFAULTS = buildCommonDefaults();

  private DefaultsForMode() {}

  /**
   * Returns the defaults for {@code mode} merged over the common defaults.
   *
   * @param mode command name ({@code extract} or {@code inspect})
   * @return unmodifiable map of default key/value pairs
   * @throws IllegalArgumentException for unknown commands
   */
  public static Map<String, String> asFlatMap(String mode) {
    Objects.requireNonNull(mode, "mode");
    String normalized = mode.trim().toLowerCase(Locale.ROOT);
    Map<String, String> defaults = new LinkedHashMap<>(COMMON_DEFAULTS);
    defaults.putAll(switch (normalized) {
      case "extract" -> buildExtractDefaults();
      case "inspect" -> buildInspectDefaults();
      default -> throw new IllegalArgumentException("Unsupported mode: " + mode);
    });
    return Map.copyOf(defaults);
  }

  private static Map<String, String> buildCommonDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("metricsExporter", "none");
    map.put("otelEndpoint", "");
    map.put("otelResourceAttributes", "");
    map.put("verbose", "false");
    return Map.copyOf(map);
  }

  private static Map<String, String> buildSourceDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("db", "");
    map.put("backup", "");
    map.put("passphraseEnv", ExtractConfig.DEFAULT_PASSPHRASE_ENV);
    map.put("workDir", System.getProperty("java.io.tmpdir"));
    map.put("retainStaging", "false");
    map.put("attachmentsHome", System.getProperty("user.home", "."));
    map.put("stagingTimeout", ExtractConfig.DEFAULT_STAGING_TIMEOUT.toString());
    return map;
  }

  private static Map<String, String> buildExtractDefaults() {
    Map<String, String> map = buildSourceDefaults();
    map.put("out", ExtractConfig.defaultOutputDirectory().toString());
    map.put("copyAttachments", "false");
    map.put("hashAttachments", "true");
    map.put("attachmentWorkers", "1");
    map.put("transcription.mode", "off");
    map.put("transcription.binary", "");
    map.put("transcription.model", "");
    map.put("transcription.language", "en");
    map.put("transcription.ffmpeg", "");
    map.put("transcription.timeout", TranscriptionConfig.DEFAULT_TIMEOUT.toString());
    map.put("transcription.fixedText", TranscriptionConfig.DEFAULT_FIXED_TEXT);
    map.put("contact", "");
    map.put("allowOverwrite", "false");
    map.put("dryRun", "false");
    return map;
  }

  private static Map<String, String> buildInspectDefaults() {
    return buildSourceDefaults();
  }
}
