package ca.gc.cra.scribe.config;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Merges configuration from defaults, YAML, and CLI sources while enforcing precedence and invariants.
 */
public final class ConfigMerger {

  private ConfigMerger() {}

  /**
   * Builds an effective configuration map using precedence CLI > YAML > defaults.
   *
   * @param mode active command
   * @param yaml optional YAML-derived settings for the command
   * @param cli CLI key/value overrides (may be empty)
   * @param defaults embedded defaults for the command
   * @param warn consumer invoked when a CLI key overrides a YAML key
   * @return immutable merged configuration map
   * @throws IllegalArgumentException when validation fails
   */
  public static Map<String, String> buildEffectiveConfig(
      String mode,
      Optional<Map<String, String>> yaml,
      Map<String, String> cli,
      Map<String, String> defaults,
      Consumer<String> warn) {
    Objects.requireNonNull(mode, "mode");
    Objects.requireNonNull(yaml, "yaml");
    Map<String, String> defaultsCopy = defaults == null ? Map.of() : defaults;
    Map<String, String> yamlCopy = yaml.orElse(Map.of());
    Map<String, String> cliCopy = cli == null ? Map.of() : cli;

    Map<String, String> merged = new LinkedHashMap<>(defaultsCopy);
    merged.putAll(yamlCopy);

    // A source chosen on the command line replaces the other kind of source from YAML.
    if (isSet(cliCopy.get("db")) && !isSet(cliCopy.get("backup"))) {
      merged.remove("backup");
    }
    if (isSet(cliCopy.get("backup")) && !isSet(cliCopy.get("db"))) {
      merged.remove("db");
    }
    for (Map.Entry<String, String> entry : cliCopy.entrySet()) {
      String key = entry.getKey();
      if (key == null) {
        continue;
      }
      if (yamlCopy.containsKey(key) && warn != null) {
        warn.accept("CLI overrides YAML for key: " + key);
      }
      if (entry.getValue() != null) {
        merged.put(key, entry.getValue());
      }
    }

    validate(mode, merged);
    return Map.copyOf(merged);
  }

  private static void validate(String mode, Map<String, String> effective) {
    String normalized = mode.trim().toLowerCase(Locale.ROOT);
    if ("extract".equals(normalized) || "inspect".equals(normalized)) {
      boolean db = isSet(effective.get("db"));
      boolean backup = isSet(effective.get("backup"));
      if (db && backup) {
        throw new IllegalArgumentException("db and backup are mutually exclusive for " + normalized);
      }
      if (!db && !backup) {
        throw new IllegalArgumentException("One of db or backup is required for " + normalized);
      }
    }
    if (effective.containsKey("passphrase")) {
      throw new IllegalArgumentException(
          "passphrase must not appear in configuration files; use passphraseEnv instead");
    }
  }

  private static boolean isSet(String value) {
    return value != null && !value.isBlank();
  }
}
