package ca.gc.cra.scribe.config;

import ca.gc.cra.scribe.validation.Strings;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/** Typed parsing of flat {@code key=value} configuration entries. */
final class ConfigValues {
  private ConfigValues() {}

  static boolean parseBoolean(Map<String, String> kv, String key, boolean fallback) {
    String raw = kv.get(key);
    if (raw == null || raw.isBlank()) {
      return fallback;
    }
    String value = raw.trim().toLowerCase(Locale.ROOT);
    return switch (value) {
      case "true", "yes", "1" -> true;
      case "false", "no", "0" -> false;
      default -> throw new IllegalArgumentException(key + " must be true or false: " + raw);
    };
  }

  static int parseBoundedInt(Map<String, String> kv, String key, int fallback, int min, int max) {
    String raw = kv.get(key);
    if (raw == null || raw.isBlank()) {
      return fallback;
    }
    int parsed;
    try {
      parsed = Integer.parseInt(raw.trim());
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(key + " must be an integer between " + min + " and " + max, ex);
    }
    if (parsed < min || parsed > max) {
      throw new IllegalArgumentException(key + " must be between " + min + " and " + max + ": " + parsed);
    }
    return parsed;
  }

  static Path parsePath(String key, String value) {
    try {
      return Path.of(Strings.requireNonBlank(key, value)).toAbsolutePath().normalize();
    } catch (InvalidPathException ex) {
      throw new IllegalArgumentException(key + " is not a valid path: " + value, ex);
    }
  }

  static Optional<Path> parseOptionalPath(Map<String, String> kv, String key) {
    String raw = kv.get(key);
    if (raw == null || raw.isBlank()) {
      return Optional.empty();
    }
    return Optional.of(parsePath(key, raw));
  }

  static Optional<String> optionalString(Map<String, String> kv, String key) {
    String raw = kv.get(key);
    if (raw == null || raw.isBlank()) {
      return Optional.empty();
    }
    return Optional.of(raw.trim());
  }

  /**
   * Parses {@code PT10M}, {@code 250ms}, {@code 30s}, {@code 10m}, {@code 1h} or bare seconds.
   */
  static Duration parseDuration(Map<String, String> kv, String key, Duration fallback) {
    String raw = kv.get(key);
    if (raw == null || raw.isBlank()) {
      return fallback;
    }
    String value = raw.trim().toLowerCase(Locale.ROOT);
    Duration parsed;
    try {
      if (value.startsWith("p")) {
        parsed = Duration.parse(value.toUpperCase(Locale.ROOT));
      } else if (value.endsWith("ms")) {
        parsed = Duration.ofMillis(Long.parseLong(value.substring(0, value.length() - 2)));
      } else if (value.endsWith("s")) {
        parsed = Duration.ofSeconds(Long.parseLong(value.substring(0, value.length() - 1)));
      } else if (value.endsWith("m")) {
        parsed = Duration.ofMinutes(Long.parseLong(value.substring(0, value.length() - 1)));
      } else if (value.endsWith("h")) {
        parsed = Duration.ofHours(Long.parseLong(value.substring(0, value.length() - 1)));
      } else {
        parsed = Duration.ofSeconds(Long.parseLong(value));
      }
    } catch (NumberFormatException | DateTimeParseException ex) {
      throw new IllegalArgumentException(key + " is not a valid duration: " + raw, ex);
    }
    if (parsed.isNegative() || parsed.isZero()) {
      throw new IllegalArgumentException(key + " must be positive: " + raw);
    }
    return parsed;
  }
}
