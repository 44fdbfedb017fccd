package ca.gc.cra.scribe.config;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Transcription settings for audio attachments.
 *
 * @param mode engine selection
 * @param binary whisper.cpp executable; required for {@link TranscriptionMode#WHISPER_CPP}
 * @param model whisper model file; required for {@link TranscriptionMode#WHISPER_CPP}
 * @param language spoken language hint passed to the engine
 * @param ffmpeg optional converter used to turn audio into 16 kHz WAV first
 * @param timeout per-attachment engine timeout
 * @param fixedText template for {@link TranscriptionMode#FIXED}; {@code {sha256}} expands to a hash prefix
 * @since 0.1.0
 */
public record TranscriptionConfig(
    TranscriptionMode mode,
    Optional<Path> binary,
    Optional<Path> model,
    String language,
    Optional<Path> ffmpeg,
    Duration timeout,
    String fixedText) {

  static final Duration DEFAULT_TIMEOUT = Duration.ofMinutes(2);
  static final String DEFAULT_FIXED_TEXT = "[transcript {sha256}]";

  public TranscriptionConfig {
    mode = Objects.requireNonNullElse(mode, TranscriptionMode.OFF);
    binary = Objects.requireNonNullElse(binary, Optional.empty());
    model = Objects.requireNonNullElse(model, Optional.empty());
    ffmpeg = Objects.requireNonNullElse(ffmpeg, Optional.empty());
    language = language == null || language.isBlank() ? "en" : language.trim();
    if (!language.matches("[A-Za-z]{2,3}|auto")) {
      throw new IllegalArgumentException("transcription.language must be a 2-3 letter code or auto: " + language);
    }
    timeout = Objects.requireNonNullElse(timeout, DEFAULT_TIMEOUT);
    fixedText = fixedText == null || fixedText.isBlank() ? DEFAULT_FIXED_TEXT : fixedText;
    if (mode == TranscriptionMode.WHISPER_CPP && (binary.isEmpty() || model.isEmpty())) {
      throw new IllegalArgumentException(
          "transcription.binary and transcription.model are required when transcription.mode=whisper-cpp");
    }
  }

  /**
   * Returns the configuration with transcription disabled.
   *
   * @return disabled configuration
   */
  public static TranscriptionConfig off() {
    return new TranscriptionConfig(TranscriptionMode.OFF, Optional.empty(), Optional.empty(), "en",
        Optional.empty(), DEFAULT_TIMEOUT, DEFAULT_FIXED_TEXT);
  }

  /**
   * Reads {@code transcription.*} keys.
   *
   * @param kv flat configuration
   * @return parsed settings
   */
  public static TranscriptionConfig fromMap(Map<String, String> kv) {
    Objects.requireNonNull(kv, "kv");
    TranscriptionMode mode = ConfigValues.optionalString(kv, "transcription.mode")
        .map(TranscriptionMode::fromString)
        .orElse(TranscriptionMode.OFF);
    return new TranscriptionConfig(
        mode,
        ConfigValues.parseOptionalPath(kv, "transcription.binary"),
        ConfigValues.parseOptionalPath(kv, "transcription.model"),
        kv.get("transcription.language"),
        ConfigValues.parseOptionalPath(kv, "transcription.ffmpeg"),
        ConfigValues.parseDuration(kv, "transcription.timeout", DEFAULT_TIMEOUT),
        kv.get("transcription.fixedText"));
  }

  public boolean enabled() {
    return mode != TranscriptionMode.OFF;
  }
}
