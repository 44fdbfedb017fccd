package ca.gc.cra.scribe.config;

import java.util.Locale;

/** Which transcription engine, if any, handles audio attachments. */
public enum TranscriptionMode {
  /** Audio attachments carry no transcript. */
  OFF,
  /** Local whisper.cpp executable. */
  WHISPER_CPP,
  /** Deterministic text derived from the audio hash; for tests and dry pipelines. */
  FIXED;

  /**
   * Parses a configuration value such as {@code off}, {@code whisper-cpp} or {@code fixed}.
   *
   * @param value raw value
   * @return matching mode
   * @throws IllegalArgumentException for unknown values
   */
  public static TranscriptionMode fromString(String value) {
    String normalized = value.trim().toUpperCase(Locale.ROOT).replace('-', '_').replace('.', '_');
    if ("WHISPER".equals(normalized) || "WHISPERCPP".equals(normalized)) {
      return WHISPER_CPP;
    }
    try {
      return valueOf(normalized);
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException("transcription.mode must be off, whisper-cpp or fixed: " + value, ex);
    }
  }
}
