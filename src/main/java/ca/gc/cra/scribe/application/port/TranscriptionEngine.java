package ca.gc.cra.scribe.application.port;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Local speech-to-text engine. Implementations must never send audio off the device.
 *
 * @since 0.1.0
 */
public interface TranscriptionEngine {
  /**
   * Returns the engine name recorded with each transcript.
   *
   * @return engine name
   */
  String name();

  /**
   * Returns the configured model identifier.
   *
   * @return model identifier, or {@code null} when not applicable
   */
  String model();

  /**
   * Transcribes an audio file.
   *
   * @param audio readable audio file
   * @return transcript text, empty when the engine produced nothing
   * @throws IOException when the engine fails or times out
   * @throws InterruptedException when interrupted while waiting for the engine
   */
  Optional<String> transcribe(Path audio) throws IOException, InterruptedException;
}
