package ca.gc.cra.scribe.domain.msg;

import java.util.Objects;

/**
 * Transcript produced for one audio attachment.
 *
 * @param attachment display name of the transcribed attachment
 * @param text transcript text
 * @param engine engine name
 * @param model model identifier configured for the engine
 * @since 0.1.0
 */
public record Transcript(String attachment, String text, String engine, String model) {
  public Transcript {
    Objects.requireNonNull(text, "text");
    Objects.requireNonNull(engine, "engine");
  }
}
