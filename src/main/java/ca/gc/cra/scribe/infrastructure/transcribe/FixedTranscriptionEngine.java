package ca.gc.cra.scribe.infrastructure.transcribe;

import ca.gc.cra.scribe.application.port.AttachmentMaterializer;
import ca.gc.cra.scribe.application.port.TranscriptionEngine;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Deterministic engine whose output depends only on a template and the audio content hash.
 *
 * <p>{@code {sha256}} in the template is replaced with the first twelve hex digits of the content hash.
 * Used for reproducible runs and tests.</p>
 *
 * @since 0.1.0
 */
public final class FixedTranscriptionEngine implements TranscriptionEngine {
  /** Placeholder replaced by the short content hash. */
  public static final String HASH_PLACEHOLDER = "{sha256}";
  static final int SHORT_HASH_LENGTH = 12;

  private final String template;
  private final AttachmentMaterializer hasher;

  public FixedTranscriptionEngine(String template, AttachmentMaterializer hasher) {
    this.template = Objects.requireNonNull(template, "template");
    this.hasher = Objects.requireNonNull(hasher, "hasher");
  }

  @Override
  public String name() {
    return "fixed";
  }

  @Override
  public String model() {
    return null;
  }

  @Override
  public Optional<String> transcribe(Path audio) throws IOException {
    if (!template.contains(HASH_PLACEHOLDER)) {
      return template.isBlank() ? Optional.empty() : Optional.of(template);
    }
    String hash = hasher.hash(audio);
    String hex = hash.substring(hash.indexOf(':') + 1);
    return Optional.of(template.replace(HASH_PLACEHOLDER, hex.substring(0, Math.min(SHORT_HASH_LENGTH, hex.length()))));
  }
}
