package ca.gc.cra.scribe.domain.schema;

import java.util.Objects;

/**
 * Result of classifying a staged database.
 *
 * @param generation selected generation
 * @param degraded {@code true} when no generation matched and the legacy path was forced
 * @since 0.1.0
 */
public record SchemaDetection(SchemaGeneration generation, boolean degraded) {
  public SchemaDetection {
    Objects.requireNonNull(generation, "generation");
  }
}
