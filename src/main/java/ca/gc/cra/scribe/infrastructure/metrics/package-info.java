/**
 * OpenTelemetry bridge for the {@code MetricsPort}.
 * <p><strong>Concurrency:</strong> Instruments are cached in concurrent maps; attachment and transcription workers
 * may update counters concurrently.</p>
 * <p><strong>Metrics:</strong> Publishes run counters as {@code scribe.<counter>} and the run duration as
 * {@code scribe.run.durationMs}.</p>
 * <p><strong>Security:</strong> Only counts and durations are exported, never message content or paths.</p>
 */
package ca.gc.cra.scribe.infrastructure.metrics;
