package ca.gc.cra.scribe.application.port;

/**
 * <strong>What:</strong> Port abstracting SCRIBE metrics emission.
 * <p><strong>Why:</strong> Lets pipeline stages record counters without binding to a vendor SDK.</p>
 * <p><strong>Role:</strong> Implemented by {@code OpenTelemetryMetricsAdapter}; {@link #NO_OP} for tests and disabled
 * exporters.</p>
 * <p><strong>Thread-safety:</strong> Implementations must accept concurrent updates from attachment and
 * transcription workers.</p>
 * <p><strong>Observability:</strong> Defines the metric name contract ({@code scribe.<counter>}).</p>
 *
 * @since 0.1.0
 */
public interface MetricsPort {
  /**
   * Increments the named counter by one.
   *
   * @param key metric identifier such as {@code scribe.rows_read}; must not be {@code null}
   */
  void increment(String key);

  /**
   * Records an observation for a histogram style metric.
   *
   * @param key metric identifier; must not be {@code null}
   * @param value observed value, e.g. milliseconds or bytes
   */
  void observe(String key, long value);

  /**
   * Adds a delta to the named counter.
   *
   * @param key metric identifier; must not be {@code null}
   * @param delta non-negative amount
   */
  default void add(String key, long delta) {
    for (long i = 0; i < delta; i++) {
      increment(key);
    }
  }

  /** Metrics sink that discards everything. */
  MetricsPort NO_OP = new MetricsPort() {
    @Override public void increment(String key) {}

    @Override public void observe(String key, long value) {}

    @Override public void add(String key, long delta) {}
  };
}
