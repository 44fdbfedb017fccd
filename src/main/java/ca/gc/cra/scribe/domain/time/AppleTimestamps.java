package ca.gc.cra.scribe.domain.time;

import java.time.Instant;

/**
 * <strong>What:</strong> Normalizes raw message-table dates into UTC instants.
 * <p><strong>Why:</strong> The platform counts from 2001-01-01 UTC and switched from seconds to nanoseconds at some
 * point; exports mix both, so the unit is chosen by magnitude instead of by declared schema generation.</p>
 * <p><strong>Thread-safety:</strong> Stateless.</p>
 *
 * @since 0.1.0
 */
public final class AppleTimestamps {
  /** Seconds between the Unix epoch and 2001-01-01T00:00:00Z. */
  public static final long APPLE_EPOCH_OFFSET_SECONDS = 978_307_200L;
  /** Raw values at or above this magnitude are nanoseconds. */
  public static final long NANOS_THRESHOLD = 100_000_000_000L;

  private static final long NANOS_PER_SECOND = 1_000_000_000L;
  private static final Instant APPLE_EPOCH = Instant.ofEpochSecond(APPLE_EPOCH_OFFSET_SECONDS);

  private AppleTimestamps() {
    // Utility
  }

  /**
   * Converts a raw date to a second-precision UTC instant.
   *
   * @param raw raw column value in seconds or nanoseconds since the Apple epoch
   * @return normalized instant
   */
  public static Instant normalize(long raw) {
    return APPLE_EPOCH.plusSeconds(toSeconds(raw));
  }

  /**
   * Converts a raw date to whole seconds since the Apple epoch, rounding nanoseconds half-up.
   *
   * @param raw raw column value
   * @return seconds since the Apple epoch
   */
  public static long toSeconds(long raw) {
    if (Math.abs(raw) < NANOS_THRESHOLD) {
      return raw;
    }
    return Math.floorDiv(raw + NANOS_PER_SECOND / 2, NANOS_PER_SECOND);
  }

  /**
   * Reports whether the raw value would be interpreted as nanoseconds.
   *
   * @param raw raw column value
   * @return {@code true} when the magnitude reaches {@link #NANOS_THRESHOLD}
   */
  public static boolean isNanoseconds(long raw) {
    return Math.abs(raw) >= NANOS_THRESHOLD;
  }
}
