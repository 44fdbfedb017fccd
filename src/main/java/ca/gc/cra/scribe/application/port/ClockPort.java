package ca.gc.cra.scribe.application.port;

import java.time.Instant;

/**
 * Supplies wall-clock time for run report stamps. Never used for message content.
 *
 * @since 0.1.0
 */
public interface ClockPort {
  /**
   * Returns the current time in milliseconds since the Unix epoch.
   *
   * @return epoch milliseconds
   */
  long nowMillis();

  /**
   * Returns the current time as an instant.
   *
   * @return current instant
   */
  default Instant now() {
    return Instant.ofEpochMilli(nowMillis());
  }

  /** Clock backed by {@link System#currentTimeMillis()}. */
  ClockPort SYSTEM = System::currentTimeMillis;
}
