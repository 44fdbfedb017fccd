package ca.gc.cra.scribe.logging;

import ca.gc.cra.scribe.domain.problem.PathRedaction;

/**
 * <strong>What:</strong> Logging hygiene helpers that keep personal data out of operator logs.
 * <p><strong>Why:</strong> Source paths sit under a user's home directory and message content is personal;
 * neither belongs in log files.</p>
 * <p><strong>Thread-safety:</strong> Stateless utilities.</p>
 *
 * @since 0.1.0
 * @see LoggingConfigurator
 */
public final class Logs {
  private static final String NULL_PLACEHOLDER = "<null>";

  private Logs() {
    // Utility
  }

  /**
   * Replaces the current user's home directory with {@code ~}.
   *
   * @param path path or message that may contain the home directory
   * @return redacted text, {@code "<null>"} for {@code null}
   */
  public static String redactPath(String path) {
    if (path == null) {
      return NULL_PLACEHOLDER;
    }
    return PathRedaction.redact(path, System.getProperty("user.home"));
  }
}
