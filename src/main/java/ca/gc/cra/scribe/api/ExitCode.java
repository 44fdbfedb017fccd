package ca.gc.cra.scribe.api;

import ca.gc.cra.scribe.domain.problem.ProblemCode;
import java.util.Objects;

/**
 * <strong>What:</strong> Canonical exit codes shared by SCRIBE commands.
 * <p><strong>Why:</strong> Scripts wrapping an export branch on the process status, so each fatal
 * {@link ProblemCode} maps to one stable value.</p>
 * <p><strong>Role:</strong> Adapter-facing enum returned by CLI entry points.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable and thread-safe.</p>
 *
 * @since 0.1.0
 */
public enum ExitCode {
  /** Successful execution. */
  SUCCESS(0),
  /** Command-line arguments were invalid. */
  INVALID_ARGS(2),
  /** IO failure occurred while reading configuration or writing outputs. */
  IO_ERROR(3),
  /** Configuration was missing or malformed. */
  CONFIG_ERROR(4),
  /** Unexpected runtime failure occurred. */
  RUNTIME_FAILURE(5),
  /** The source could not be found, staged, decrypted or read. */
  SOURCE_ERROR(6),
  /** The run finished but no record passed validation. */
  NO_VALID_ROWS(7),
  /** Process was interrupted (e.g., SIGINT). */
  INTERRUPTED(130);

  private final int code;

  ExitCode(int code) {
    this.code = code;
  }

  /**
   * Returns the numeric value encoded by this exit code.
   *
   * @return numeric exit code
   */
  public int code() {
    return code;
  }

  /**
   * Maps a fatal problem to the exit code reported by the CLI.
   *
   * @param problem stable problem code
   * @return exit code
   */
  public static ExitCode forProblem(ProblemCode problem) {
    Objects.requireNonNull(problem, "problem");
    return switch (problem) {
      case DATABASE_NOT_FOUND, DATABASE_UNREADABLE, BACKUP_MANIFEST_MISSING, BACKUP_PASSPHRASE_REQUIRED,
          BACKUP_DECRYPTION_FAILED, STAGING_TIMEOUT -> SOURCE_ERROR;
      case NO_VALID_ROWS -> NO_VALID_ROWS;
      case OUTPUT_FAILURE -> IO_ERROR;
      case RUN_INTERRUPTED -> INTERRUPTED;
    };
  }
}
