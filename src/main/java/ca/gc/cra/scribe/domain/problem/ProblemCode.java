package ca.gc.cra.scribe.domain.problem;

import java.util.Locale;

/**
 * <strong>What:</strong> Stable machine-readable codes for conditions that abort a SCRIBE run.
 * <p><strong>Why:</strong> Automation keys off the code, never off the human summary, so codes are never renamed.</p>
 * <p><strong>Role:</strong> Domain vocabulary shared by staging, the extract use case and the CLI error surface.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable.</p>
 *
 * @since 0.1.0
 * @see PipelineFailure
 * @see ProblemDetails
 */
public enum ProblemCode {
  /** The live database file or the backup's logical database entry does not exist. */
  DATABASE_NOT_FOUND("Database not found", 404),
  /** The staged database could not be opened or lacks the message table. */
  DATABASE_UNREADABLE("Database unreadable", 422),
  /** The backup manifest index is missing or cannot be read. */
  BACKUP_MANIFEST_MISSING("Backup manifest missing", 404),
  /** The backup is encrypted and no passphrase was supplied. */
  BACKUP_PASSPHRASE_REQUIRED("Encrypted backup needs passphrase", 401),
  /** The supplied passphrase did not unlock the backup keybag, or a blob failed to decrypt. */
  BACKUP_DECRYPTION_FAILED("Backup decryption failed", 403),
  /** Copying or decrypting the source exceeded the staging timeout. */
  STAGING_TIMEOUT("Staging timed out", 504),
  /** Not a single record passed schema validation. */
  NO_VALID_ROWS("No valid rows", 422),
  /** Output artifacts could not be written. */
  OUTPUT_FAILURE("Output failure", 500),
  /** The run was cancelled between rows. */
  RUN_INTERRUPTED("Run interrupted", 499);

  private final String title;
  private final int status;

  ProblemCode(String title, int status) {
    this.title = title;
    this.status = status;
  }

  /**
   * Returns the short human summary.
   *
   * @return title for problem payloads
   */
  public String title() {
    return title;
  }

  /**
   * Returns the HTTP-style status associated with the problem.
   *
   * @return status value
   */
  public int status() {
    return status;
  }

  /**
   * Returns the kebab-case form used in problem type URIs.
   *
   * @return slug such as {@code database-not-found}
   */
  public String slug() {
    return name().toLowerCase(Locale.ROOT).replace('_', '-');
  }
}
