package ca.gc.cra.scribe.infrastructure.backup;

import java.io.IOException;

/**
 * Raised when an encrypted backup blob cannot be decrypted with the unlocked keys.
 *
 * @since 0.1.0
 */
public final class BackupDecryptionException extends IOException {
  private static final long serialVersionUID = 1L;

  public BackupDecryptionException(String message) {
    super(message);
  }

  public BackupDecryptionException(String message, Throwable cause) {
    super(message, cause);
  }
}
