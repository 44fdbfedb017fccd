package ca.gc.cra.scribe.application.port;

import ca.gc.cra.scribe.domain.msg.CanonicalMessage;
import java.util.List;

/**
 * Validates frozen canonical messages against the canonical schema.
 *
 * @since 0.1.0
 */
public interface MessageValidator {
  /**
   * Validates one message.
   *
   * @param message frozen message
   * @return failure reasons in a stable order; empty when valid
   */
  List<String> validate(CanonicalMessage message);
}
