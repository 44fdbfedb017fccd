package ca.gc.cra.scribe.application.pipeline;

import ca.gc.cra.scribe.application.port.MessageOutputPort;
import ca.gc.cra.scribe.application.port.MessageValidator;
import ca.gc.cra.scribe.domain.msg.CanonicalMessage;
import ca.gc.cra.scribe.domain.report.RunCounter;
import ca.gc.cra.scribe.domain.report.RunReport;
import java.io.IOException;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Routes each frozen message to the main output or to quarantine.
 *
 * @since 0.1.0
 */
public final class ValidationGate {
  private static final Logger log = LoggerFactory.getLogger(ValidationGate.class);

  private final MessageValidator validator;
  private final RunReport report;

  public ValidationGate(MessageValidator validator, RunReport report) {
    this.validator = Objects.requireNonNull(validator, "validator");
    this.report = Objects.requireNonNull(report, "report");
  }

  /**
   * Validates a message and writes it to the matching sink.
   *
   * @param message frozen message
   * @param output output port
   * @return {@code true} when emitted, {@code false} when quarantined
   * @throws IOException when the sink write fails
   */
  public boolean admit(CanonicalMessage message, MessageOutputPort output) throws IOException {
    List<String> reasons = validator.validate(message);
    if (reasons.isEmpty()) {
      output.emit(message);
      report.increment(RunCounter.MESSAGES_EMITTED);
      return true;
    }
    output.quarantine(message, reasons);
    report.increment(RunCounter.QUARANTINED);
    log.debug("Quarantined row {}: {}", message.sourceRef().rowId(), reasons);
    return false;
  }
}
