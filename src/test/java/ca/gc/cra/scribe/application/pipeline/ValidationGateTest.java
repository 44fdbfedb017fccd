package ca.gc.cra.scribe.application.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.scribe.application.port.MessageOutputPort;
import ca.gc.cra.scribe.domain.msg.CanonicalMessage;
import ca.gc.cra.scribe.domain.msg.DraftMessage;
import ca.gc.cra.scribe.domain.msg.MissingAttachment;
import ca.gc.cra.scribe.domain.msg.SourceRef;
import ca.gc.cra.scribe.domain.msg.UnresolvedRelation;
import ca.gc.cra.scribe.domain.report.RunCounter;
import ca.gc.cra.scribe.domain.report.RunReport;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ValidationGateTest {
  private final RunReport report =
      new RunReport("run-test", "live", () -> Instant.EPOCH, RunReport.CounterListener.NONE);

  @Test
  void validMessagesAreEmittedAndInvalidOnesQuarantined() throws Exception {
    RecordingOutput output = new RecordingOutput();
    ValidationGate gate = new ValidationGate(
        message -> message.timestamp() == null ? List.of("timestamp: required") : List.of(), report);

    assertTrue(gate.admit(message("A", Instant.EPOCH), output));
    assertFalse(gate.admit(message("B", null), output));

    assertEquals(List.of("A"), output.emitted);
    assertEquals(List.of("B: [timestamp: required]"), output.quarantined);
    assertEquals(1L, report.get(RunCounter.MESSAGES_EMITTED));
    assertEquals(1L, report.get(RunCounter.QUARANTINED));
  }

  private static CanonicalMessage message(String id, Instant timestamp) {
    return new DraftMessage(id, "chat", timestamp, "self", true, "hi", new SourceRef("chat.db", id, 1), Map.of())
        .freeze();
  }

  private static final class RecordingOutput implements MessageOutputPort {
    final List<String> emitted = new ArrayList<>();
    final List<String> quarantined = new ArrayList<>();

    @Override
    public void emit(CanonicalMessage message) {
      emitted.add(message.id());
    }

    @Override
    public void quarantine(CanonicalMessage message, List<String> reasons) {
      quarantined.add(message.id() + ": " + reasons);
    }

    @Override
    public void writeUnresolved(List<UnresolvedRelation> relations) {}

    @Override
    public void writeMissingAttachments(List<MissingAttachment> missing) {}

    @Override
    public void writeRunReport(Map<String, Object> report) {}

    @Override
    public void close() {}
  }
}
