package ca.gc.cra.scribe.application.port;

import ca.gc.cra.scribe.domain.msg.CanonicalMessage;
import ca.gc.cra.scribe.domain.msg.MissingAttachment;
import ca.gc.cra.scribe.domain.msg.UnresolvedRelation;
import java.io.IOException;
import java.util.List;
import java.util.Map;

/**
 * <strong>What:</strong> Output port for every artifact of a run.
 * <p><strong>Why:</strong> Keeps the use case independent of file layout and serialization.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Stream valid messages and quarantined records.</li>
 *   <li>Write the unresolved-relation, missing-attachment and run report artifacts once.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Single-threaded; called from the orchestrating thread only.</p>
 *
 * @since 0.1.0
 */
public interface MessageOutputPort extends AutoCloseable {
  void emit(CanonicalMessage message) throws IOException;

  void quarantine(CanonicalMessage message, List<String> reasons) throws IOException;

  void writeUnresolved(List<UnresolvedRelation> relations) throws IOException;

  void writeMissingAttachments(List<MissingAttachment> missing) throws IOException;

  void writeRunReport(Map<String, Object> report) throws IOException;

  @Override
  void close() throws IOException;

  /** Opens the output port for one run. */
  @FunctionalInterface
  interface Factory {
    MessageOutputPort open() throws IOException;
  }
}
