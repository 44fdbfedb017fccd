package ca.gc.cra.scribe.infrastructure.output;

import ca.gc.cra.scribe.application.port.MessageOutputPort;
import ca.gc.cra.scribe.domain.msg.CanonicalMessage;
import ca.gc.cra.scribe.domain.msg.MissingAttachment;
import ca.gc.cra.scribe.domain.msg.UnresolvedRelation;
import com.fasterxml.jackson.databind.JsonNode;
import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Writes run artifacts as UTF-8 NDJSON and JSON files in the output directory.
 * <p><strong>Files:</strong> {@value #MESSAGES}, {@value #QUARANTINE}, {@value #UNRESOLVED},
 * {@value #MISSING_ATTACHMENTS} and {@value #RUN_REPORT}. The three line-oriented files are created on open so an
 * empty run still leaves empty files behind.</p>
 * <p><strong>Thread-safety:</strong> Not thread-safe; driven from the orchestrating thread.</p>
 *
 * @since 0.1.0
 */
public final class NdjsonMessageOutputAdapter implements MessageOutputPort {
  private static final Logger log = LoggerFactory.getLogger(NdjsonMessageOutputAdapter.class);

  public static final String MESSAGES = "messages.ndjson";
  public static final String QUARANTINE = "quarantine.ndjson";
  public static final String UNRESOLVED = "unresolved_relations.ndjson";
  public static final String MISSING_ATTACHMENTS = "missing_attachments.json";
  public static final String RUN_REPORT = "run_report.json";

  private final Path directory;
  private final BufferedWriter messages;
  private final BufferedWriter quarantine;
  private final BufferedWriter unresolved;
  private long emitted;
  private long quarantined;

  private NdjsonMessageOutputAdapter(
      Path directory, BufferedWriter messages, BufferedWriter quarantine, BufferedWriter unresolved) {
    this.directory = directory;
    this.messages = messages;
    this.quarantine = quarantine;
    this.unresolved = unresolved;
  }

  /**
   * Opens the adapter, truncating any previous artifacts.
   *
   * @param directory output directory; created when missing
   * @return open adapter
   * @throws IOException when a file cannot be created
   */
  public static NdjsonMessageOutputAdapter open(Path directory) throws IOException {
    Objects.requireNonNull(directory, "directory");
    Files.createDirectories(directory);
    BufferedWriter messages = null;
    BufferedWriter quarantine = null;
    try {
      messages = Files.newBufferedWriter(directory.resolve(MESSAGES), StandardCharsets.UTF_8);
      quarantine = Files.newBufferedWriter(directory.resolve(QUARANTINE), StandardCharsets.UTF_8);
      BufferedWriter unresolved = Files.newBufferedWriter(directory.resolve(UNRESOLVED), StandardCharsets.UTF_8);
      return new NdjsonMessageOutputAdapter(directory, messages, quarantine, unresolved);
    } catch (IOException ex) {
      closeAll(ex, messages, quarantine);
      throw ex;
    }
  }

  /**
   * Returns a factory opening adapters on {@code directory}.
   *
   * @param directory output directory
   * @return output factory
   */
  public static MessageOutputPort.Factory factory(Path directory) {
    return () -> open(directory);
  }

  @Override
  public void emit(CanonicalMessage message) throws IOException {
    writeLine(messages, CanonicalJson.message(message));
    emitted++;
  }

  @Override
  public void quarantine(CanonicalMessage message, List<String> reasons) throws IOException {
    writeLine(quarantine, CanonicalJson.quarantine(message, reasons));
    quarantined++;
  }

  @Override
  public void writeUnresolved(List<UnresolvedRelation> relations) throws IOException {
    for (UnresolvedRelation relation : relations) {
      writeLine(unresolved, CanonicalJson.unresolved(relation));
    }
  }

  @Override
  public void writeMissingAttachments(List<MissingAttachment> missing) throws IOException {
    writeDocument(MISSING_ATTACHMENTS, CanonicalJson.missingAttachments(missing));
  }

  @Override
  public void writeRunReport(Map<String, Object> report) throws IOException {
    writeDocument(RUN_REPORT, CanonicalJson.value(report));
  }

  @Override
  public void close() throws IOException {
    IOException failure = closeAll(null, messages, quarantine, unresolved);
    log.debug("Closed outputs: {} emitted, {} quarantined", emitted, quarantined);
    if (failure != null) {
      throw failure;
    }
  }

  private void writeDocument(String name, JsonNode node) throws IOException {
    Files.writeString(directory.resolve(name), CanonicalJson.pretty(node) + "\n", StandardCharsets.UTF_8);
  }

  private static void writeLine(BufferedWriter writer, JsonNode node) throws IOException {
    writer.write(CanonicalJson.line(node));
    writer.write('\n');
  }

  private static IOException closeAll(IOException primary, BufferedWriter... writers) {
    IOException failure = primary;
    for (BufferedWriter writer : writers) {
      if (writer == null) {
        continue;
      }
      try {
        writer.close();
      } catch (IOException ex) {
        if (failure == null) {
          failure = ex;
        } else {
          failure.addSuppressed(ex);
        }
      }
    }
    return failure;
  }
}
