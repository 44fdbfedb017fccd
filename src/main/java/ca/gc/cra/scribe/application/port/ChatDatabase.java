package ca.gc.cra.scribe.application.port;

import ca.gc.cra.scribe.domain.msg.AttachmentRow;
import ca.gc.cra.scribe.domain.msg.RawRow;
import ca.gc.cra.scribe.domain.schema.SchemaGeneration;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Read access to a staged chat database.
 *
 * <p>Implementations wrap driver exceptions in
 * {@link ca.gc.cra.scribe.domain.problem.PipelineFailure} with code {@code DATABASE_UNREADABLE}.</p>
 *
 * @since 0.1.0
 */
public interface ChatDatabase extends AutoCloseable {
  /**
   * Lists table names.
   *
   * @return table names as declared
   */
  Set<String> tables();

  /**
   * Lists the message table's columns.
   *
   * @return column names as declared
   */
  Set<String> messageColumns();

  /**
   * Counts rows in a table.
   *
   * @param table table name from {@link #tables()}
   * @return row count
   */
  long count(String table);

  /**
   * Streams message rows in {@code ROWID} order.
   *
   * @param generation detected generation; selects which payload columns are read
   * @param consumer receives each row; exceptions it throws stop the scan and propagate
   */
  default void forEachMessage(SchemaGeneration generation, Consumer<RawRow> consumer) {
    forEachMessage(generation, Optional.empty(), consumer);
  }

  /**
   * Streams the message rows of one handle's conversations in {@code ROWID} order.
   *
   * <p>A conversation belongs to the handle when the handle is a participant or sent a message in it. The
   * address is compared with {@code handle.id} exactly as stored.</p>
   *
   * @param generation detected generation; selects which payload columns are read
   * @param contact handle address; empty streams every row
   * @param consumer receives each row; exceptions it throws stop the scan and propagate
   */
  void forEachMessage(SchemaGeneration generation, Optional<String> contact, Consumer<RawRow> consumer);

  /**
   * Loads attachment records grouped by owning message row, each list ordered by attachment row.
   *
   * @return attachments keyed by {@code message.ROWID}; empty when attachment tables are absent
   */
  Map<Long, List<AttachmentRow>> attachmentsByMessage();

  @Override
  void close();

  /** Opens staged databases. */
  @FunctionalInterface
  interface Factory {
    ChatDatabase open(Path databasePath);
  }
}
