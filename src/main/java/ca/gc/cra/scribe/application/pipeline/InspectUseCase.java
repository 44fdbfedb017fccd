package ca.gc.cra.scribe.application.pipeline;

import ca.gc.cra.scribe.application.port.ChatDatabase;
import ca.gc.cra.scribe.application.port.SourceStager;
import ca.gc.cra.scribe.application.port.StagedSource;
import ca.gc.cra.scribe.domain.schema.SchemaDetection;
import ca.gc.cra.scribe.domain.schema.SchemaGenerations;
import ca.gc.cra.scribe.domain.source.SourceDescriptor;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Stages a source and reports its schema generation and table sizes without emitting messages.
 *
 * @since 0.1.0
 */
public final class InspectUseCase {
  private final SourceStager stager;
  private final ChatDatabase.Factory databases;

  public InspectUseCase(SourceStager stager, ChatDatabase.Factory databases) {
    this.stager = Objects.requireNonNull(stager, "stager");
    this.databases = Objects.requireNonNull(databases, "databases");
  }

  /**
   * Inspects a source.
   *
   * @param descriptor source to inspect
   * @return inspection summary
   */
  public Inspection inspect(SourceDescriptor descriptor) {
    try (StagedSource staged = stager.stage(descriptor);
        ChatDatabase database = databases.open(staged.databasePath())) {
      Map<String, Long> counts = new TreeMap<>();
      for (String table : database.tables()) {
        counts.put(table, database.count(table));
      }
      Set<String> columns = new TreeSet<>(database.messageColumns());
      SchemaDetection detection = SchemaGenerations.detect(columns);
      return new Inspection(detection.generation().tag(), detection.degraded(), counts, columns,
          staged.walFrames());
    }
  }

  /**
   * Inspection summary.
   *
   * @param generation detected generation tag
   * @param degraded whether detection fell back to the legacy layout
   * @param tableRowCounts row count per table
   * @param messageColumns message table columns
   * @param walFrames write-ahead log frames staged
   */
  public record Inspection(
      String generation,
      boolean degraded,
      Map<String, Long> tableRowCounts,
      Set<String> messageColumns,
      long walFrames) {
    public Inspection {
      tableRowCounts = Map.copyOf(tableRowCounts);
      messageColumns = Set.copyOf(messageColumns);
    }
  }
}
