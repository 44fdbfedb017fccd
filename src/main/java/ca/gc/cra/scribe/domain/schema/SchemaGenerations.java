package ca.gc.cra.scribe.domain.schema;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;

/**
 * <strong>What:</strong> Append-only registry of known message-table generations.
 * <p><strong>Why:</strong> Exports mix generations, so selection is by column presence rather than by version string.
 * New platform layouts are added as new entries; existing entries never change.</p>
 * <p><strong>Thread-safety:</strong> Immutable after class initialization.</p>
 *
 * @since 0.1.0
 */
public final class SchemaGenerations {
  private static final Set<String> CORE = Set.of("ROWID", "guid", "text", "date", "is_from_me");
  private static final Set<String> COMMON_OPTIONAL = Set.of(
      "handle_id", "service", "associated_message_guid", "associated_message_type",
      "cache_has_attachments", "thread_originator_guid", "associated_message_emoji", "date_read",
      "date_delivered", "is_read", "item_type", "subject", "account");

  public static final SchemaGeneration LEGACY_PLAIN_TEXT =
      new SchemaGeneration("legacy_plain_text", 1, CORE, COMMON_OPTIONAL);

  public static final SchemaGeneration BINARY_TEXT = new SchemaGeneration(
      "binary_text", 2, union(CORE, Set.of("attributedBody")), COMMON_OPTIONAL);

  public static final SchemaGeneration BINARY_TEXT_EDIT_HISTORY = new SchemaGeneration(
      "binary_text_edit_history",
      3,
      union(CORE, Set.of("attributedBody", "message_summary_info")),
      union(COMMON_OPTIONAL, Set.of("date_edited", "date_retracted")));

  private static final List<SchemaGeneration> REGISTRY =
      List.of(LEGACY_PLAIN_TEXT, BINARY_TEXT, BINARY_TEXT_EDIT_HISTORY);

  private SchemaGenerations() {
    // Utility
  }

  /**
   * Returns every registered generation in version order.
   *
   * @return immutable registry view
   */
  public static List<SchemaGeneration> all() {
    return REGISTRY;
  }

  /**
   * Selects the highest-version generation whose required columns are all present.
   *
   * @param messageColumns column names of the message table, any case
   * @return detection; degraded to {@link #LEGACY_PLAIN_TEXT} when nothing matches
   */
  public static SchemaDetection detect(Collection<String> messageColumns) {
    Set<String> present = new TreeSet<>();
    for (String column : messageColumns) {
      present.add(column.toLowerCase(Locale.ROOT));
    }
    List<SchemaGeneration> ordered = new ArrayList<>(REGISTRY);
    ordered.sort(Comparator.comparingInt(SchemaGeneration::version).reversed());
    for (SchemaGeneration generation : ordered) {
      if (generation.matches(present)) {
        return new SchemaDetection(generation, false);
      }
    }
    return new SchemaDetection(LEGACY_PLAIN_TEXT, true);
  }

  private static Set<String> union(Set<String> first, Set<String> second) {
    Set<String> merged = new TreeSet<>(first);
    merged.addAll(second);
    return merged;
  }
}
