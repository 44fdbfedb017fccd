package ca.gc.cra.scribe.domain.schema;

import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * One known message-table layout.
 *
 * @param tag stable tag emitted in the run report
 * @param version registry position; higher versions are preferred
 * @param requiredColumns columns that must all be present (lower-case)
 * @param optionalColumns columns read when present (lower-case)
 * @since 0.1.0
 */
public record SchemaGeneration(
    String tag, int version, Set<String> requiredColumns, Set<String> optionalColumns) {

  public SchemaGeneration {
    Objects.requireNonNull(tag, "tag");
    requiredColumns = lowerCase(requiredColumns);
    optionalColumns = lowerCase(optionalColumns);
  }

  /**
   * Reports whether the generation declares a column as required or optional.
   *
   * @param column column name, any case
   * @return {@code true} when declared
   */
  public boolean declares(String column) {
    String lower = column.toLowerCase(Locale.ROOT);
    return requiredColumns.contains(lower) || optionalColumns.contains(lower);
  }

  /**
   * Reports whether every required column is present.
   *
   * @param presentColumns lower-case column names
   * @return {@code true} when the layout matches
   */
  public boolean matches(Set<String> presentColumns) {
    return presentColumns.containsAll(requiredColumns);
  }

  private static Set<String> lowerCase(Set<String> columns) {
    TreeSet<String> lowered = new TreeSet<>();
    if (columns != null) {
      for (String column : columns) {
        lowered.add(column.toLowerCase(Locale.ROOT));
      }
    }
    return Set.copyOf(lowered);
  }
}
