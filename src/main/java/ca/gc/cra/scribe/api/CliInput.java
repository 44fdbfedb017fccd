package ca.gc.cra.scribe.api;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Command arguments split into {@code key=value} pairs and boolean switches.
 *
 * <p>A switch such as {@code --dry-run} is recorded under the configuration key it stands for
 * ({@code dryRun}), so callers can treat {@code --allow-overwrite} and {@code allowOverwrite=true}
 * alike. Help and verbose switches are recognized in their short forms too.
 *
 * @param arguments {@code key=value} arguments in command-line order
 * @param switches configuration keys enabled by {@code --switch} arguments
 * @param help whether usage was requested
 * @param verbose whether debug logging was requested
 * @since 0.1.0
 */
public record CliInput(List<String> arguments, Set<String> switches, boolean help, boolean verbose) {
  private static final Set<String> HELP_SWITCHES = Set.of("--help", "-h", "help");
  private static final Set<String> VERBOSE_SWITCHES = Set.of("--verbose", "-v", "--debug");

  public CliInput {
    arguments = List.copyOf(arguments);
    switches = Set.copyOf(switches);
  }

  /**
   * Splits raw arguments; {@code null} and blank entries are ignored.
   *
   * @param args raw CLI arguments (may be {@code null})
   * @return parsed input
   */
  public static CliInput parse(String[] args) {
    List<String> arguments = new ArrayList<>();
    Set<String> switches = new LinkedHashSet<>();
    boolean help = false;
    boolean verbose = false;
    for (String raw : args == null ? new String[0] : args) {
      String arg = raw == null ? "" : raw.trim();
      if (arg.isEmpty()) {
        continue;
      }
      String lower = arg.toLowerCase(Locale.ROOT);
      if (HELP_SWITCHES.contains(lower)) {
        help = true;
      } else if (VERBOSE_SWITCHES.contains(lower)) {
        verbose = true;
      } else if (arg.startsWith("-") && !arg.contains("=")) {
        switches.add(configKey(lower));
      } else {
        arguments.add(arg);
      }
    }
    return new CliInput(arguments, switches, help, verbose);
  }

  /** Arguments in the array form {@link CliArgsParser#toMap(String[])} expects. */
  public String[] keyValueArgs() {
    return arguments.toArray(String[]::new);
  }

  /**
   * Checks whether a switch for the given configuration key was supplied.
   *
   * @param key configuration key, e.g. {@code dryRun}
   * @return {@code true} when the matching {@code --switch} was present
   */
  public boolean hasSwitch(String key) {
    return key != null && switches.contains(key);
  }

  /** Maps {@code --allow-overwrite} to {@code allowOverwrite}. */
  static String configKey(String lowerSwitch) {
    String name = lowerSwitch.replaceFirst("^-+", "");
    StringBuilder key = new StringBuilder(name.length());
    boolean upper = false;
    for (char c : name.toCharArray()) {
      if (c == '-' || c == '_') {
        upper = key.length() > 0;
        continue;
      }
      key.append(upper ? Character.toUpperCase(c) : c);
      upper = false;
    }
    return key.toString();
  }
}
