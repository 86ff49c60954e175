package ca.gc.cra.geotag.api;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Command-line arguments split into {@code --flags} and {@code key=value} pairs.
 *
 * <p>{@code --help}/{@code -h} and {@code --verbose}/{@code -v} are recognised in any position; every other
 * dash-prefixed token without {@code '='} is kept as a lower-cased flag.</p>
 */
public final class CliInput {
  private static final Set<String> HELP_FLAGS = Set.of("--help", "-h", "help");
  private static final Set<String> VERBOSE_FLAGS = Set.of("--verbose", "-v", "--debug");

  private final List<String> keyValueArgs;
  private final Set<String> flags;

  private CliInput(List<String> keyValueArgs, Set<String> flags) {
    this.keyValueArgs = List.copyOf(keyValueArgs);
    this.flags = Set.copyOf(flags);
  }

  /**
   * Parses raw arguments.
   *
   * @param args raw arguments; {@code null} is treated as empty
   * @return parsed input
   */
  public static CliInput parse(String[] args) {
    List<String> kv = new ArrayList<>();
    Set<String> flags = new LinkedHashSet<>();
    for (String raw : args == null ? new String[0] : args) {
      if (raw == null || raw.isBlank()) {
        continue;
      }
      String arg = raw.trim();
      String lower = arg.toLowerCase(Locale.ROOT);
      if (HELP_FLAGS.contains(lower)) {
        flags.add("--help");
      } else if (VERBOSE_FLAGS.contains(lower)) {
        flags.add("--verbose");
      } else if (arg.startsWith("-") && !arg.contains("=")) {
        flags.add(lower);
      } else {
        kv.add(arg);
      }
    }
    return new CliInput(kv, flags);
  }

  /**
   * Returns the positional and {@code key=value} arguments in command-line order.
   *
   * @return copy of the non-flag arguments
   */
  public String[] keyValueArgs() {
    return keyValueArgs.toArray(String[]::new);
  }

  public boolean help() {
    return flags.contains("--help");
  }

  public boolean verbose() {
    return flags.contains("--verbose");
  }

  /**
   * Checks whether a flag such as {@code --dry-run} was supplied.
   *
   * @param flag flag to query (case-insensitive)
   * @return {@code true} if present
   */
  public boolean hasFlag(String flag) {
    return flag != null && flags.contains(flag.trim().toLowerCase(Locale.ROOT));
  }

  /**
   * Returns all flags supplied.
   *
   * @return lower-cased flags
   */
  public Set<String> flags() {
    return flags;
  }

  @Override
  public String toString() {
    return "CliInput" + Arrays.toString(keyValueArgs()) + flags;
  }
}
