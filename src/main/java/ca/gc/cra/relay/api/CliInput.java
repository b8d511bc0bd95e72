package ca.gc.cra.relay.api;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Arguments of one {@code relay} subcommand, split into dash flags and {@code key=value} overrides.
 *
 * <p>{@code -h} and {@code help} fold into {@code --help}; {@code -v} and {@code --debug} fold into
 * {@code --verbose}. Anything with an {@code =} is an override even when it starts with a dash.</p>
 */
public final class CliInput {
  private static final Map<String, String> ALIASES = Map.of(
      "-h", "--help",
      "help", "--help",
      "--help", "--help",
      "-v", "--verbose",
      "--debug", "--verbose",
      "--verbose", "--verbose");

  private final String[] overrides;
  private final Set<String> flags;

  private CliInput(String[] overrides, Set<String> flags) {
    this.overrides = overrides;
    this.flags = flags;
  }

  /**
   * Classifies raw arguments; blank entries are skipped.
   *
   * @param args raw arguments, possibly {@code null}
   * @return parsed arguments
   */
  public static CliInput parse(String[] args) {
    List<String> overrides = new ArrayList<>();
    Set<String> flags = new TreeSet<>();
    for (String raw : args == null ? new String[0] : args) {
      if (raw == null || raw.isBlank()) {
        continue;
      }
      String arg = raw.trim();
      String normalized = arg.toLowerCase(Locale.ROOT);
      String alias = ALIASES.get(normalized);
      if (alias != null) {
        flags.add(alias);
      } else if (normalized.startsWith("-") && normalized.indexOf('=') < 0) {
        flags.add(normalized);
      } else {
        overrides.add(arg);
      }
    }
    return new CliInput(overrides.toArray(new String[0]), Set.copyOf(flags));
  }

  /**
   * Returns the {@code key=value} arguments in command-line order.
   *
   * @return defensive copy
   */
  public String[] keyValueArgs() {
    return Arrays.copyOf(overrides, overrides.length);
  }

  public boolean help() {
    return flags.contains("--help");
  }

  public boolean verbose() {
    return flags.contains("--verbose");
  }

  /**
   * Rejects dash flags other than help and verbose, e.g. a mistyped {@code --dry-run}.
   *
   * @throws IllegalArgumentException naming the first unknown flag
   */
  public void requireKnownFlags() {
    for (String flag : flags) {
      if (!ALIASES.containsValue(flag)) {
        throw new IllegalArgumentException("unknown option: " + flag);
      }
    }
  }
}
