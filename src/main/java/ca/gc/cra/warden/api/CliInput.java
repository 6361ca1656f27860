package ca.gc.cra.warden.api;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Parsed representation of CLI arguments split into {@code --flags} and {@code key=value} pairs.
 */
public final class CliInput {
  private static final Set<String> HELP_FLAGS = Set.of("--help", "-h", "help");
  private static final Set<String> VERBOSE_FLAGS = Set.of("--verbose", "-v", "--debug");

  private final String[] keyValueArgs;
  private final Set<String> flags;
  private final boolean help;
  private final boolean verbose;

  private CliInput(String[] keyValueArgs, Set<String> flags, boolean help, boolean verbose) {
    this.keyValueArgs = keyValueArgs;
    this.flags = flags;
    this.help = help;
    this.verbose = verbose;
  }

  /**
   * Parses raw arguments. Tokens starting with {@code -} and lacking {@code =} are flags; the rest are
   * key/value arguments (or, for the dispatcher, the command name).
   *
   * @param args raw CLI arguments (may be {@code null})
   * @return parsed representation of the arguments
   */
  public static CliInput parse(String[] args) {
    if (args == null || args.length == 0) {
      return new CliInput(new String[0], Set.of(), false, false);
    }
    List<String> positional = new ArrayList<>();
    Set<String> flags = new LinkedHashSet<>();
    boolean help = false;
    boolean verbose = false;
    for (String raw : args) {
      if (raw == null || raw.isBlank()) {
        continue;
      }
      String arg = raw.trim();
      String lower = arg.toLowerCase(Locale.ROOT);
      if (HELP_FLAGS.contains(lower)) {
        help = true;
      } else if (VERBOSE_FLAGS.contains(lower)) {
        verbose = true;
      } else if (arg.startsWith("-") && arg.indexOf('=') < 0) {
        flags.add(lower);
      } else {
        positional.add(arg);
      }
    }
    return new CliInput(positional.toArray(String[]::new), Set.copyOf(flags), help, verbose);
  }

  /**
   * Returns a copy of the non-flag arguments.
   *
   * @return arguments intended for key=value parsing
   */
  public String[] keyValueArgs() {
    return Arrays.copyOf(keyValueArgs, keyValueArgs.length);
  }

  /**
   * Indicates whether a help flag was supplied.
   *
   * @return {@code true} if help output was requested
   */
  public boolean help() {
    return help;
  }

  /**
   * Indicates whether verbose logging was requested.
   *
   * @return {@code true} when --verbose (or equivalent) was present
   */
  public boolean verbose() {
    return verbose;
  }

  /**
   * Checks whether a flag such as {@code --dry-run} was provided.
   *
   * @param flag flag to query (case-insensitive)
   * @return {@code true} if the flag was supplied
   */
  public boolean hasFlag(String flag) {
    if (flag == null || flag.isBlank()) {
      return false;
    }
    return flags.contains(flag.trim().toLowerCase(Locale.ROOT));
  }

  /**
   * Returns the supplied flags that a command does not understand.
   *
   * @param accepted flags the command recognizes (lowercase)
   * @return unknown flags in command-line order; empty when all are recognized
   */
  public List<String> unknownFlags(Set<String> accepted) {
    List<String> unknown = new ArrayList<>();
    for (String flag : flags) {
      if (!accepted.contains(flag)) {
        unknown.add(flag);
      }
    }
    return unknown;
  }

  /**
   * Writes {@code true} under the mapped configuration key for every flag present, so that flags take
   * part in CLI-over-YAML precedence like any {@code key=value} argument.
   *
   * @param target CLI key/value map to update
   * @param flagToKey mapping from flag (lowercase) to configuration key
   */
  public void applyFlags(Map<String, String> target, Map<String, String> flagToKey) {
    for (Map.Entry<String, String> entry : flagToKey.entrySet()) {
      if (flags.contains(entry.getKey())) {
        target.put(entry.getValue(), "true");
      }
    }
  }
}
