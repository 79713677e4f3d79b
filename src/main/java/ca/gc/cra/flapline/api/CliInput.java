package ca.gc.cra.flapline.api;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * CLI arguments split into flags, {@code key=value} pairs and bare words.
 *
 * <p>Bare words (no {@code '='} and no leading dash) are kept in order; the dispatcher uses the first one as
 * the subcommand.</p>
 */
public final class CliInput {
  private static final Set<String> HELP_FLAGS = Set.of("--help", "-h", "help");
  private static final Set<String> VERBOSE_FLAGS = Set.of("--verbose", "-v", "--debug");

  private final List<String> words;
  private final String[] keyValueArgs;
  private final Set<String> flags;

  private CliInput(List<String> words, String[] keyValueArgs, Set<String> flags) {
    this.words = words;
    this.keyValueArgs = keyValueArgs;
    this.flags = flags;
  }

  /**
   * Parses raw arguments.
   *
   * @param args raw arguments (may be {@code null})
   * @return parsed arguments
   */
  public static CliInput parse(String[] args) {
    List<String> words = new ArrayList<>();
    List<String> kv = new ArrayList<>();
    Set<String> flags = new LinkedHashSet<>();
    if (args != null) {
      for (String raw : args) {
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
        } else if (arg.contains("=")) {
          kv.add(arg);
        } else {
          words.add(arg);
        }
      }
    }
    return new CliInput(List.copyOf(words), kv.toArray(String[]::new), Set.copyOf(flags));
  }

  /**
   * Returns a copy of the {@code key=value} arguments.
   *
   * @return arguments for {@link CliArgsParser#toMap(String[])}
   */
  public String[] keyValueArgs() {
    return Arrays.copyOf(keyValueArgs, keyValueArgs.length);
  }

  /**
   * Returns bare words in argument order.
   *
   * @return immutable list of words
   */
  public List<String> words() {
    return words;
  }

  /**
   * Indicates whether help was requested.
   *
   * @return {@code true} for {@code --help}, {@code -h} or {@code help}
   */
  public boolean help() {
    return flags.contains("--help");
  }

  /**
   * Indicates whether verbose logging was requested.
   *
   * @return {@code true} for {@code --verbose}, {@code -v} or {@code --debug}
   */
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
    if (flag == null || flag.isBlank()) {
      return false;
    }
    return flags.contains(flag.trim().toLowerCase(Locale.ROOT));
  }

  /**
   * Returns every normalized flag.
   *
   * @return lowercase flags
   */
  public Set<String> flags() {
    return flags;
  }
}
