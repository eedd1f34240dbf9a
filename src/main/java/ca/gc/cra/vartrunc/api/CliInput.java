package ca.gc.cra.vartrunc.api;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Command-line arguments split into bare words, {@code key=value} pairs and dash flags.
 *
 * <p>The dispatcher reads the first bare word as the command and forwards the rest; subcommands accept no bare
 * words at all. Help and verbose aliases are normalized to {@code --help} and {@code --verbose}.</p>
 *
 * @since 0.1.0
 */
public final class CliInput {
  private static final Set<String> HELP_ALIASES = Set.of("--help", "-h", "help");
  private static final Set<String> VERBOSE_ALIASES = Set.of("--verbose", "-v", "--debug");

  private final List<String> words;
  private final List<String> pairs;
  private final Set<String> flags;

  private CliInput(List<String> words, List<String> pairs, Set<String> flags) {
    this.words = List.copyOf(words);
    this.pairs = List.copyOf(pairs);
    this.flags = Set.copyOf(flags);
  }

  /**
   * Classifies each argument; {@code null} and blank arguments are skipped.
   *
   * @param args raw arguments, may be {@code null}
   * @return classified arguments
   */
  public static CliInput parse(String[] args) {
    List<String> words = new ArrayList<>();
    List<String> pairs = new ArrayList<>();
    Set<String> flags = new LinkedHashSet<>();
    if (args != null) {
      for (String raw : args) {
        String arg = raw == null ? "" : raw.trim();
        String lower = arg.toLowerCase(Locale.ROOT);
        if (arg.isEmpty()) {
          continue;
        } else if (HELP_ALIASES.contains(lower)) {
          flags.add("--help");
        } else if (VERBOSE_ALIASES.contains(lower)) {
          flags.add("--verbose");
        } else if (arg.contains("=")) {
          pairs.add(arg);
        } else if (arg.startsWith("-")) {
          flags.add(lower);
        } else {
          words.add(arg);
        }
      }
    }
    return new CliInput(words, pairs, flags);
  }

  /**
   * Returns the command named by the first bare word, lower-cased.
   *
   * @return command or empty when only pairs and flags were given
   */
  public Optional<String> command() {
    return words.isEmpty() ? Optional.empty() : Optional.of(words.get(0).toLowerCase(Locale.ROOT));
  }

  /**
   * Returns the bare words in order, the command included.
   *
   * @return immutable list of bare words
   */
  public List<String> words() {
    return words;
  }

  /**
   * Returns the {@code key=value} arguments in order.
   *
   * @return arguments for {@link CliArgsParser#toMap(String[])}
   */
  public String[] keyValueArgs() {
    return pairs.toArray(String[]::new);
  }

  /**
   * Returns every argument except the command, for handing to a subcommand.
   *
   * @return remaining bare words, then pairs, then normalized flags
   */
  public String[] forwardedArgs() {
    List<String> forwarded = new ArrayList<>(words.subList(Math.min(1, words.size()), words.size()));
    forwarded.addAll(pairs);
    forwarded.addAll(flags);
    return forwarded.toArray(String[]::new);
  }

  /**
   * Fails when bare words were supplied to a command that takes only pairs and flags.
   *
   * @throws IllegalArgumentException naming the first unexpected word
   */
  public void requireNoWords() {
    if (!words.isEmpty()) {
      throw new IllegalArgumentException("unexpected argument '" + words.get(0) + "'");
    }
  }

  public boolean help() {
    return flags.contains("--help");
  }

  public boolean verbose() {
    return flags.contains("--verbose");
  }

  /**
   * Checks for a flag, ignoring case and surrounding blanks.
   *
   * @param flag flag such as {@code --dry-run}
   * @return {@code true} if supplied
   */
  public boolean hasFlag(String flag) {
    return flag != null && flags.contains(flag.trim().toLowerCase(Locale.ROOT));
  }

  /**
   * Returns the normalized flags.
   *
   * @return immutable set of lower-case flags
   */
  public Set<String> flags() {
    return flags;
  }
}
