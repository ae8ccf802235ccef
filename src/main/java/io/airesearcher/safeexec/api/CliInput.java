package io.airesearcher.safeexec.api;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Parsed representation of CLI arguments split into flags, key/value pairs and pass-through arguments.
 *
 * <p>Everything after a literal {@code --} is kept verbatim, in order, as pass-through arguments.</p>
 */
public final class CliInput {
  private static final Set<String> HELP_FLAGS = Set.of("--help", "-h", "help");
  private static final Set<String> VERBOSE_FLAGS = Set.of("--verbose", "-v", "--debug");
  private static final String END_OF_OPTIONS = "--";

  private final List<String> keyValueArgs;
  private final Set<String> flags;
  private final List<String> passThrough;
  private final boolean help;
  private final boolean verbose;

  private CliInput(
      List<String> keyValueArgs, Set<String> flags, List<String> passThrough, boolean help, boolean verbose) {
    this.keyValueArgs = List.copyOf(keyValueArgs);
    this.flags = Set.copyOf(flags);
    this.passThrough = List.copyOf(passThrough);
    this.help = help;
    this.verbose = verbose;
  }

  /**
   * Parses raw arguments.
   *
   * @param args raw CLI arguments (may be {@code null})
   * @return parsed representation of the arguments
   */
  public static CliInput parse(String[] args) {
    if (args == null || args.length == 0) {
      return new CliInput(List.of(), Set.of(), List.of(), false, false);
    }

    List<String> kv = new ArrayList<>();
    Set<String> flags = new LinkedHashSet<>();
    List<String> passThrough = new ArrayList<>();
    boolean help = false;
    boolean verbose = false;
    for (int i = 0; i < args.length; i++) {
      String raw = args[i];
      if (raw == null) {
        continue;
      }
      if (raw.equals(END_OF_OPTIONS)) {
        for (int j = i + 1; j < args.length; j++) {
          if (args[j] != null) {
            passThrough.add(args[j]);
          }
        }
        break;
      }
      String arg = raw.trim();
      if (arg.isEmpty()) {
        continue;
      }
      String lower = arg.toLowerCase(Locale.ROOT);
      if (HELP_FLAGS.contains(lower)) {
        help = true;
        flags.add("--help");
        continue;
      }
      if (VERBOSE_FLAGS.contains(lower)) {
        verbose = true;
        flags.add("--verbose");
        continue;
      }
      if (arg.startsWith("-") && !arg.contains("=")) {
        flags.add(lower);
        continue;
      }
      kv.add(arg);
    }
    return new CliInput(kv, flags, passThrough, help, verbose);
  }

  /**
   * Returns the key/value style arguments.
   *
   * @return copy of arguments intended for key=value parsing
   */
  public String[] keyValueArgs() {
    return keyValueArgs.toArray(String[]::new);
  }

  /**
   * Returns the arguments that followed {@code --}, untouched.
   *
   * @return immutable list of pass-through arguments
   */
  public List<String> passThrough() {
    return passThrough;
  }

  /** @return {@code true} if help output was requested */
  public boolean help() {
    return help;
  }

  /** @return {@code true} when --verbose (or equivalent) was present */
  public boolean verbose() {
    return verbose;
  }

  /**
   * Checks whether a normalized flag such as {@code --dry-run} was provided.
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

  /** @return set of normalized flags (lowercase) */
  public Set<String> flags() {
    return flags;
  }
}
