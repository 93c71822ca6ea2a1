package ca.gc.cra.ftrace.api;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Command-line arguments split into {@code key=value} pairs and flags.
 *
 * <p>Help aliases ({@code --help}, {@code -h}, {@code help}) normalize to {@code --help}; verbose aliases
 * ({@code --verbose}, {@code -v}, {@code --debug}) normalize to {@code --verbose}. Other flags are lower-cased.</p>
 *
 * @param keyValueArgs arguments that are not flags, in order
 * @param flags normalized flags
 */
record CliInput(List<String> keyValueArgs, Set<String> flags) {
  private static final Set<String> HELP_ALIASES = Set.of("--help", "-h", "help");
  private static final Set<String> VERBOSE_ALIASES = Set.of("--verbose", "-v", "--debug");

  CliInput {
    keyValueArgs = List.copyOf(keyValueArgs);
    flags = Set.copyOf(flags);
  }

  /**
   * Parses raw arguments; {@code null} and blank entries are ignored.
   *
   * @param args raw arguments, may be {@code null}
   * @return parsed input
   */
  static CliInput parse(String[] args) {
    List<String> kv = new ArrayList<>();
    Set<String> flags = new LinkedHashSet<>();
    if (args != null) {
      for (String raw : args) {
        String arg = raw == null ? "" : raw.trim();
        if (arg.isEmpty()) {
          continue;
        }
        String lower = arg.toLowerCase(Locale.ROOT);
        if (HELP_ALIASES.contains(lower)) {
          flags.add("--help");
        } else if (VERBOSE_ALIASES.contains(lower)) {
          flags.add("--verbose");
        } else if (arg.startsWith("-") && arg.indexOf('=') < 0) {
          flags.add(lower);
        } else {
          kv.add(arg);
        }
      }
    }
    return new CliInput(kv, flags);
  }

  boolean help() {
    return flags.contains("--help");
  }

  boolean verbose() {
    return flags.contains("--verbose");
  }

  boolean hasFlag(String flag) {
    return flag != null && flags.contains(flag.trim().toLowerCase(Locale.ROOT));
  }
}
