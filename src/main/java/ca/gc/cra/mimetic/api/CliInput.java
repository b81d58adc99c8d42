package ca.gc.cra.mimetic.api;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Command-line tokens sorted into switches ({@code --dry-run}) and positional or {@code key=value}
 * arguments.
 *
 * <p>Aliases such as {@code -h} and {@code --debug} are folded into their canonical switch so callers
 * only test one spelling.</p>
 */
public final class CliInput {
  private static final Map<String, String> ALIASES = Map.of(
      "-h", "--help",
      "help", "--help",
      "-v", "--verbose",
      "--debug", "--verbose",
      "-n", "--dry-run");

  private final List<String> arguments;
  private final Set<String> switches;

  private CliInput(List<String> arguments, Set<String> switches) {
    this.arguments = List.copyOf(arguments);
    this.switches = Set.copyOf(switches);
  }

  /**
   * Splits raw tokens. Blank and {@code null} tokens are ignored.
   *
   * @param args raw arguments; may be {@code null}
   * @return parsed input
   */
  public static CliInput parse(String[] args) {
    List<String> arguments = new ArrayList<>();
    Set<String> switches = new TreeSet<>();
    if (args != null) {
      for (String raw : args) {
        String token = raw == null ? "" : raw.trim();
        if (token.isEmpty()) {
          continue;
        }
        String lower = token.toLowerCase(Locale.ROOT);
        String canonical = ALIASES.getOrDefault(lower, lower);
        if (canonical.startsWith("-") && token.indexOf('=') < 0) {
          switches.add(canonical);
        } else {
          arguments.add(token);
        }
      }
    }
    return new CliInput(arguments, switches);
  }

  /** @return copy of the non-switch arguments, in order */
  public String[] keyValueArgs() {
    return arguments.toArray(String[]::new);
  }

  public boolean help() {
    return switches.contains("--help");
  }

  public boolean verbose() {
    return switches.contains("--verbose");
  }

  public boolean dryRun() {
    return switches.contains("--dry-run");
  }

  /**
   * Tests for a switch using its canonical spelling.
   *
   * @param flag switch such as {@code --dry-run}; case-insensitive
   * @return {@code true} when supplied
   */
  public boolean hasFlag(String flag) {
    if (flag == null || flag.isBlank()) {
      return false;
    }
    String lower = flag.trim().toLowerCase(Locale.ROOT);
    return switches.contains(ALIASES.getOrDefault(lower, lower));
  }

  /** @return every switch supplied, canonicalized and sorted */
  public Set<String> flags() {
    return switches;
  }
}
