package ca.gc.cra.mimetic.api;

import ca.gc.cra.mimetic.logging.LoggingConfigurator;
import java.util.Arrays;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * MIMETIC command dispatcher.
 *
 * @since 0.1.0
 */
public final class Main {
  private static final Logger log = LoggerFactory.getLogger(Main.class);
  private static final String SUMMARY_USAGE = "usage: mimetic <run|calibrate> [options]";
  private static final String HELP_TEXT = """
      MIMETIC: camera-driven motion mimicry for desktop robots

      Usage:
        mimetic <command> [options]

      Commands:
        run         Track the user and drive the actuators (run --help for details)
        calibrate   Measure the neutral head pose and print it

      Global flags:
        --help      Show this message
        --verbose   Enable DEBUG logging before dispatching
      """;

  private Main() {}

  public static void main(String[] args) {
    ExitCode exit = run(args);
    System.exit(exit.code());
  }

  /**
   * Dispatches to a command and returns its exit code.
   *
   * @param args first token is the command name
   * @return exit code of the command
   */
  static ExitCode run(String[] args) {
    String[] tokens = args == null ? new String[0] : args;
    int commandIndex = firstCommandIndex(tokens);
    if (commandIndex < 0) {
      CliInput input = CliInput.parse(tokens);
      if (input.help()) {
        CliPrinter.println(HELP_TEXT.stripTrailing());
        return ExitCode.SUCCESS;
      }
      log.error("Missing command");
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    String command = tokens[commandIndex].trim().toLowerCase(Locale.ROOT);
    String[] delegateArgs = new String[tokens.length - 1];
    System.arraycopy(tokens, 0, delegateArgs, 0, commandIndex);
    System.arraycopy(tokens, commandIndex + 1, delegateArgs, commandIndex, tokens.length - commandIndex - 1);
    if (CliInput.parse(Arrays.copyOf(tokens, commandIndex)).verbose()) {
      LoggingConfigurator.enableVerboseLogging();
    }

    return switch (command) {
      case "run" -> RunCli.run(delegateArgs);
      case "calibrate" -> CalibrateCli.run(delegateArgs);
      default -> {
        log.error("Unknown command: {}", command);
        CliPrinter.println(SUMMARY_USAGE);
        yield ExitCode.INVALID_ARGS;
      }
    };
  }

  /** Index of the first token that is neither a switch nor a {@code key=value} option. */
  private static int firstCommandIndex(String[] tokens) {
    for (int i = 0; i < tokens.length; i++) {
      String token = tokens[i] == null ? "" : tokens[i].trim();
      if (!token.isEmpty() && !token.startsWith("-") && token.indexOf('=') < 0
          && !token.equalsIgnoreCase("help")) {
        return i;
      }
    }
    return -1;
  }
}
