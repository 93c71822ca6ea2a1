package ca.gc.cra.ftrace.api;

import ca.gc.cra.ftrace.logging.LoggingConfigurator;
import java.util.Arrays;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command dispatcher.
 */
public final class Main {
  private static final Logger log = LoggerFactory.getLogger(Main.class);
  private static final String SUMMARY_USAGE = "usage: ftrace <tokenize> [options]";
  private static final String HELP_TEXT = """
      ftrace command dispatcher

      Usage:
        ftrace <command> [options]

      Commands:
        tokenize    Tokenize the ftrace bundles of a trace file (tokenize --help for details)

      Global flags:
        --help      Show this message
        --verbose   Enable DEBUG logging before dispatching
      """;

  private Main() {}

  /**
   * JVM entry point.
   *
   * @param args command followed by its arguments
   */
  public static void main(String[] args) {
    System.exit(run(args).code());
  }

  /**
   * Dispatches to a command and returns its exit code without terminating the JVM.
   *
   * <p>Global flags are honoured only before the command; everything after it belongs to the command.</p>
   *
   * @param args command followed by its arguments
   * @return exit code of the command
   */
  static ExitCode run(String[] args) {
    String[] safeArgs = args == null ? new String[0] : args;
    int commandIndex = 0;
    while (commandIndex < safeArgs.length && isGlobalFlag(safeArgs[commandIndex])) {
      commandIndex++;
    }
    CliInput globals = CliInput.parse(Arrays.copyOfRange(safeArgs, 0, commandIndex));
    if (globals.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for dispatcher");
    }
    if (commandIndex == safeArgs.length) {
      if (globals.help()) {
        CliPrinter.println(HELP_TEXT.stripTrailing());
        return ExitCode.SUCCESS;
      }
      log.error("Missing command");
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    String command = safeArgs[commandIndex].trim().toLowerCase(Locale.ROOT);
    String[] delegateArgs = Arrays.copyOfRange(safeArgs, commandIndex + 1, safeArgs.length);
    return switch (command) {
      case "tokenize" -> TokenizeCli.run(delegateArgs);
      case "help" -> {
        CliPrinter.println(HELP_TEXT.stripTrailing());
        yield ExitCode.SUCCESS;
      }
      default -> {
        log.error("Unknown command: {}", command);
        CliPrinter.println(SUMMARY_USAGE);
        yield ExitCode.INVALID_ARGS;
      }
    };
  }

  private static boolean isGlobalFlag(String arg) {
    return arg == null || arg.isBlank() || arg.trim().startsWith("-");
  }
}
