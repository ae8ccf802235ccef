package io.airesearcher.safeexec.api;

import io.airesearcher.safeexec.logging.LoggingConfigurator;
import java.util.Arrays;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * SafeExec CLI dispatcher that routes to subcommands.
 *
 * <p>Global flags are only recognized before the command name; everything after it, including any
 * {@code --} separator, is handed to the subcommand unchanged.</p>
 *
 * @since 0.1.0
 */
public final class Main {
  private static final Logger log = LoggerFactory.getLogger(Main.class);
  private static final String SUMMARY_USAGE =
      "usage: safeexec <clone|checkout|compile|script> [options]";
  private static final String HELP_TEXT = """
      SafeExec command dispatcher

      Usage:
        safeexec <command> [options]

      Commands:
        clone       Clone a repository (clone --help for details)
        checkout    Check out a branch in an existing repository
        compile     Compile a LaTeX document with shell escape disabled
        script      Run an interpreter script with verbatim arguments

      Global flags:
        --help      Show this message
        --verbose   Enable DEBUG logging before dispatching to subcommand

      Exit codes:
        0 success, 2 invalid input, 3 I/O error, 4 configuration error, 5 runtime failure,
        6 command failed, 124 timeout, 130 interrupted
      """;

  private Main() {}

  /**
   * Entry point invoked by the JVM.
   *
   * @param args raw CLI arguments
   */
  public static void main(String[] args) {
    ExitCode exit = run(args);
    System.exit(exit.code());
  }

  /**
   * Dispatches a subcommand and returns its exit code without terminating the JVM.
   *
   * @param args dispatcher arguments; the first non-flag token is the subcommand
   * @return exit code reported by the delegated CLI
   */
  static ExitCode run(String[] args) {
    String[] raw = args == null ? new String[0] : args;
    int commandIndex = 0;
    while (commandIndex < raw.length && (raw[commandIndex] == null || raw[commandIndex].startsWith("-"))) {
      commandIndex++;
    }
    CliInput globals = CliInput.parse(Arrays.copyOfRange(raw, 0, commandIndex));
    if (globals.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (globals.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for dispatcher");
    }
    if (commandIndex >= raw.length) {
      log.error("Missing command");
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    String command = raw[commandIndex].trim().toLowerCase(Locale.ROOT);
    String[] delegateArgs = Arrays.copyOfRange(raw, commandIndex + 1, raw.length);

    return switch (command) {
      case "clone" -> CloneCli.run(delegateArgs);
      case "checkout" -> CheckoutCli.run(delegateArgs);
      case "compile" -> CompileCli.run(delegateArgs);
      case "script" -> ScriptCli.run(delegateArgs);
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
}
