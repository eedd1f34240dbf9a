package ca.gc.cra.vartrunc.api;

import ca.gc.cra.vartrunc.logging.LoggingConfigurator;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * VARTRUNC CLI dispatcher that routes to subcommands.
 *
 * @since 0.1.0
 */
public final class Main {
  private static final Logger log = LoggerFactory.getLogger(Main.class);
  private static final String SUMMARY_USAGE = "usage: vartrunc <truncate|offload> [options]";
  private static final String HELP_TEXT = """
      VARTRUNC command dispatcher

      Usage:
        vartrunc <command> [options]

      Commands:
        truncate    Truncate a JSON document to configured limits (truncate --help for details)
        offload     Offload oversized execution payloads to blob storage (offload --help for details)

      Global flags:
        --help      Show this message
        --verbose   Enable DEBUG logging before dispatching to subcommand
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
   * @param args dispatcher arguments (first non-flag token is the subcommand)
   * @return exit code reported by the delegated CLI
   */
  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    Optional<String> command = input.command();
    if (command.isEmpty()) {
      if (input.help()) {
        CliPrinter.println(HELP_TEXT.stripTrailing());
        return ExitCode.SUCCESS;
      }
      log.error("Missing command");
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for dispatcher");
    }

    String[] delegateArgs = input.forwardedArgs();
    return switch (command.get()) {
      case "truncate" -> TruncateCli.run(delegateArgs);
      case "offload" -> OffloadCli.run(delegateArgs);
      default -> {
        log.error("Unknown command: {}", command.get());
        CliPrinter.println(SUMMARY_USAGE);
        yield ExitCode.INVALID_ARGS;
      }
    };
  }
}
