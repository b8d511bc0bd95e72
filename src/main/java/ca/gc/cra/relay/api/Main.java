package ca.gc.cra.relay.api;

import ca.gc.cra.relay.logging.LoggingConfigurator;
import java.util.Arrays;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * RELAY command dispatcher.
 *
 * @since 0.1.0
 */
public final class Main {
  private static final Logger log = LoggerFactory.getLogger(Main.class);
  private static final String SUMMARY_USAGE = "usage: relay <run|check> [options]";
  private static final String HELP_TEXT = """
      RELAY buffered MQTT publisher

      Usage:
        relay <command> [options]

      Commands:
        run     Publish NDJSON records from stdin (run --help for details)
        check   Validate a configuration file and print the plan

      Global flags:
        --help      Show this message
        --verbose   Enable DEBUG logging
      """;

  private Main() {}

  /**
   * JVM entry point.
   *
   * @param args raw arguments
   */
  public static void main(String[] args) {
    System.exit(run(args).code());
  }

  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    String[] remainder = input.keyValueArgs();
    if (remainder.length == 0) {
      if (input.help()) {
        CliPrinter.out(HELP_TEXT.stripTrailing());
        return ExitCode.SUCCESS;
      }
      log.error("Missing command");
      CliPrinter.err(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
    }

    String command = remainder[0].toLowerCase(Locale.ROOT);
    String[] delegateArgs = Arrays.copyOfRange(args, indexOf(args, remainder[0]) + 1, args.length);
    return switch (command) {
      case "run" -> RunCli.run(delegateArgs);
      case "check" -> CheckCli.run(delegateArgs);
      default -> {
        log.error("Unknown command: {}", command);
        CliPrinter.err(SUMMARY_USAGE);
        yield ExitCode.INVALID_ARGS;
      }
    };
  }

  private static int indexOf(String[] args, String token) {
    for (int i = 0; i < args.length; i++) {
      if (args[i] != null && args[i].trim().equals(token)) {
        return i;
      }
    }
    return -1;
  }
}
