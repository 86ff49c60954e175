package ca.gc.cra.geotag.api;

import ca.gc.cra.geotag.logging.LoggingConfigurator;
import java.util.Arrays;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Process entry point dispatching {@code geotag <run|plan>}.
 *
 * @since 0.1.0
 */
public final class Main {
  private static final Logger log = LoggerFactory.getLogger(Main.class);
  private static final String SUMMARY_USAGE = "usage: geotag <run|plan> [options] (geotag --help for details)";

  private Main() {}

  public static void main(String[] args) {
    ExitCode exit = run(args);
    System.exit(exit.code());
  }

  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
    }
    String[] remainder = input.keyValueArgs();
    if (remainder.length == 0) {
      if (input.help()) {
        CliPrinter.println(GeotagCli.HELP_TEXT.stripTrailing());
        return ExitCode.SUCCESS;
      }
      log.error("Missing command");
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    String command = remainder[0].toLowerCase(Locale.ROOT);
    String[] delegateArgs = Arrays.copyOfRange(args, indexOf(args, remainder[0]) + 1, args.length);
    return switch (command) {
      case "run", "plan" -> GeotagCli.run(command, delegateArgs);
      default -> {
        log.error("Unknown command: {}", command);
        CliPrinter.println(SUMMARY_USAGE);
        yield ExitCode.INVALID_ARGS;
      }
    };
  }

  private static int indexOf(String[] args, String command) {
    for (int i = 0; i < args.length; i++) {
      if (args[i] != null && args[i].trim().equals(command)) {
        return i;
      }
    }
    return -1;
  }
}
