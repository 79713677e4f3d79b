package ca.gc.cra.flapline.api;

import ca.gc.cra.flapline.logging.LoggingConfigurator;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * FLAPLINE CLI dispatcher.
 *
 * @since FLAPLINE 0.1
 */
public final class Main {
  private static final Logger log = LoggerFactory.getLogger(Main.class);
  static final String SUMMARY_USAGE = "usage: flapline <play|bench> [options]";
  private static final String HELP_TEXT = """
      FLAPLINE command dispatcher

      Usage:
        flapline <command> [options]

      Commands:
        play        Run a game session through the command channel and worker pool
        bench       Measure channel hand-off throughput and latency

      Global flags:
        --help      Show this message (or the command's help when placed after it)
        --verbose   Enable DEBUG logging
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
   * Dispatches to a subcommand without terminating the JVM.
   *
   * @param args dispatcher arguments; the first bare word is the subcommand
   * @return exit code reported by the subcommand
   */
  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.words().isEmpty()) {
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

    String commandWord = input.words().get(0);
    String[] delegateArgs = withoutFirst(args, commandWord);
    return switch (commandWord.toLowerCase(Locale.ROOT)) {
      case "play" -> PlayCli.run(delegateArgs);
      case "bench" -> BenchCli.run(delegateArgs);
      default -> {
        log.error("Unknown command: {}", commandWord);
        CliPrinter.println(SUMMARY_USAGE);
        yield ExitCode.INVALID_ARGS;
      }
    };
  }

  private static String[] withoutFirst(String[] args, String word) {
    List<String> remaining = new ArrayList<>(args.length);
    boolean removed = false;
    for (String arg : args) {
      if (!removed && arg != null && arg.trim().equals(word)) {
        removed = true;
        continue;
      }
      remaining.add(arg);
    }
    return remaining.toArray(String[]::new);
  }
}
