package ca.gc.cra.flapline.api;

import ca.gc.cra.flapline.application.pipeline.LatencySummary;
import ca.gc.cra.flapline.application.pipeline.SessionReport;
import ca.gc.cra.flapline.config.CompositionRoot;
import ca.gc.cra.flapline.config.SessionSettings;
import ca.gc.cra.flapline.logging.LoggingConfigurator;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs one game session and prints its {@link SessionReport}.
 *
 * @since FLAPLINE 0.1
 */
public final class PlayCli {
  private static final Logger log = LoggerFactory.getLogger(PlayCli.class);
  private static final String SUMMARY_USAGE =
      "usage: play [workers=N] [queueCapacity=N] [tickHz=N] [maxTicks=N] "
          + "[input=AUTOPILOT|SCRIPT|PERIODIC] [script=T1,T2,...] [flapEvery=N] [seed=N] "
          + "[realtime=true|false] [config=PATH] [--dry-run] "
          + "[metricsExporter=otlp|none] [otelEndpoint=URL] [otelResourceAttributes=K=V,...]";
  private static final String HELP_TEXT = """
      FLAPLINE play session

      Usage:
        play [options]

      Options (validated):
        workers=N                Worker threads applying commands, 1-64 (default 4)
        queueCapacity=N          0 for unbounded, else >= workers; full channel drops commands (default 0)
        tickHz=N                 Physics ticks per second, 1-1000 (default 60)
        maxTicks=N               Tick limit (default 3600)
        input=MODE               AUTOPILOT, SCRIPT or PERIODIC (default AUTOPILOT)
        script=T1,T2,...         Flap ticks 0-10000000 for input=SCRIPT
        scriptTailTicks=N        Ticks to keep running after the last scripted flap (default 120)
        flapEvery=N              Flap interval for input=PERIODIC (default 20)
        seed=N                   Pipe gap seed (default 42)
        latencyWarnMicros=N      Warn when a command waits longer than this (default 1000)
        realtime=true|false      Pace ticks to wall time (default true)
        daemonWorkers=true|false Run workers as daemon threads (default false)
        config=PATH              YAML file with common/play sections; CLI keys override it
        metricsExporter=otlp|none  Metrics exporter (default otlp)
        otelEndpoint=URL           OTLP metrics endpoint when exporter=otlp
        otelResourceAttributes=K=V Comma-separated OTel resource attributes
        --dry-run                Print the resolved settings without starting threads
        --verbose                Enable DEBUG logging
        --help                   Show this message
      """;

  private PlayCli() {}

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
   * Runs the play command and maps the outcome to an exit code.
   *
   * @param args raw CLI arguments
   * @return exit code capturing the outcome
   */
  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for play CLI");
    }
    if (!input.words().isEmpty()) {
      log.error("Unexpected argument: {}", input.words().get(0));
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    ConfigCliUtils.Resolved resolved = ConfigCliUtils.resolve("play", input, SUMMARY_USAGE, log);
    if (!resolved.ok()) {
      return resolved.failure();
    }
    Map<String, String> effective = resolved.config();
    boolean dryRun = input.hasFlag("--dry-run") || ConfigCliUtils.parseBoolean(effective, "dryRun");

    String metricsExporter;
    SessionSettings settings;
    try {
      metricsExporter = TelemetryConfigurator.configureMetrics(effective);
      settings = SessionSettings.fromMap(effective);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid play arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    if (dryRun) {
      printDryRunPlan(settings, metricsExporter);
      return ExitCode.SUCCESS;
    }

    try (CompositionRoot root = new CompositionRoot()) {
      log.info("Configured play session: input={}, workers={}, metricsExporter={}",
          settings.input(), settings.workers(), metricsExporter);
      SessionReport report = root.gameSessionUseCase(settings).run();
      printReport(report);
      if (!report.teardown().workersQuiesced()) {
        log.error("Session {} ended with workers still running ({})", report.sessionId(), report.teardown());
        return ExitCode.RUNTIME_FAILURE;
      }
      if (report.endReason() == SessionReport.EndReason.INTERRUPTED) {
        return ExitCode.INTERRUPTED;
      }
      return ExitCode.SUCCESS;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure in play session", ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }

  private static void printDryRunPlan(SessionSettings settings, String metricsExporter) {
    CliPrinter.printLines(
        "Play dry-run: no threads will be started.",
        " Input             : " + settings.input()
            + (settings.script().isEmpty() ? "" : " [" + settings.script() + "]"),
        " Workers           : " + settings.workers() + (settings.daemonWorkers() ? " (daemon)" : ""),
        " Queue capacity    : " + (settings.queueCapacity() == 0 ? "unbounded" : settings.queueCapacity()),
        " Tick rate         : " + settings.tickHz() + " Hz" + (settings.realtime() ? "" : " (unpaced)"),
        " Max ticks         : " + settings.maxTicks(),
        " Seed              : " + settings.seed(),
        " Latency warning   : " + settings.latencyWarnMicros() + " us",
        " Metrics exporter  : " + metricsExporter,
        " Re-run without --dry-run to play.");
  }

  private static void printReport(SessionReport report) {
    LatencySummary latency = report.latency();
    CliPrinter.printLines(
        "Session " + report.sessionId() + " finished: " + report.endReason(),
        " Ticks             : " + report.ticks(),
        " Score             : " + report.finalScore() + (report.alive() ? " (alive)" : " (crashed)"),
        " Commands          : submitted=" + report.commandsSubmitted()
            + " applied=" + report.commandsApplied() + " dropped=" + report.commandsDropped(),
        " Latency (us)      : p50=" + latency.p50Micros() + " p99=" + latency.p99Micros()
            + " max=" + latency.maxMicros(),
        " Teardown          : " + report.teardown(),
        " Elapsed           : " + report.elapsed().toMillis() + " ms");
  }
}
