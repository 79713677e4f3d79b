package ca.gc.cra.flapline.api;

import ca.gc.cra.flapline.application.pipeline.ChannelBenchmarkUseCase.BenchmarkResult;
import ca.gc.cra.flapline.config.BenchSettings;
import ca.gc.cra.flapline.config.CompositionRoot;
import ca.gc.cra.flapline.logging.LoggingConfigurator;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the channel hand-off benchmark and prints throughput, latency and delivery counts.
 *
 * @since FLAPLINE 0.1
 */
public final class BenchCli {
  private static final Logger log = LoggerFactory.getLogger(BenchCli.class);
  private static final String SUMMARY_USAGE =
      "usage: bench [workers=N] [commands=N] [queueCapacity=N] [config=PATH] [--dry-run] "
          + "[metricsExporter=otlp|none] [otelEndpoint=URL]";
  private static final String HELP_TEXT = """
      FLAPLINE channel benchmark

      Usage:
        bench [options]

      Options (validated):
        workers=N          Consumer threads, 1-64 (default 8)
        commands=N         Values pushed by the producer, 1-50000000 (default 100000)
        queueCapacity=N    0 for unbounded, else >= workers; full channel drops values (default 0)
        config=PATH        YAML file with common/bench sections; CLI keys override it
        metricsExporter=otlp|none  Metrics exporter (default otlp)
        otelEndpoint=URL           OTLP metrics endpoint when exporter=otlp
        --dry-run          Print the resolved settings without starting threads
        --verbose          Enable DEBUG logging
        --help             Show this message
      """;

  private BenchCli() {}

  /**
   * Entry point invoked by the JVM.
   *
   * @param args raw CLI arguments
   */
  public static void main(String[] args) {
    ExitCode exit = run(args);
    System.exit(exit.code());
  }

  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
    }
    if (!input.words().isEmpty()) {
      log.error("Unexpected argument: {}", input.words().get(0));
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    ConfigCliUtils.Resolved resolved = ConfigCliUtils.resolve("bench", input, SUMMARY_USAGE, log);
    if (!resolved.ok()) {
      return resolved.failure();
    }
    Map<String, String> effective = resolved.config();
    boolean dryRun = input.hasFlag("--dry-run") || ConfigCliUtils.parseBoolean(effective, "dryRun");

    BenchSettings settings;
    try {
      TelemetryConfigurator.configureMetrics(effective);
      settings = BenchSettings.fromMap(effective);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid bench arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    if (dryRun) {
      CliPrinter.printLines(
          "Bench dry-run: no threads will be started.",
          " Workers           : " + settings.workers(),
          " Commands          : " + settings.commands(),
          " Queue capacity    : " + (settings.queueCapacity() == 0 ? "unbounded" : settings.queueCapacity()),
          " Re-run without --dry-run to benchmark.");
      return ExitCode.SUCCESS;
    }

    try (CompositionRoot root = new CompositionRoot()) {
      BenchmarkResult result = root.channelBenchmarkUseCase(settings).run();
      CliPrinter.printLines(
          "Benchmark finished: " + result.teardown(),
          " Commands          : " + result.commands() + " accepted=" + result.accepted()
              + " dropped=" + result.dropped(),
          " Delivery          : duplicates=" + result.duplicates() + " missing=" + result.missing(),
          " Throughput        : " + Math.round(result.throughputPerSecond()) + " cmd/s",
          " Latency (us)      : p50=" + result.latency().p50Micros() + " p99=" + result.latency().p99Micros()
              + " max=" + result.latency().maxMicros(),
          " Elapsed           : " + result.elapsed().toMillis() + " ms");
      if (!result.teardown().workersQuiesced() || result.duplicates() > 0 || result.missing() > 0) {
        return ExitCode.RUNTIME_FAILURE;
      }
      return ExitCode.SUCCESS;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure in benchmark", ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }
}
