package ca.gc.cra.flapline.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.flapline.testutil.LogCapture;
import ch.qos.logback.classic.Level;
import java.io.PrintWriter;
import java.io.StringWriter;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class MainTest {
  private final StringWriter buffer = new StringWriter();
  private LogCapture logs;

  @BeforeEach
  void setUp() {
    CliPrinter.setWriterForTesting(new PrintWriter(buffer));
    logs = LogCapture.attach(Main.class);
  }

  @AfterEach
  void tearDown() {
    logs.close();
    CliPrinter.clearTestWriter();
    System.clearProperty("otel.metrics.exporter");
  }

  @Test
  void helpWithoutCommandPrintsOverview() {
    assertEquals(ExitCode.SUCCESS, Main.run(new String[] {"--help"}));
    assertTrue(buffer.toString().contains("FLAPLINE command dispatcher"));
  }

  @Test
  void missingCommandPrintsUsage() {
    assertEquals(ExitCode.INVALID_ARGS, Main.run(new String[0]));
    assertTrue(buffer.toString().contains(Main.SUMMARY_USAGE));
    assertTrue(logs.contains(Level.ERROR, "Missing command"));
  }

  @Test
  void unknownCommandPrintsUsage() {
    assertEquals(ExitCode.INVALID_ARGS, Main.run(new String[] {"replay"}));
    assertTrue(buffer.toString().contains(Main.SUMMARY_USAGE));
    assertTrue(logs.contains(Level.ERROR, "Unknown command: replay"));
  }

  @Test
  void delegatesFlagsToSubcommand() {
    ExitCode code = Main.run(new String[] {"play", "--dry-run", "workers=3", "metricsExporter=none"});

    assertEquals(ExitCode.SUCCESS, code);
    assertTrue(buffer.toString().contains("Play dry-run: no threads will be started."));
    assertTrue(buffer.toString().contains(" Workers           : 3"));
  }

  @Test
  void helpAfterCommandShowsCommandHelp() {
    assertEquals(ExitCode.SUCCESS, Main.run(new String[] {"bench", "--help"}));
    assertTrue(buffer.toString().contains("FLAPLINE channel benchmark"));
  }
}
