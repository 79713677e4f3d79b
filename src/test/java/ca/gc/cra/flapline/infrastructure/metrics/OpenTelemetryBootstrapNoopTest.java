package ca.gc.cra.flapline.infrastructure.metrics;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class OpenTelemetryBootstrapNoopTest {
  private String previousExporter;

  @BeforeEach
  void disableExporter() {
    previousExporter = System.getProperty("otel.metrics.exporter");
    System.setProperty("otel.metrics.exporter", "none");
  }

  @AfterEach
  void restoreExporter() {
    if (previousExporter == null) {
      System.clearProperty("otel.metrics.exporter");
    } else {
      System.setProperty("otel.metrics.exporter", previousExporter);
    }
  }

  @Test
  void exporterNoneYieldsNoopHandle() {
    OpenTelemetryBootstrap.Handle handle = OpenTelemetryBootstrap.initialize();

    assertTrue(handle.isNoop());
    assertDoesNotThrow(handle::forceFlush);
    assertDoesNotThrow(handle::close);
  }

  @Test
  void noopAdapterAcceptsUpdates() {
    try (OpenTelemetryMetricsAdapter adapter = new OpenTelemetryMetricsAdapter()) {
      assertDoesNotThrow(() -> adapter.increment("pool.worker.started"));
      assertDoesNotThrow(() -> adapter.observe("bench.handoff.latencyMicros", 12L));
      adapter.forceFlush();
    }
  }

  @Test
  void sanitizeNameLowercasesAndReplacesIllegalCharacters() {
    assertEquals("session.tick.count", OpenTelemetryMetricsAdapter.sanitizeName("session.tick.count"));
    assertEquals("m9lives", OpenTelemetryMetricsAdapter.sanitizeName("9lives"));
    assertEquals("a_b", OpenTelemetryMetricsAdapter.sanitizeName("A b"));
    assertEquals("flapline.metric", OpenTelemetryMetricsAdapter.sanitizeName(" "));
  }
}
