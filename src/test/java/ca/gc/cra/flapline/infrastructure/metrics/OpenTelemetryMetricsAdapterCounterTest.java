package ca.gc.cra.flapline.infrastructure.metrics;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.sdk.metrics.data.LongPointData;
import io.opentelemetry.sdk.metrics.data.MetricData;
import io.opentelemetry.sdk.metrics.data.MetricDataType;
import io.opentelemetry.sdk.testing.exporter.InMemoryMetricReader;
import java.util.Collection;
import java.util.Optional;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class OpenTelemetryMetricsAdapterCounterTest {
  private InMemoryMetricReader reader;
  private OpenTelemetryMetricsAdapter adapter;

  @BeforeEach
  void setUp() {
    reader = InMemoryMetricReader.create();
    adapter = new OpenTelemetryMetricsAdapter(OpenTelemetryBootstrap.forTesting(reader));
  }

  @AfterEach
  void tearDown() {
    if (adapter != null) {
      adapter.close();
    }
  }

  @Test
  void incrementAndAddAccumulateOnOneCounter() {
    adapter.increment("channel.submit.accepted");
    adapter.increment("channel.submit.accepted");
    adapter.add("channel.submit.accepted", 5L);
    adapter.forceFlush();

    Collection<MetricData> metrics = reader.collectAllMetrics();
    Optional<MetricData> maybeCounter = metrics.stream()
        .filter(metric -> metric.getName().equals("channel.submit.accepted"))
        .findFirst();
    assertTrue(maybeCounter.isPresent(), "Expected counter metric to be exported");

    MetricData counter = maybeCounter.orElseThrow();
    assertEquals(MetricDataType.LONG_SUM, counter.getType());
    LongPointData point = counter.getLongSumData().getPoints().iterator().next();
    assertEquals(7L, point.getValue());
    assertEquals("channel.submit.accepted",
        point.getAttributes().get(AttributeKey.stringKey("flapline.metric.key")));

    assertEquals("flapline", counter.getResource().getAttribute(AttributeKey.stringKey("service.name")));
    assertEquals("ca.gc.cra", counter.getResource().getAttribute(AttributeKey.stringKey("service.namespace")));
    String instance = counter.getResource().getAttribute(AttributeKey.stringKey("service.instance.id"));
    assertTrue(instance != null && !instance.isBlank(), "Service instance id should be provided");
  }

  @Test
  void unusualKeysAreSanitizedButKeptAsAttribute() {
    adapter.increment("Pool Worker/Failed");

    MetricData counter = reader.collectAllMetrics().stream()
        .filter(metric -> metric.getName().equals("pool_worker_failed"))
        .findFirst()
        .orElseThrow();
    LongPointData point = counter.getLongSumData().getPoints().iterator().next();
    assertEquals("Pool Worker/Failed", point.getAttributes().get(AttributeKey.stringKey("flapline.metric.key")));
  }

  @Test
  void negativeDeltaIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> adapter.add("session.tick.count", -1L));
  }
}
