package ca.gc.cra.flapline.application.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class LatencyRecorderTest {

  @Test
  void emptyRecorderReportsEmptySummary() {
    assertSame(LatencySummary.EMPTY, new LatencyRecorder().summary());
  }

  @Test
  void percentilesUseNearestRank() {
    LatencyRecorder recorder = new LatencyRecorder();
    for (long i = 100; i >= 1; i--) {
      recorder.record(i);
    }

    LatencySummary summary = recorder.summary();
    assertEquals(100L, summary.count());
    assertEquals(50L, summary.p50Micros());
    assertEquals(99L, summary.p99Micros());
    assertEquals(100L, summary.maxMicros());
  }

  @Test
  void negativeSamplesClampToZero() {
    LatencyRecorder recorder = new LatencyRecorder();
    recorder.record(-5L);

    assertEquals(new LatencySummary(1L, 0L, 0L, 0L), recorder.summary());
  }

  @Test
  void countAndMaxStayExactPastTheReservoir() {
    LatencyRecorder recorder = new LatencyRecorder(16);
    for (long i = 0; i < 10_000; i++) {
      recorder.record(i % 10);
    }
    recorder.record(1_000L);

    LatencySummary summary = recorder.summary();
    assertEquals(10_001L, summary.count());
    assertEquals(1_000L, summary.maxMicros());
    assertTrue(summary.p50Micros() <= 9L);
  }

  @Test
  void rejectsEmptyReservoir() {
    assertThrows(IllegalArgumentException.class, () -> new LatencyRecorder(0));
  }
}
