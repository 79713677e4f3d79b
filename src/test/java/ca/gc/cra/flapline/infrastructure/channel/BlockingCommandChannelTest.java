package ca.gc.cra.flapline.infrastructure.channel;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.flapline.application.port.MetricsPort;
import ca.gc.cra.flapline.testutil.LogCapture;
import ca.gc.cra.flapline.testutil.RecordingMetricsPort;
import ch.qos.logback.classic.Level;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

class BlockingCommandChannelTest {

  @Test
  void singleConsumerSeesSubmissionOrder() throws Exception {
    BlockingCommandChannel<Integer> channel = new BlockingCommandChannel<>("fifo");
    for (int i = 0; i < 5; i++) {
      channel.submit(i);
    }
    channel.stop();

    List<Integer> seen = new ArrayList<>();
    Optional<Integer> next;
    while ((next = channel.take()).isPresent()) {
      seen.add(next.get());
    }

    assertEquals(List.of(0, 1, 2, 3, 4), seen);
  }

  @Test
  void stopDrainsPendingValuesBeforeSignallingEnd() throws Exception {
    BlockingCommandChannel<String> channel = new BlockingCommandChannel<>("drain");
    channel.submit("a");
    channel.submit("b");
    channel.stop();

    assertTrue(channel.isStopped());
    assertEquals(Optional.of("a"), channel.take());
    assertEquals(Optional.of("b"), channel.take());
    assertEquals(Optional.empty(), channel.take());
    assertEquals(Optional.empty(), channel.take(), "end signal is sticky");
  }

  @Test
  void submitAfterStopIsDiscardedAndCounted() throws Exception {
    RecordingMetricsPort metrics = new RecordingMetricsPort();
    BlockingCommandChannel<String> channel =
        new BlockingCommandChannel<>("late", BlockingCommandChannel.UNBOUNDED, metrics);
    channel.stop();
    channel.stop();

    channel.submit("ignored");

    assertEquals(0, channel.size());
    assertEquals(1, channel.afterStopCount());
    assertEquals(1, metrics.count("channel.submit.afterStop"));
    assertEquals(Optional.empty(), channel.take());
  }

  @Test
  void stopReleasesEveryBlockedTaker() throws Exception {
    BlockingCommandChannel<Integer> channel = new BlockingCommandChannel<>("release");
    int takers = 6;
    CountDownLatch started = new CountDownLatch(takers);
    CountDownLatch released = new CountDownLatch(takers);
    AtomicInteger emptyResults = new AtomicInteger();
    List<Thread> threads = new ArrayList<>();
    for (int i = 0; i < takers; i++) {
      Thread thread = new Thread(() -> {
        started.countDown();
        try {
          if (channel.take().isEmpty()) {
            emptyResults.incrementAndGet();
          }
        } catch (InterruptedException ex) {
          Thread.currentThread().interrupt();
        } finally {
          released.countDown();
        }
      });
      thread.start();
      threads.add(thread);
    }
    assertTrue(started.await(5, TimeUnit.SECONDS));
    Thread.sleep(50);

    channel.stop();

    assertTrue(released.await(5, TimeUnit.SECONDS), "stop() must wake all takers");
    assertEquals(takers, emptyResults.get());
    for (Thread thread : threads) {
      thread.join(1_000);
    }
  }

  @Test
  void blockedTakerReceivesLaterSubmission() throws Exception {
    BlockingCommandChannel<String> channel = new BlockingCommandChannel<>("handoff");
    List<String> received = new ArrayList<>();
    Thread taker = new Thread(() -> {
      try {
        channel.take().ifPresent(received::add);
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
      }
    });
    taker.start();
    Thread.sleep(50);

    channel.submit("flap");
    taker.join(5_000);

    assertFalse(taker.isAlive());
    assertEquals(List.of("flap"), received);
  }

  @Test
  void takeHonoursInterrupt() throws Exception {
    BlockingCommandChannel<String> channel = new BlockingCommandChannel<>("interrupt");
    AtomicInteger interrupted = new AtomicInteger();
    Thread taker = new Thread(() -> {
      try {
        channel.take();
      } catch (InterruptedException ex) {
        interrupted.incrementAndGet();
      }
    });
    taker.start();
    Thread.sleep(50);

    taker.interrupt();
    taker.join(5_000);

    assertEquals(1, interrupted.get());
  }

  @Test
  void boundedChannelDropsWhenFull() {
    RecordingMetricsPort metrics = new RecordingMetricsPort();
    BlockingCommandChannel<Integer> channel = new BlockingCommandChannel<>("bounded", 2, metrics);

    try (LogCapture logs = LogCapture.attach(BlockingCommandChannel.class)) {
      channel.submit(1);
      channel.submit(2);
      channel.submit(3);

      assertEquals(2, channel.size());
      assertEquals(2, channel.acceptedCount());
      assertEquals(1, channel.droppedCount());
      assertEquals(1, metrics.count("channel.submit.dropped"));
      assertEquals(List.of(1L, 2L), metrics.observed("channel.depth"));
      assertTrue(logs.contains(Level.WARN, "bounded full"));
    }
  }

  @Test
  void rejectsNullValuesAndBadConstruction() {
    BlockingCommandChannel<String> channel = new BlockingCommandChannel<>("nulls");
    assertThrows(NullPointerException.class, () -> channel.submit(null));
    assertThrows(IllegalArgumentException.class, () -> new BlockingCommandChannel<String>(" "));
    assertThrows(IllegalArgumentException.class,
        () -> new BlockingCommandChannel<String>("neg", -1, MetricsPort.NO_OP));
  }
}
