package ca.gc.cra.relay.application.publish;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.relay.application.port.ClockPort;
import ca.gc.cra.relay.application.port.TransportSettings;
import ca.gc.cra.relay.application.port.TransportSettings.ProtocolVersion;
import ca.gc.cra.relay.infrastructure.serialization.json.JsonRecordSerializer;
import ca.gc.cra.relay.testutil.FakeTransportClient;
import ca.gc.cra.relay.testutil.RecordingMetricsPort;
import ca.gc.cra.relay.testutil.TestRecords;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.junit.jupiter.api.Test;

class PublisherConcurrencyTest {
  private static final int PRODUCERS = 8;
  private static final int RECORDS_PER_PRODUCER = 250;

  @Test
  void concurrentWritersAndFlusherLoseNoRecords() throws Exception {
    FakeTransportClient transport = new FakeTransportClient();
    RecordingMetricsPort metrics = new RecordingMetricsPort();
    FrameBuffer buffer = FrameBuffer.allocate(4096, new JsonRecordSerializer(false), ClockPort.SYSTEM);
    ConnectionManager connection = new ConnectionManager(
        "n1",
        new TransportSettings("broker", 1883, "relay-test", 60, ProtocolVersion.V3_1_1, Optional.empty()),
        "collectd",
        0,
        transport,
        ClockPort.SYSTEM,
        metrics);
    Publisher publisher = new Publisher("n1", buffer, connection, ClockPort.SYSTEM, metrics);

    ExecutorService pool = Executors.newFixedThreadPool(PRODUCERS + 1);
    CountDownLatch start = new CountDownLatch(1);
    AtomicBoolean producing = new AtomicBoolean(true);
    List<Future<?>> producers = new ArrayList<>();
    try {
      for (int p = 0; p < PRODUCERS; p++) {
        int producer = p;
        producers.add(pool.submit(() -> {
          start.await();
          for (int i = 0; i < RECORDS_PER_PRODUCER; i++) {
            publisher.write(TestRecords.gauge("p" + producer + "-" + i, i));
            assertTrue(publisher.buffer().filled() <= publisher.buffer().capacity());
          }
          return null;
        }));
      }
      Future<?> flusher = pool.submit(() -> {
        start.await();
        while (producing.get()) {
          publisher.flush(0);
          Thread.sleep(1);
        }
        return null;
      });

      start.countDown();
      for (Future<?> future : producers) {
        future.get(30, TimeUnit.SECONDS);
      }
      producing.set(false);
      flusher.get(30, TimeUnit.SECONDS);
    } finally {
      pool.shutdownNow();
    }
    publisher.flush(0);

    int records = 0;
    for (byte[] batch : transport.published()) {
      String text = new String(batch, StandardCharsets.UTF_8);
      assertTrue(text.startsWith("[") && text.endsWith("]"));
      records += count(text, "\"values\"");
    }
    assertEquals(PRODUCERS * RECORDS_PER_PRODUCER, records);
    assertEquals(1, transport.connectAttempts());
  }

  private static int count(String haystack, String needle) {
    int count = 0;
    for (int i = haystack.indexOf(needle); i >= 0; i = haystack.indexOf(needle, i + 1)) {
      count++;
    }
    return count;
  }
}
