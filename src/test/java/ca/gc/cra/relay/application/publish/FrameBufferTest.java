package ca.gc.cra.relay.application.publish;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.relay.application.port.BufferRegion;
import ca.gc.cra.relay.application.port.RecordSerializer;
import ca.gc.cra.relay.domain.error.FramingException;
import ca.gc.cra.relay.domain.metric.MetricRecord;
import ca.gc.cra.relay.infrastructure.serialization.json.JsonRecordSerializer;
import ca.gc.cra.relay.testutil.ManualClock;
import ca.gc.cra.relay.testutil.TestRecords;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.Test;

class FrameBufferTest {
  private final ManualClock clock = new ManualClock(5_000);

  @Test
  void freshBufferHoldsEmptyFraming() throws Exception {
    FrameBuffer buffer = FrameBuffer.allocate(1024, new JsonRecordSerializer(false), clock);

    assertEquals(2, buffer.filled());
    assertEquals(1022, buffer.free());
    assertTrue(buffer.isEffectivelyEmpty());
    assertEquals(5_000, buffer.openedAtMillis());
    assertArrayEquals("[]".getBytes(StandardCharsets.US_ASCII), buffer.payload());
  }

  @Test
  void filledNeverExceedsCapacity() throws Exception {
    FrameBuffer buffer = FrameBuffer.allocate(1024, new JsonRecordSerializer(false), clock);
    int accepted = 0;
    for (int i = 0; i < 100; i++) {
      if (buffer.append(TestRecords.gauge("i" + i, i))) {
        accepted++;
      }
      assertTrue(buffer.filled() <= buffer.capacity());
    }
    assertTrue(accepted > 0 && accepted < 100);
  }

  @Test
  void rejectedAppendLeavesContentUnchanged() throws Exception {
    FrameBuffer buffer = FrameBuffer.allocate(1024, new JsonRecordSerializer(false), clock);
    assertTrue(buffer.append(TestRecords.gauge("idle", 1.0)));
    byte[] before = buffer.payload();

    assertFalse(buffer.append(TestRecords.padded(2_000)));

    assertArrayEquals(before, buffer.payload());
  }

  @Test
  void finalizedBatchIsJsonArrayOfRecords() throws Exception {
    FrameBuffer buffer = FrameBuffer.allocate(1024, new JsonRecordSerializer(false), clock);
    buffer.append(TestRecords.gauge("idle", 1.0));
    buffer.append(TestRecords.gauge("user", 2.0));

    String batch = new String(buffer.finalizeBatch(), StandardCharsets.UTF_8);

    assertTrue(batch.startsWith("[{\"values\":[1.0]"));
    assertTrue(batch.contains("},{\"values\":[2.0]"));
    assertTrue(batch.endsWith("}]"));
  }

  @Test
  void resetRestartsClockAndDropsContent() throws Exception {
    FrameBuffer buffer = FrameBuffer.allocate(1024, new JsonRecordSerializer(false), clock);
    buffer.append(TestRecords.gauge("idle", 1.0));
    clock.advance(3_000);

    buffer.reset();

    assertTrue(buffer.isEffectivelyEmpty());
    assertEquals(8_000, buffer.openedAtMillis());
  }

  @Test
  void dueOnlyAfterTimeoutElapsed() throws Exception {
    FrameBuffer buffer = FrameBuffer.allocate(1024, new JsonRecordSerializer(false), clock);

    assertFalse(buffer.isDue(1_000, 5_999));
    assertTrue(buffer.isDue(1_000, 6_000));
    assertTrue(buffer.isDue(0, 5_000));
  }

  @Test
  void failedFinalizeResetsBuffer() throws Exception {
    FrameBuffer buffer = new FrameBuffer(new BufferRegion(64), new BrokenCloseSerializer(), clock);
    buffer.append(TestRecords.gauge("idle", 1.0));
    assertEquals(3, buffer.filled());

    assertThrows(FramingException.class, buffer::finalizeBatch);

    assertEquals(2, buffer.filled());
  }

  @Test
  void releasedBufferRejectsUse() throws Exception {
    FrameBuffer buffer = FrameBuffer.allocate(1024, new JsonRecordSerializer(false), clock);
    buffer.release();
    buffer.release();

    assertTrue(buffer.isReleased());
    assertThrows(IllegalStateException.class, buffer::reset);
    assertThrows(IllegalStateException.class, () -> buffer.append(TestRecords.gauge("idle", 1.0)));
  }

  @Test
  void capacityBelowEmptyFramingIsRejected() {
    assertThrows(IllegalArgumentException.class,
        () -> FrameBuffer.allocate(1, new JsonRecordSerializer(false), clock));
  }

  /** Writes one byte per record and always fails to close. */
  private static final class BrokenCloseSerializer implements RecordSerializer {
    @Override
    public int emptyFramingSize() {
      return 2;
    }

    @Override
    public void initFraming(BufferRegion region) {
      region.writeAt(0, new byte[] {'<', '>'});
    }

    @Override
    public boolean append(BufferRegion region, MetricRecord record) {
      return region.writeAt(region.filled() - 1, new byte[] {'r', '>'});
    }

    @Override
    public void closeFraming(BufferRegion region) throws FramingException {
      throw new FramingException("corrupt");
    }
  }
}
