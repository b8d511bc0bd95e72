package ca.gc.cra.relay.application.publish;

import ca.gc.cra.relay.application.port.BufferRegion;
import ca.gc.cra.relay.application.port.ClockPort;
import ca.gc.cra.relay.application.port.RecordSerializer;
import ca.gc.cra.relay.domain.error.FramingException;
import ca.gc.cra.relay.domain.error.ResourceException;
import ca.gc.cra.relay.domain.metric.MetricRecord;
import java.util.Objects;

/**
 * <strong>What:</strong> Fixed-capacity batch buffer for one endpoint.
 * <p><strong>Why:</strong> Records are small and frequent; batching them amortizes one broker publish over many
 * records while bounding the message size.</p>
 * <p><strong>Role:</strong> Owned by {@link Publisher}; framing is delegated to the {@link RecordSerializer}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Track filled/free extents and the batch-open timestamp.</li>
 *   <li>Open, append to, and close the serializer's framing context.</li>
 *   <li>Drop the batch when closing fails, since its content is presumed corrupt.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Not thread-safe; every method runs under the endpoint lock.</p>
 *
 * <p>After {@link #reset()} the filled count equals {@link RecordSerializer#emptyFramingSize()}, never zero.</p>
 *
 * @since 0.1.0
 */
public final class FrameBuffer {
  private final BufferRegion region;
  private final RecordSerializer serializer;
  private final ClockPort clock;
  private long openedAtMillis;
  private boolean released;

  FrameBuffer(BufferRegion region, RecordSerializer serializer, ClockPort clock) {
    this.region = Objects.requireNonNull(region, "region");
    this.serializer = Objects.requireNonNull(serializer, "serializer");
    this.clock = Objects.requireNonNull(clock, "clock");
    if (region.capacity() < serializer.emptyFramingSize()) {
      throw new IllegalArgumentException(
          "capacity " + region.capacity() + " cannot hold empty framing of " + serializer.emptyFramingSize() + " bytes");
    }
    reset();
  }

  /**
   * Allocates and resets a buffer.
   *
   * @param capacity buffer size in bytes
   * @param serializer framing delegate
   * @param clock time source for the batch-open timestamp
   * @return ready buffer holding an empty batch
   * @throws ResourceException if the byte region cannot be allocated
   */
  public static FrameBuffer allocate(int capacity, RecordSerializer serializer, ClockPort clock)
      throws ResourceException {
    BufferRegion region;
    try {
      region = new BufferRegion(capacity);
    } catch (OutOfMemoryError ex) {
      throw new ResourceException("cannot allocate " + capacity + "-byte send buffer", ex);
    }
    return new FrameBuffer(region, serializer, clock);
  }

  /**
   * Zeroes the region, restarts the staleness clock, and opens a fresh framing context.
   */
  public void reset() {
    ensureLive();
    region.clear();
    openedAtMillis = clock.nowMillis();
    try {
      serializer.initFraming(region);
    } catch (FramingException ex) {
      throw new IllegalStateException("serializer refused to open framing in a cleared buffer", ex);
    }
  }

  /**
   * Appends one record.
   *
   * @param record record to encode
   * @return {@code false} on overflow; the buffer is unchanged in that case
   * @throws FramingException if the record cannot be encoded
   */
  public boolean append(MetricRecord record) throws FramingException {
    ensureLive();
    return serializer.append(region, record);
  }

  /**
   * Closes the framing and returns the publishable batch.
   *
   * @return copy of the framed batch
   * @throws FramingException if closing fails; the buffer has been reset and the batch dropped
   */
  public byte[] finalizeBatch() throws FramingException {
    ensureLive();
    try {
      serializer.closeFraming(region);
    } catch (FramingException ex) {
      reset();
      throw ex;
    }
    return region.copyFilled();
  }

  /**
   * Indicates whether no record has been appended since the last reset.
   *
   * @return {@code true} when only empty framing is present
   */
  public boolean isEffectivelyEmpty() {
    return region.filled() <= serializer.emptyFramingSize();
  }

  /**
   * Indicates whether the batch is older than {@code timeoutMillis}.
   *
   * @param timeoutMillis staleness threshold; values {@code <= 0} are always due
   * @param nowMillis current time
   * @return {@code true} when a flush should proceed
   */
  public boolean isDue(long timeoutMillis, long nowMillis) {
    return timeoutMillis <= 0 || openedAtMillis + timeoutMillis <= nowMillis;
  }

  /**
   * Restarts the staleness clock without touching content.
   *
   * @param nowMillis new batch-open timestamp
   */
  public void restartClock(long nowMillis) {
    openedAtMillis = nowMillis;
  }

  /**
   * Zeroes and releases the region; every later call fails.
   */
  public void release() {
    if (!released) {
      region.clear();
      released = true;
    }
  }

  /**
   * Returns the buffer capacity.
   *
   * @return bytes
   */
  public int capacity() {
    return region.capacity();
  }

  /**
   * Returns the filled byte count including framing.
   *
   * @return bytes
   */
  public int filled() {
    return region.filled();
  }

  /**
   * Returns the free byte count.
   *
   * @return bytes
   */
  public int free() {
    return region.free();
  }

  /**
   * Returns the batch-open timestamp.
   *
   * @return epoch milliseconds
   */
  public long openedAtMillis() {
    return openedAtMillis;
  }

  /**
   * Returns a copy of the filled extent, framing included.
   *
   * @return buffered bytes
   */
  public byte[] payload() {
    return region.copyFilled();
  }

  boolean isReleased() {
    return released;
  }

  private void ensureLive() {
    if (released) {
      throw new IllegalStateException("send buffer has been released");
    }
  }
}
