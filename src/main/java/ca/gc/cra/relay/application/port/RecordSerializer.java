package ca.gc.cra.relay.application.port;

import ca.gc.cra.relay.domain.error.FramingException;
import ca.gc.cra.relay.domain.metric.MetricRecord;

/**
 * <strong>What:</strong> Port encoding records into a framed batch inside a {@link BufferRegion}.
 * <p><strong>Why:</strong> Keeps the wire format out of the buffering and publishing core.</p>
 * <p><strong>Role:</strong> Implemented by {@code JsonRecordSerializer}; one instance per endpoint.</p>
 * <p><strong>Thread-safety:</strong> Invoked only under the owning endpoint's lock.</p>
 *
 * @since 0.1.0
 */
public interface RecordSerializer {

  /**
   * Size of an opened-and-closed batch with no records; a region filled to this size or less is empty.
   *
   * @return byte count of the empty framing markers
   */
  int emptyFramingSize();

  /**
   * Writes the opening framing into a cleared region.
   *
   * @param region region with {@code filled() == 0}
   * @throws FramingException if the region cannot hold the empty framing
   */
  void initFraming(BufferRegion region) throws FramingException;

  /**
   * Appends one record if it fits in the remaining free space.
   *
   * @param region framed region
   * @param record record to encode
   * @return {@code false} on overflow, in which case the region is left exactly as it was
   * @throws FramingException if the record cannot be encoded at all
   */
  boolean append(BufferRegion region, MetricRecord record) throws FramingException;

  /**
   * Closes the framing so the filled extent is a complete, publishable batch.
   *
   * @param region framed region
   * @throws FramingException if the accumulated content is not a well-formed batch
   */
  void closeFraming(BufferRegion region) throws FramingException;
}
