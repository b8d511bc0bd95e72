package ca.gc.cra.relay.application.port;

import java.util.Arrays;

/**
 * <strong>What:</strong> Fixed-capacity byte region handed to a {@link RecordSerializer}.
 * <p><strong>Why:</strong> Gives the serializer a check-and-write view of the endpoint buffer without exposing
 * the owning {@code FrameBuffer}'s lifecycle operations.</p>
 * <p><strong>Role:</strong> Port-side value shared between the publish core and serializer adapters.</p>
 * <p><strong>Thread-safety:</strong> Not thread-safe; callers hold the endpoint lock.</p>
 *
 * <p>The filled count never exceeds {@link #capacity()}; writes that would cross the boundary are rejected
 * before any byte is copied, so a refused write leaves the region exactly as it was.</p>
 *
 * @since 0.1.0
 */
public final class BufferRegion {
  private final byte[] storage;
  private int filled;

  /**
   * Allocates a zeroed region.
   *
   * @param capacity size in bytes; must be positive
   * @throws IllegalArgumentException if {@code capacity} is not positive
   */
  public BufferRegion(int capacity) {
    if (capacity <= 0) {
      throw new IllegalArgumentException("capacity must be positive");
    }
    this.storage = new byte[capacity];
  }

  /**
   * Returns the total size of the region.
   *
   * @return capacity in bytes
   */
  public int capacity() {
    return storage.length;
  }

  /**
   * Returns how many leading bytes currently hold framed content.
   *
   * @return filled byte count
   */
  public int filled() {
    return filled;
  }

  /**
   * Returns the remaining writable bytes.
   *
   * @return {@code capacity() - filled()}
   */
  public int free() {
    return storage.length - filled;
  }

  /**
   * Reads a single byte inside the filled extent.
   *
   * @param index zero-based offset
   * @return byte at {@code index}
   * @throws IndexOutOfBoundsException if {@code index} is outside {@code [0, filled)}
   */
  public byte byteAt(int index) {
    if (index < 0 || index >= filled) {
      throw new IndexOutOfBoundsException("index " + index + " outside filled extent " + filled);
    }
    return storage[index];
  }

  /**
   * Checks whether {@code length} bytes written at {@code position} stay within capacity.
   *
   * @param position write offset; must be within {@code [0, filled]}
   * @param length number of bytes
   * @return {@code true} when the write would fit
   */
  public boolean fits(int position, int length) {
    return position >= 0 && position <= filled && length >= 0 && (long) position + length <= storage.length;
  }

  /**
   * Copies {@code data} at {@code position} and moves the filled mark to the end of the copy.
   *
   * <p>Writing before the current mark truncates whatever followed {@code position}.</p>
   *
   * @param position offset within {@code [0, filled]}
   * @param data bytes to copy
   * @return {@code false} without modifying the region when the data does not fit
   */
  public boolean writeAt(int position, byte[] data) {
    if (!fits(position, data.length)) {
      return false;
    }
    System.arraycopy(data, 0, storage, position, data.length);
    if (position + data.length < filled) {
      Arrays.fill(storage, position + data.length, filled, (byte) 0);
    }
    filled = position + data.length;
    return true;
  }

  /**
   * Zeroes the region and resets the filled mark.
   */
  public void clear() {
    Arrays.fill(storage, (byte) 0);
    filled = 0;
  }

  /**
   * Copies the filled extent.
   *
   * @return new array holding {@code filled()} bytes
   */
  public byte[] copyFilled() {
    return Arrays.copyOf(storage, filled);
  }
}
