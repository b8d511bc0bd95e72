package ca.gc.cra.relay.logging;

import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

/**
 * Helpers that keep untrusted input and secrets out of log lines: malformed stdin records and batch previews
 * are cut to a byte budget, private-key locations are redacted.
 *
 * <p>Stateless; safe for concurrent use.</p>
 *
 * @since 0.1.0
 */
public final class Logs {
  private static final String NULL_PLACEHOLDER = "<null>";
  private static final String REDACTED_PLACEHOLDER = "[REDACTED]";

  private Logs() {
    // Utility
  }

  /**
   * Cuts {@code value} down to at most {@code maxBytes} UTF-8 bytes, flagging the cut with the original size.
   *
   * @param value text to shorten; {@code null} becomes {@code "<null>"}
   * @param maxBytes byte budget; must be positive
   * @return {@code value} itself when it fits, otherwise its prefix followed by {@code "... (truncated, X of Y)"}
   * @throws IllegalArgumentException if {@code maxBytes} is not positive
   */
  public static String truncate(String value, int maxBytes) {
    if (value == null) {
      return NULL_PLACEHOLDER;
    }
    return preview(value.getBytes(StandardCharsets.UTF_8), maxBytes, value);
  }

  /**
   * Renders the head of a UTF-8 payload, such as a framed batch, for a DEBUG line.
   *
   * @param payload encoded bytes; {@code null} becomes {@code "<null>"}
   * @param maxBytes byte budget; must be positive
   * @return decoded prefix, flagged with {@code "... (truncated, X of Y)"} when cut
   * @throws IllegalArgumentException if {@code maxBytes} is not positive
   */
  public static String preview(byte[] payload, int maxBytes) {
    if (payload == null) {
      return NULL_PLACEHOLDER;
    }
    return preview(payload, maxBytes, null);
  }

  /**
   * Replaces a secret with a fixed placeholder, e.g. the private-key path in the {@code check} plan.
   *
   * @param value secret; never rendered
   * @return {@code "[REDACTED]"}, or {@code "<null>"} when nothing was configured
   */
  public static String redact(Object value) {
    return value == null ? NULL_PLACEHOLDER : REDACTED_PLACEHOLDER;
  }

  private static String preview(byte[] bytes, int maxBytes, String whole) {
    if (maxBytes <= 0) {
      throw new IllegalArgumentException("maxBytes must be positive");
    }
    if (bytes.length <= maxBytes) {
      return whole != null ? whole : new String(bytes, StandardCharsets.UTF_8);
    }
    // a cut inside a multi-byte sequence drops the partial character
    CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
        .onMalformedInput(CodingErrorAction.IGNORE)
        .onUnmappableCharacter(CodingErrorAction.IGNORE);
    String head;
    try {
      CharBuffer prefix = decoder.decode(ByteBuffer.wrap(bytes, 0, maxBytes));
      head = prefix.toString();
    } catch (CharacterCodingException ex) {
      head = new String(bytes, 0, maxBytes, StandardCharsets.UTF_8);
    }
    return head + "... (truncated, " + maxBytes + " of " + bytes.length + ")";
  }
}
