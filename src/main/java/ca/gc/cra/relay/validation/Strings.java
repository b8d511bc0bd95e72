package ca.gc.cra.relay.validation;

import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Text checks for node names, MQTT client identifiers and publish topics.
 *
 * <p>A broker answers a malformed topic or client id with an opaque connect or publish refusal, so these values
 * are rejected while the configuration is parsed. Failures are {@link IllegalArgumentException}s whose message
 * starts with the option name.</p>
 *
 * @since 0.1.0
 * @see Numbers
 * @see Paths
 */
public final class Strings {
  /** Largest topic or client identifier an MQTT length prefix can carry. */
  public static final int MAX_MQTT_STRING_BYTES = 65_535;

  private Strings() {
    // Utility
  }

  /**
   * Trims {@code value}, rejecting blanks and ISO control characters (NUL, newlines, tabs).
   *
   * @param name option name for diagnostics
   * @param value raw text
   * @return trimmed text
   * @throws NullPointerException if {@code value} is {@code null}
   * @throws IllegalArgumentException if the value is blank or carries a control character
   */
  public static String requireNonBlank(String name, String value) {
    Objects.requireNonNull(value, label(name));
    if (value.chars().anyMatch(ch -> Character.isISOControl((char) ch))) {
      throw invalid(name, "must not contain control characters");
    }
    String trimmed = value.trim();
    if (trimmed.isEmpty()) {
      throw invalid(name, "must not be blank");
    }
    return trimmed;
  }

  /**
   * Accepts a topic usable in PUBLISH: no {@code +} or {@code #} filter wildcards and at most
   * {@value #MAX_MQTT_STRING_BYTES} UTF-8 bytes.
   *
   * @param name option name for diagnostics
   * @param topic raw topic
   * @return trimmed topic
   * @throws IllegalArgumentException if the topic cannot be published to
   */
  public static String requirePublishTopic(String name, String topic) {
    String candidate = requireNonBlank(name, topic);
    for (char wildcard : new char[] {'+', '#'}) {
      if (candidate.indexOf(wildcard) >= 0) {
        throw invalid(name, "must not contain wildcard characters '+' or '#'");
      }
    }
    if (candidate.getBytes(StandardCharsets.UTF_8).length > MAX_MQTT_STRING_BYTES) {
      throw invalid(name, "must be at most " + MAX_MQTT_STRING_BYTES + " bytes");
    }
    return candidate;
  }

  /**
   * Accepts printable ASCII ({@code 0x20-0x7E}) of at most {@code maxLength} characters, e.g. a client id.
   *
   * @param name option name for diagnostics
   * @param value raw text
   * @param maxLength character budget
   * @return trimmed text
   * @throws IllegalArgumentException if the value is blank, too long or not printable ASCII
   */
  public static String requirePrintableAscii(String name, String value, int maxLength) {
    String candidate = requireNonBlank(name, value);
    if (candidate.length() > maxLength) {
      throw invalid(name, "length must be <= " + maxLength);
    }
    if (!candidate.chars().allMatch(ch -> ch >= 0x20 && ch <= 0x7E)) {
      throw invalid(name, "must contain printable ASCII characters");
    }
    return candidate;
  }

  private static IllegalArgumentException invalid(String name, String problem) {
    return new IllegalArgumentException(label(name) + " " + problem);
  }

  private static String label(String name) {
    return name == null || name.isBlank() ? "value" : name;
  }
}
