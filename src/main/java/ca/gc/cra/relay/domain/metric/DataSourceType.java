package ca.gc.cra.relay.domain.metric;

import java.util.Locale;

/**
 * Kind of a single data-source value within a {@link MetricRecord}.
 *
 * <p>GAUGE values are published as-is. COUNTER, DERIVE and ABSOLUTE values may be converted to
 * per-second rates when a node enables {@code StoreRates}.</p>
 *
 * @since 0.1.0
 */
public enum DataSourceType {
  /** Instantaneous reading. */
  GAUGE,
  /** Monotonic counter that may wrap at 32 or 64 bits. */
  COUNTER,
  /** Counter that may decrease; rates can be negative. */
  DERIVE,
  /** Counter reset on every read. */
  ABSOLUTE;

  /**
   * Returns the lowercase wire name used by the JSON framing ({@code gauge}, {@code counter}, ...).
   *
   * @return wire name
   */
  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }

  /**
   * Parses a wire name, ignoring case.
   *
   * @param raw wire name such as {@code "derive"}
   * @return matching type
   * @throws IllegalArgumentException if {@code raw} is blank or unknown
   */
  public static DataSourceType fromWireName(String raw) {
    if (raw == null || raw.isBlank()) {
      throw new IllegalArgumentException("data source type must not be blank");
    }
    try {
      return valueOf(raw.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException("unknown data source type: " + raw, ex);
    }
  }
}
