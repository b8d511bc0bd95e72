package ca.gc.cra.relay.domain.metric;

import java.util.Objects;

/**
 * One named sample inside a {@link MetricRecord}.
 *
 * @param name data-source name (e.g., {@code "rx"}); must not be blank
 * @param type data-source kind controlling rate conversion
 * @param value raw sample; gauges may be {@link Double#NaN}, counters are integral
 * @since 0.1.0
 */
public record DataSourceValue(String name, DataSourceType type, Number value) {

  /**
   * Validates the components.
   *
   * @throws NullPointerException if any component is {@code null}
   * @throws IllegalArgumentException if {@code name} is blank
   */
  public DataSourceValue {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(type, "type");
    Objects.requireNonNull(value, "value");
    if (name.isBlank()) {
      throw new IllegalArgumentException("data source name must not be blank");
    }
  }

  /**
   * Convenience factory for gauge samples.
   *
   * @param name data-source name
   * @param value gauge reading
   * @return gauge value
   */
  public static DataSourceValue gauge(String name, double value) {
    return new DataSourceValue(name, DataSourceType.GAUGE, value);
  }

  /**
   * Convenience factory for counter-like samples.
   *
   * @param name data-source name
   * @param type COUNTER, DERIVE or ABSOLUTE
   * @param value raw counter reading
   * @return counter value
   */
  public static DataSourceValue counter(String name, DataSourceType type, long value) {
    return new DataSourceValue(name, type, value);
  }
}
