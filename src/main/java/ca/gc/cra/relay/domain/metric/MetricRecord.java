package ca.gc.cra.relay.domain.metric;

import java.util.List;
import java.util.Objects;

/**
 * <strong>What:</strong> Immutable telemetry record (a "value list") produced by collection plugins.
 * <p><strong>Why:</strong> Unit of work handed to {@code Publisher.write}; many small records are batched
 * into one transport message.</p>
 * <p><strong>Role:</strong> Domain value consumed by the record serializer port.</p>
 * <p><strong>Thread-safety:</strong> Immutable; safe to share across producer threads.</p>
 *
 * @param host originating host name; must not be blank
 * @param plugin plugin name (e.g., {@code "cpu"}); must not be blank
 * @param pluginInstance plugin instance; empty string when absent
 * @param type type name (e.g., {@code "if_octets"}); must not be blank
 * @param typeInstance type instance; empty string when absent
 * @param timeSeconds sample time as epoch seconds with millisecond precision
 * @param intervalSeconds collection interval in seconds
 * @param values ordered data-source values; at least one
 * @since 0.1.0
 */
public record MetricRecord(
    String host,
    String plugin,
    String pluginInstance,
    String type,
    String typeInstance,
    double timeSeconds,
    double intervalSeconds,
    List<DataSourceValue> values) {

  /**
   * Normalizes optional instances and copies the value list.
   *
   * @throws NullPointerException if a required component is {@code null}
   * @throws IllegalArgumentException if a required name is blank or no values are supplied
   */
  public MetricRecord {
    host = requireName("host", host);
    plugin = requireName("plugin", plugin);
    type = requireName("type", type);
    pluginInstance = pluginInstance == null ? "" : pluginInstance;
    typeInstance = typeInstance == null ? "" : typeInstance;
    Objects.requireNonNull(values, "values");
    if (values.isEmpty()) {
      throw new IllegalArgumentException("metric record must carry at least one value");
    }
    values = List.copyOf(values);
  }

  /**
   * Returns the {@code host/plugin[-instance]/type[-instance]} identifier used for rate tracking
   * and log messages.
   *
   * @return identifier string
   */
  public String identifier() {
    StringBuilder sb = new StringBuilder(64).append(host).append('/').append(plugin);
    if (!pluginInstance.isEmpty()) {
      sb.append('-').append(pluginInstance);
    }
    sb.append('/').append(type);
    if (!typeInstance.isEmpty()) {
      sb.append('-').append(typeInstance);
    }
    return sb.toString();
  }

  private static String requireName(String field, String value) {
    Objects.requireNonNull(value, field);
    if (value.isBlank()) {
      throw new IllegalArgumentException(field + " must not be blank");
    }
    return value;
  }
}
