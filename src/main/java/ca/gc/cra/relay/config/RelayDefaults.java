package ca.gc.cra.relay.config;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Supplies the flattened default settings for the RELAY CLI.
 *
 * <p>The defaults remain the single source of truth for optional YAML keys and CLI overrides.</p>
 */
public final class RelayDefaults {
  private static final Map<String, String> DEFAULTS = buildDefaults();

  private RelayDefaults() {}

  /**
   * Returns the default key/value pairs.
   *
   * @return unmodifiable map of defaults as strings
   */
  public static Map<String, String> asFlatMap() {
    return DEFAULTS;
  }

  private static Map<String, String> buildDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("flushInterval", Long.toString(RelayConfig.DEFAULT_FLUSH_INTERVAL_SECONDS));
    map.put("flushTimeout", "0");
    map.put("metricsExporter", "otlp");
    map.put("otelEndpoint", "");
    map.put("otelResourceAttributes", "");
    map.put("verbose", "false");
    return Map.copyOf(map);
  }
}
