package ca.gc.cra.relay.config;

import ca.gc.cra.relay.validation.Numbers;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Effective process-wide RELAY configuration plus the raw node blocks.
 * <p><strong>Why:</strong> Separates host settings (flush cadence, metrics exporter) from per-node settings, which
 * are validated individually so one bad node does not block the others.</p>
 * <p><strong>Role:</strong> Built by the CLI from {@link ConfigMerger} output; consumed by {@link CompositionRoot}.</p>
 * <p><strong>Thread-safety:</strong> Record is immutable.</p>
 *
 * @param configFile source file, or {@code null} when none was loaded
 * @param flushInterval period of the flush trigger
 * @param flushTimeout staleness threshold passed to each flush; zero flushes every tick
 * @param metricsExporter {@code otlp} or {@code none}
 * @param nodes raw node blocks keyed by node name, in document order
 * @since 0.1.0
 */
public record RelayConfig(
    Path configFile,
    Duration flushInterval,
    Duration flushTimeout,
    String metricsExporter,
    Map<String, Map<String, String>> nodes) {

  /** Default flush trigger period in seconds. */
  public static final long DEFAULT_FLUSH_INTERVAL_SECONDS = 10;

  /**
   * Validates and copies components.
   */
  public RelayConfig {
    Objects.requireNonNull(flushInterval, "flushInterval");
    Objects.requireNonNull(flushTimeout, "flushTimeout");
    Objects.requireNonNull(metricsExporter, "metricsExporter");
    Objects.requireNonNull(nodes, "nodes");
    if (flushInterval.isZero() || flushInterval.isNegative()) {
      throw new IllegalArgumentException("flushInterval must be positive");
    }
    if (flushTimeout.isNegative()) {
      throw new IllegalArgumentException("flushTimeout must not be negative");
    }
    nodes = Collections.unmodifiableMap(new LinkedHashMap<>(nodes));
  }

  /**
   * Builds a configuration from merged settings and the YAML node blocks.
   *
   * @param configFile source file; may be {@code null}
   * @param settings effective settings from {@link ConfigMerger}
   * @param nodes node blocks from {@link YamlConfigLoader}
   * @return configuration record
   * @throws IllegalArgumentException if a setting is invalid
   */
  public static RelayConfig fromMap(
      Path configFile, Map<String, String> settings, Map<String, Map<String, String>> nodes) {
    Map<String, String> effective = settings == null ? Map.of() : settings;
    long interval = seconds(effective, "flushInterval", DEFAULT_FLUSH_INTERVAL_SECONDS, 1);
    long timeout = seconds(effective, "flushTimeout", 0, 0);
    String exporter = effective.getOrDefault("metricsExporter", "otlp").trim().toLowerCase(Locale.ROOT);
    return new RelayConfig(
        configFile,
        Duration.ofSeconds(interval),
        Duration.ofSeconds(timeout),
        exporter.isEmpty() ? "otlp" : exporter,
        nodes == null ? Map.of() : nodes);
  }

  private static long seconds(Map<String, String> settings, String key, long defaultValue, int min) {
    String raw = settings.get(key);
    if (raw == null || raw.isBlank()) {
      return defaultValue;
    }
    return Numbers.parseIntInRange(key, raw, min, 86_400);
  }
}
