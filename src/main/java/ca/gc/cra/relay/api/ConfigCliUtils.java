package ca.gc.cra.relay.api;

import ca.gc.cra.relay.config.ConfigMerger;
import ca.gc.cra.relay.config.RelayConfig;
import ca.gc.cra.relay.config.RelayDefaults;
import ca.gc.cra.relay.config.YamlConfigLoader;
import ca.gc.cra.relay.infrastructure.metrics.MetricsSettings;
import ca.gc.cra.relay.validation.Paths;
import java.io.IOException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Shared configuration loading for the {@code run} and {@code check} commands.
 */
final class ConfigCliUtils {
  private static final Logger log = LoggerFactory.getLogger(ConfigCliUtils.class);
  static final String CONFIG_KEY = "config";

  private ConfigCliUtils() {}

  /**
   * Effective configuration of one invocation.
   *
   * @param config process-wide settings and node blocks
   * @param metrics metrics exporter settings
   * @param verbose whether DEBUG logging was requested through the configuration
   */
  record Loaded(RelayConfig config, MetricsSettings metrics, boolean verbose) {}

  /**
   * Rejects CLI keys that are neither {@code config} nor a known setting.
   *
   * @param kv parsed CLI arguments
   * @throws IllegalArgumentException naming the first unknown key
   */
  static void requireKnownKeys(Map<String, String> kv) {
    Set<String> known = new TreeSet<>(RelayDefaults.asFlatMap().keySet());
    known.add(CONFIG_KEY);
    for (String key : kv.keySet()) {
      if (!known.contains(key)) {
        throw new IllegalArgumentException("unknown option " + key + " (known: " + String.join(", ", known) + ")");
      }
    }
  }

  /**
   * Loads the YAML file named by {@code config=PATH} and merges it with CLI overrides and defaults.
   *
   * @param kv parsed CLI arguments; not modified
   * @return effective configuration
   * @throws IOException if the file cannot be read
   * @throws IllegalArgumentException if the file is missing or any setting is invalid
   */
  static Loaded load(Map<String, String> kv) throws IOException {
    Map<String, String> cli = new LinkedHashMap<>(kv);
    String rawPath = cli.remove(CONFIG_KEY);
    if (rawPath == null || rawPath.isBlank()) {
      throw new IllegalArgumentException("config=PATH is required");
    }
    Path path = Paths.validateReadableFile(CONFIG_KEY, rawPath);
    Optional<YamlConfigLoader.Document> document = YamlConfigLoader.load(path);
    Map<String, String> effective = ConfigMerger.buildEffectiveConfig(
        document.map(YamlConfigLoader.Document::settings),
        cli,
        RelayDefaults.asFlatMap(),
        log::warn);
    RelayConfig config = RelayConfig.fromMap(
        path, effective, document.map(YamlConfigLoader.Document::nodes).orElse(Map.of()));
    MetricsSettings metrics = TelemetryConfigurator.metricsSettings(effective);
    boolean verbose = Boolean.parseBoolean(effective.getOrDefault("verbose", "false").trim());
    return new Loaded(config, metrics, verbose);
  }
}
