package ca.gc.cra.relay.config;

import ca.gc.cra.relay.validation.Numbers;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Merges process-wide settings from defaults, YAML, and CLI sources while enforcing precedence and invariants.
 */
public final class ConfigMerger {

  private ConfigMerger() {}

  /**
   * Builds an effective settings map using precedence CLI > YAML > defaults.
   *
   * @param yaml optional YAML-derived settings
   * @param cli CLI key/value overrides (may be empty)
   * @param defaults embedded defaults
   * @param warn consumer invoked when a CLI key overrides a YAML key
   * @return immutable merged settings map
   * @throws IllegalArgumentException when validation fails
   */
  public static Map<String, String> buildEffectiveConfig(
      Optional<Map<String, String>> yaml,
      Map<String, String> cli,
      Map<String, String> defaults,
      Consumer<String> warn) {
    Objects.requireNonNull(yaml, "yaml");
    Map<String, String> defaultsCopy = defaults == null ? Map.of() : defaults;
    Map<String, String> yamlCopy = yaml.orElse(Map.of());
    Map<String, String> cliCopy = cli == null ? Map.of() : cli;

    Map<String, String> merged = new LinkedHashMap<>(defaultsCopy);
    merged.putAll(yamlCopy);
    for (Map.Entry<String, String> entry : cliCopy.entrySet()) {
      String key = entry.getKey();
      if (key == null) {
        continue;
      }
      if (yamlCopy.containsKey(key) && warn != null) {
        warn.accept("CLI overrides YAML for key: " + key);
      }
      if (entry.getValue() != null) {
        merged.put(key, entry.getValue());
      }
    }

    validate(merged);
    return Map.copyOf(merged);
  }

  private static void validate(Map<String, String> effective) {
    requireSeconds(effective, "flushInterval", 1);
    requireSeconds(effective, "flushTimeout", 0);
    String exporter = trim(effective.get("metricsExporter")).toLowerCase(Locale.ROOT);
    if (!exporter.isEmpty() && !exporter.equals("otlp") && !exporter.equals("none")) {
      throw new IllegalArgumentException("metricsExporter must be otlp or none (was " + exporter + ")");
    }
  }

  private static void requireSeconds(Map<String, String> effective, String key, int min) {
    String raw = trim(effective.get(key));
    if (!raw.isEmpty()) {
      Numbers.parseIntInRange(key, raw, min, 86_400);
    }
  }

  private static String trim(String value) {
    return value == null ? "" : value.trim();
  }
}
