package ca.gc.cra.relay.config;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Loads RELAY configuration from a YAML document.
 *
 * <p>The document root holds a {@code relay} section. Scalar keys inside it are flattened into the settings map
 * (nested mappings use dotted keys); the {@code nodes} mapping is returned separately, one flat key/value block
 * per node, in document order.</p>
 */
public final class YamlConfigLoader {
  static final String ROOT_SECTION = "relay";
  static final String NODES_SECTION = "nodes";

  private YamlConfigLoader() {}

  /**
   * Parsed document.
   *
   * @param settings flattened process-wide settings (flush interval, exporter, ...)
   * @param nodes node name to raw key/value block, in document order
   */
  public record Document(Map<String, String> settings, Map<String, Map<String, String>> nodes) {
    /**
     * Copies both maps.
     */
    public Document {
      settings = Map.copyOf(settings);
      nodes = Collections.unmodifiableMap(new LinkedHashMap<>(nodes));
    }
  }

  /**
   * Loads YAML from {@code path}.
   *
   * @param path location of the YAML configuration
   * @return parsed document, or empty when the file does not exist
   * @throws IOException when the file cannot be read
   * @throws IllegalArgumentException when the YAML structure is invalid
   */
  public static Optional<Document> load(Path path) throws IOException {
    Objects.requireNonNull(path, "path");
    if (!Files.exists(path)) {
      return Optional.empty();
    }
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      return Optional.of(parse(reader, path.toString()));
    }
  }

  /**
   * Parses YAML from an open reader.
   *
   * @param reader YAML source; not closed by this method
   * @param origin description used in error messages
   * @return parsed document
   * @throws IllegalArgumentException when the YAML structure is invalid
   */
  public static Document parse(Reader reader, String origin) {
    try {
      Object document = new Yaml().load(reader);
      if (document == null) {
        return new Document(Map.of(), Map.of());
      }
      Map<String, Object> root = asMap(document, "root");
      Object relaySection = findSection(root, ROOT_SECTION);
      if (relaySection == null) {
        throw new IllegalArgumentException("YAML config at " + origin + " has no '" + ROOT_SECTION + "' section");
      }
      Map<String, Object> relay = asMap(relaySection, ROOT_SECTION);

      Map<String, Map<String, String>> nodes = new LinkedHashMap<>();
      Object nodesSection = null;
      Map<String, String> settings = new LinkedHashMap<>();
      for (Map.Entry<String, Object> entry : relay.entrySet()) {
        if (entry.getKey().trim().toLowerCase(Locale.ROOT).equals(NODES_SECTION)) {
          nodesSection = entry.getValue();
        } else {
          flatten(Map.of(entry.getKey(), entry.getValue() == null ? "" : entry.getValue()), "", settings);
        }
      }
      if (nodesSection != null) {
        for (Map.Entry<String, Object> node : asMap(nodesSection, NODES_SECTION).entrySet()) {
          Map<String, String> block = new LinkedHashMap<>();
          if (node.getValue() != null) {
            flatten(asMap(node.getValue(), NODES_SECTION + '.' + node.getKey()), "", block);
          }
          nodes.put(node.getKey(), block);
        }
      }
      return new Document(settings, nodes);
    } catch (YAMLException ex) {
      throw new IllegalArgumentException("Failed to parse YAML config at " + origin, ex);
    }
  }

  private static Map<String, Object> asMap(Object node, String context) {
    if (!(node instanceof Map<?, ?> raw)) {
      throw new IllegalArgumentException(context + " section must be a mapping");
    }
    Map<String, Object> map = new LinkedHashMap<>();
    for (Map.Entry<?, ?> entry : raw.entrySet()) {
      if (!(entry.getKey() instanceof String key)) {
        throw new IllegalArgumentException(context + " section contains non-string key");
      }
      map.put(key, entry.getValue());
    }
    return map;
  }

  private static Object findSection(Map<String, Object> root, String key) {
    for (Map.Entry<String, Object> entry : root.entrySet()) {
      if (entry.getKey() != null
          && entry.getKey().trim().toLowerCase(Locale.ROOT).equals(key)) {
        return entry.getValue();
      }
    }
    return null;
  }

  private static void flatten(Map<String, Object> source, String prefix, Map<String, String> target) {
    for (Map.Entry<String, Object> entry : source.entrySet()) {
      String key = entry.getKey();
      if (key == null || key.isBlank()) {
        throw new IllegalArgumentException("YAML contains blank keys");
      }
      String composite = prefix.isEmpty() ? key : prefix + '.' + key;
      Object value = entry.getValue();
      if (value == null) {
        target.put(composite, "");
      } else if (value instanceof Map<?, ?> nested) {
        flatten(asMap(nested, composite), composite, target);
      } else if (value instanceof Iterable<?>) {
        throw new IllegalArgumentException("YAML arrays are not supported for key " + composite);
      } else {
        target.put(composite, value.toString());
      }
    }
  }
}
