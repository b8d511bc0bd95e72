package ca.gc.cra.relay.config;

import ca.gc.cra.relay.application.port.TransportSettings.ProtocolVersion;
import ca.gc.cra.relay.domain.error.ConfigurationException;
import ca.gc.cra.relay.validation.Net;
import ca.gc.cra.relay.validation.Numbers;
import ca.gc.cra.relay.validation.Paths;
import ca.gc.cra.relay.validation.Strings;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.BiConsumer;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Turns one node's key/value block into a validated {@link NodeConfig}.
 * <p><strong>Why:</strong> Node keys are case-insensitive and each has its own type and bounds; a static table of
 * typed setters keeps the rules in one place.</p>
 * <p><strong>Role:</strong> Used by {@code EndpointRegistry} and the {@code check} command.</p>
 * <p><strong>Thread-safety:</strong> Stateless apart from the host name supplier; safe to share.</p>
 *
 * <p>Recognised keys: {@code Host} (required), {@code Port}, {@code ClientId}, {@code CAPath},
 * {@code ClientKey}, {@code ClientCert}, {@code Insecure}, {@code QoS}, {@code Topic}, {@code StoreRates},
 * {@code BufferSize}, {@code ProtocolVersion}.</p>
 *
 * @since 0.1.0
 */
public final class NodeConfigParser {
  private static final Logger log = LoggerFactory.getLogger(NodeConfigParser.class);

  private static final Map<String, BiConsumer<Builder, String>> KEYS = buildKeyTable();

  private final Supplier<String> hostnameSupplier;

  /**
   * Creates a parser defaulting {@code ClientId} to the local host name.
   */
  public NodeConfigParser() {
    this(NodeConfigParser::localHostname);
  }

  /**
   * Creates a parser with an explicit default client identifier source.
   *
   * @param hostnameSupplier supplies the client identifier when a node omits {@code ClientId}
   */
  public NodeConfigParser(Supplier<String> hostnameSupplier) {
    this.hostnameSupplier = Objects.requireNonNull(hostnameSupplier, "hostnameSupplier");
  }

  /**
   * Parses and validates one node block.
   *
   * @param name node name; must be non-blank
   * @param block raw key/value settings; keys are matched case-insensitively
   * @return validated node configuration
   * @throws ConfigurationException if a key is unknown, a value is invalid, or {@code Host} is missing
   */
  public NodeConfig parse(String name, Map<String, String> block) throws ConfigurationException {
    String nodeName;
    try {
      nodeName = Strings.requirePrintableAscii("node name", name, 255);
    } catch (IllegalArgumentException | NullPointerException ex) {
      throw new ConfigurationException("invalid node name: " + ex.getMessage(), ex);
    }
    Builder builder = new Builder(nodeName);
    Map<String, String> entries = block == null ? Map.of() : block;
    for (Map.Entry<String, String> entry : entries.entrySet()) {
      String key = entry.getKey() == null ? "" : entry.getKey().trim();
      BiConsumer<Builder, String> setter = KEYS.get(key.toLowerCase(Locale.ROOT));
      if (setter == null) {
        throw new ConfigurationException(
            "write_mqtt plugin: invalid configuration option \"" + key + "\" in node \"" + nodeName + "\"");
      }
      try {
        setter.accept(builder, entry.getValue() == null ? "" : entry.getValue());
      } catch (IllegalArgumentException | NullPointerException ex) {
        throw new ConfigurationException(
            "write_mqtt plugin: invalid " + key + " for node \"" + nodeName + "\": " + ex.getMessage(), ex);
      }
    }
    if (builder.host == null) {
      throw new ConfigurationException("write_mqtt plugin: no Host defined for node \"" + nodeName + "\"");
    }
    if (builder.clientCert.isPresent() != builder.clientKey.isPresent()) {
      throw new ConfigurationException(
          "write_mqtt plugin: ClientCert and ClientKey must be set together for node \"" + nodeName + "\"");
    }
    if (builder.caPath.isEmpty() && (builder.clientCert.isPresent() || builder.insecure)) {
      log.warn("Node {} sets TLS options without CAPath; the connection will not use TLS", nodeName);
    }
    if (builder.clientId == null) {
      builder.clientId = hostnameSupplier.get();
    }
    return builder.build();
  }

  /**
   * Parses the boolean spellings accepted in node blocks.
   *
   * @param name key name for diagnostics
   * @param raw {@code true/false}, {@code yes/no} or {@code on/off}, case-insensitive
   * @return parsed value
   * @throws IllegalArgumentException for any other spelling
   */
  static boolean parseBoolean(String name, String raw) {
    String value = Strings.requireNonBlank(name, raw).toLowerCase(Locale.ROOT);
    switch (value) {
      case "true", "yes", "on" -> {
        return true;
      }
      case "false", "no", "off" -> {
        return false;
      }
      default -> throw new IllegalArgumentException(name + " must be a boolean (was " + raw + ")");
    }
  }

  private static Map<String, BiConsumer<Builder, String>> buildKeyTable() {
    Map<String, BiConsumer<Builder, String>> table = new LinkedHashMap<>();
    table.put("host", (b, v) -> b.host = Net.validateHost(v));
    table.put("port", (b, v) -> b.port = Numbers.parseIntInRange("Port", v, 1, 65_535));
    table.put("clientid",
        (b, v) -> b.clientId = Strings.requirePrintableAscii("ClientId", v, Strings.MAX_MQTT_STRING_BYTES));
    table.put("capath", (b, v) -> b.caPath = Optional.of(Paths.validateReadableFile("CAPath", v)));
    table.put("clientkey", (b, v) -> b.clientKey = Optional.of(Paths.validateReadableFile("ClientKey", v)));
    table.put("clientcert", (b, v) -> b.clientCert = Optional.of(Paths.validateReadableFile("ClientCert", v)));
    table.put("insecure", (b, v) -> b.insecure = parseBoolean("Insecure", v));
    table.put("qos", (b, v) -> b.qos = Numbers.parseIntInRange("QoS", v, 0, 1));
    table.put("topic", (b, v) -> b.topic = Strings.requirePublishTopic("Topic", v));
    table.put("storerates", (b, v) -> b.storeRates = parseBoolean("StoreRates", v));
    table.put("buffersize", (b, v) -> b.bufferSize =
        Numbers.parseIntInRange("BufferSize", v, NodeConfig.MIN_BUFFER_SIZE, NodeConfig.MAX_BUFFER_SIZE));
    table.put("protocolversion", (b, v) -> b.protocolVersion = ProtocolVersion.fromLabel(v));
    return Map.copyOf(table);
  }

  private static String localHostname() {
    try {
      return InetAddress.getLocalHost().getHostName();
    } catch (UnknownHostException ex) {
      log.warn("Unable to resolve local host name for ClientId; using \"localhost\": {}", ex.getMessage());
      return "localhost";
    }
  }

  private static final class Builder {
    private final String name;
    private String host;
    private int port = NodeConfig.DEFAULT_PORT;
    private String clientId;
    private Optional<Path> caPath = Optional.empty();
    private Optional<Path> clientCert = Optional.empty();
    private Optional<Path> clientKey = Optional.empty();
    private boolean insecure;
    private int qos;
    private String topic = NodeConfig.DEFAULT_TOPIC;
    private boolean storeRates;
    private int bufferSize = NodeConfig.MAX_BUFFER_SIZE;
    private ProtocolVersion protocolVersion = ProtocolVersion.V3_1_1;

    private Builder(String name) {
      this.name = name;
    }

    private NodeConfig build() {
      return new NodeConfig(
          name, host, port, clientId, caPath, clientCert, clientKey, insecure, qos, topic, storeRates,
          bufferSize, protocolVersion);
    }
  }
}
