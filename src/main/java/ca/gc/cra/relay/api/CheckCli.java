package ca.gc.cra.relay.api;

import ca.gc.cra.relay.config.NodeConfig;
import ca.gc.cra.relay.config.NodeConfigParser;
import ca.gc.cra.relay.config.RelayConfig;
import ca.gc.cra.relay.domain.error.ConfigurationException;
import ca.gc.cra.relay.logging.LoggingConfigurator;
import ca.gc.cra.relay.logging.Logs;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@code relay check}: validates a configuration and prints what {@code run} would do, without connecting.
 *
 * @since 0.1.0
 */
public final class CheckCli {
  private static final Logger log = LoggerFactory.getLogger(CheckCli.class);
  private static final String SUMMARY_USAGE = "usage: relay check config=PATH [setting=VALUE ...] [--verbose]";
  private static final String HELP_TEXT = """
      RELAY check

      Usage:
        relay check config=PATH [setting=VALUE ...]

      Parses the configuration file with the same overrides 'run' accepts, validates every node
      and prints the resulting plan. Exits with status 4 if any node is invalid.
      """;

  private CheckCli() {}

  static ExitCode run(String[] args) {
    return run(args, new NodeConfigParser());
  }

  static ExitCode run(String[] args, NodeConfigParser parser) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.out(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
    }

    Map<String, String> kv;
    try {
      input.requireKnownFlags();
      kv = CliArgsParser.toMap(input.keyValueArgs());
      ConfigCliUtils.requireKnownKeys(kv);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.err(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    ConfigCliUtils.Loaded loaded;
    try {
      loaded = ConfigCliUtils.load(kv);
    } catch (IOException ex) {
      log.error("Cannot read configuration: {}", ex.getMessage());
      return ExitCode.IO_ERROR;
    } catch (IllegalArgumentException ex) {
      log.error("Invalid configuration: {}", ex.getMessage());
      return ExitCode.CONFIG_ERROR;
    }

    RelayConfig config = loaded.config();
    List<String> lines = new ArrayList<>();
    lines.add("RELAY configuration check: " + config.configFile());
    lines.add(" Flush interval   : " + config.flushInterval().toSeconds() + "s");
    lines.add(" Flush timeout    : " + config.flushTimeout().toSeconds() + "s");
    lines.add(" Metrics exporter : " + loaded.metrics().exporter());

    int rejected = 0;
    Set<String> seen = new HashSet<>();
    for (Map.Entry<String, Map<String, String>> entry : config.nodes().entrySet()) {
      try {
        if (!seen.add(entry.getKey().toLowerCase(Locale.ROOT))) {
          throw new ConfigurationException("duplicate node name \"" + entry.getKey() + "\"");
        }
        describe(parser.parse(entry.getKey(), entry.getValue()), lines);
      } catch (ConfigurationException ex) {
        rejected++;
        lines.add(" Node " + entry.getKey() + " : INVALID (" + ex.getMessage() + ")");
      }
    }
    if (config.nodes().isEmpty()) {
      lines.add(" No nodes configured");
    }
    CliPrinter.out(lines.toArray(String[]::new));

    if (rejected > 0 || config.nodes().isEmpty()) {
      return ExitCode.CONFIG_ERROR;
    }
    return ExitCode.SUCCESS;
  }

  private static void describe(NodeConfig node, List<String> lines) {
    lines.add(" Node " + node.name() + " (" + node.callbackName() + ")");
    lines.add("   Broker         : " + node.host() + ":" + node.port() + " MQTT " + node.protocolVersion().label());
    lines.add("   Client id      : " + node.clientId());
    lines.add("   Topic / QoS    : " + node.topic() + " / " + node.qos());
    lines.add("   TLS            : " + node.caPath().map(Path::toString).orElse("disabled")
        + (node.caPath().isPresent() && node.insecure() ? " (insecure)" : ""));
    if (node.clientCert().isPresent()) {
      lines.add("   Client cert    : " + node.clientCert().get());
      lines.add("   Client key     : " + Logs.redact(node.clientKey().orElse(null)));
    }
    lines.add("   Store rates    : " + node.storeRates());
    lines.add("   Buffer size    : " + node.bufferSize() + " bytes");
  }
}
