package ca.gc.cra.relay.api;

import ca.gc.cra.relay.application.publish.EndpointRegistry;
import ca.gc.cra.relay.config.CompositionRoot;
import ca.gc.cra.relay.config.RelayConfig;
import ca.gc.cra.relay.infrastructure.host.InProcessHost;
import ca.gc.cra.relay.infrastructure.metrics.MetricsSettings;
import ca.gc.cra.relay.logging.LoggingConfigurator;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.InterruptedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@code relay run}: publishes NDJSON records read from stdin to every configured broker until end of input.
 *
 * @since 0.1.0
 */
public final class RunCli {
  private static final Logger log = LoggerFactory.getLogger(RunCli.class);
  private static final String SUMMARY_USAGE =
      "usage: relay run config=PATH [flushInterval=SECONDS] [flushTimeout=SECONDS] "
          + "[metricsExporter=otlp|none] [otelEndpoint=URI] [otelResourceAttributes=K=V,...] [--verbose]";
  private static final String HELP_TEXT = """
      RELAY run

      Usage:
        relay run config=PATH [options]

      Reads one JSON record per line from stdin and publishes batches to every node in the
      configuration file. Stops at end of input or on SIGTERM after a final flush.

      Options:
        config=PATH                  YAML configuration with a 'relay' root section (required)
        flushInterval=SECONDS        Period of the flush trigger, 1..86400 (default 10)
        flushTimeout=SECONDS         Only publish batches older than this; 0 publishes every tick (default 0)
        metricsExporter=otlp|none    OpenTelemetry metrics export (default otlp)
        otelEndpoint=URI             OTLP endpoint (default from OTEL_EXPORTER_OTLP_ENDPOINT)
        otelResourceAttributes=K=V   Extra resource attributes, comma separated
        --verbose                    Enable DEBUG logging
        --help                       Show this message
      """;

  /** Builds the wiring for one run; replaced in tests. */
  @FunctionalInterface
  interface CompositionFactory {
    CompositionRoot create(RelayConfig config, MetricsSettings metrics);
  }

  private RunCli() {}

  /**
   * Runs against the process stdin with production adapters.
   *
   * @param args command arguments
   * @return exit code
   */
  static ExitCode run(String[] args) {
    return run(args, System.in, CompositionRoot::new);
  }

  static ExitCode run(String[] args, InputStream in, CompositionFactory factory) {
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
    if (loaded.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
    }
    if (loaded.config().nodes().isEmpty()) {
      log.error("Configuration {} defines no nodes", loaded.config().configFile());
      return ExitCode.CONFIG_ERROR;
    }

    try (CompositionRoot root = factory.create(loaded.config(), loaded.metrics())) {
      EndpointRegistry.Registration registration = root.registerEndpoints();
      InProcessHost host = root.host();
      if (registration.registered().isEmpty()) {
        log.error("No node could be registered; {} rejected", registration.rejected().size());
        host.stop();
        return ExitCode.CONFIG_ERROR;
      }
      return pump(host, root, in);
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure", ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }

  private static ExitCode pump(InProcessHost host, CompositionRoot root, InputStream in) {
    Thread hook = new Thread(host::stop, "relay-shutdown");
    Runtime.getRuntime().addShutdownHook(hook);
    try {
      host.start();
      BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
      long records = root.recordReader().readAll(reader, host::dispatch);
      log.info("End of input after {} record(s); shutting down", records);
      return ExitCode.SUCCESS;
    } catch (InterruptedIOException ex) {
      log.warn("Interrupted while reading records; shutting down");
      Thread.currentThread().interrupt();
      return ExitCode.INTERRUPTED;
    } catch (IOException ex) {
      log.error("Reading records failed: {}", ex.getMessage());
      return ExitCode.IO_ERROR;
    } finally {
      host.stop();
      try {
        Runtime.getRuntime().removeShutdownHook(hook);
      } catch (IllegalStateException ex) {
        log.debug("JVM shutdown already in progress");
      }
    }
  }
}
