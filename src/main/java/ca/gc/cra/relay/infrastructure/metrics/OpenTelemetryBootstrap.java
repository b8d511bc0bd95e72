package ca.gc.cra.relay.infrastructure.metrics;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.common.AttributesBuilder;
import io.opentelemetry.api.metrics.Meter;
import io.opentelemetry.api.metrics.MeterProvider;
import io.opentelemetry.exporter.otlp.metrics.OtlpGrpcMetricExporter;
import io.opentelemetry.sdk.common.CompletableResultCode;
import io.opentelemetry.sdk.metrics.SdkMeterProvider;
import io.opentelemetry.sdk.metrics.export.MetricReader;
import io.opentelemetry.sdk.metrics.export.PeriodicMetricReader;
import io.opentelemetry.sdk.resources.Resource;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.time.Duration;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.function.UnaryOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the OpenTelemetry meter provider RELAY reports through.
 *
 * <p>Settings come from {@link MetricsSettings}; blank values fall back to the standard {@code OTEL_*}
 * environment variables. Any failure degrades to a no-op meter so metrics never stop the publisher.</p>
 */
final class OpenTelemetryBootstrap {
  private static final Logger log = LoggerFactory.getLogger(OpenTelemetryBootstrap.class);
  static final String INSTRUMENTATION_SCOPE = "ca.gc.cra.relay";
  static final String DEFAULT_ENDPOINT = "http://localhost:4317";
  private static final Duration EXPORT_INTERVAL = Duration.ofSeconds(30);
  private static final String FALLBACK_VERSION = "0.0.0-dev";

  private OpenTelemetryBootstrap() {
    // Utility class
  }

  /**
   * Export target after environment fallbacks were applied.
   *
   * @param enabled {@code false} when the exporter is {@code none}
   * @param endpoint OTLP gRPC endpoint
   * @param attributes extra resource attributes
   */
  record Target(boolean enabled, String endpoint, Attributes attributes) {}

  static MeterHandle initialize(MetricsSettings settings) {
    return initialize(settings, System::getenv);
  }

  static MeterHandle initialize(MetricsSettings settings, UnaryOperator<String> environment) {
    Target target = resolve(settings, environment);
    if (!target.enabled()) {
      log.info("OpenTelemetry metrics export disabled");
      return MeterHandle.noop();
    }
    try {
      OtlpGrpcMetricExporter exporter = OtlpGrpcMetricExporter.builder().setEndpoint(target.endpoint()).build();
      MeterHandle handle = build(
          PeriodicMetricReader.builder(exporter).setInterval(EXPORT_INTERVAL).build(), target.attributes());
      log.info("OpenTelemetry metrics export to {} every {}s", target.endpoint(), EXPORT_INTERVAL.toSeconds());
      return handle;
    } catch (RuntimeException ex) {
      log.error("Failed to initialize OpenTelemetry metrics; using noop meter", ex);
      return MeterHandle.noop();
    }
  }

  static MeterHandle forTesting(MetricReader reader) {
    return build(Objects.requireNonNull(reader, "reader"), Attributes.empty());
  }

  static Target resolve(MetricsSettings settings, UnaryOperator<String> environment) {
    Objects.requireNonNull(settings, "settings");
    String exporter = pick(settings.exporter(), environment.apply("OTEL_METRICS_EXPORTER"), "otlp")
        .toLowerCase(Locale.ROOT);
    if (!exporter.equals("otlp") && !exporter.equals("none")) {
      log.warn("Unknown metrics exporter '{}'; using otlp", exporter);
    }
    String endpoint = pick(settings.endpoint(), environment.apply("OTEL_EXPORTER_OTLP_ENDPOINT"), DEFAULT_ENDPOINT);
    String attributes = pick(settings.resourceAttributes(), environment.apply("OTEL_RESOURCE_ATTRIBUTES"), "");
    return new Target(!exporter.equals("none"), endpoint, parseResourceAttributes(attributes));
  }

  static Attributes parseResourceAttributes(String raw) {
    AttributesBuilder builder = Attributes.builder();
    if (raw == null) {
      return builder.build();
    }
    for (String entry : raw.split(",")) {
      String pair = entry.trim();
      if (pair.isEmpty()) {
        continue;
      }
      int eq = pair.indexOf('=');
      String key = eq < 0 ? "" : pair.substring(0, eq).trim();
      String value = eq < 0 ? "" : pair.substring(eq + 1).trim();
      if (key.isEmpty() || value.isEmpty()) {
        log.warn("Ignoring malformed resource attribute entry: {}", pair);
        continue;
      }
      builder.put(AttributeKey.stringKey(key), value);
    }
    return builder.build();
  }

  private static MeterHandle build(MetricReader reader, Attributes extra) {
    String version = serviceVersion();
    Resource service = Resource.create(Attributes.builder()
        .put(AttributeKey.stringKey("service.name"), "relay")
        .put(AttributeKey.stringKey("service.namespace"), "ca.gc.cra")
        .put(AttributeKey.stringKey("service.version"), version)
        .put(AttributeKey.stringKey("service.instance.id"), instanceId())
        .build());
    SdkMeterProvider provider = SdkMeterProvider.builder()
        .setResource(Resource.getDefault().merge(service).merge(Resource.create(extra)))
        .registerMetricReader(reader)
        .build();
    return new MeterHandle(
        provider.meterBuilder(INSTRUMENTATION_SCOPE).setInstrumentationVersion(version).build(), provider);
  }

  private static String instanceId() {
    try {
      return InetAddress.getLocalHost().getHostName();
    } catch (UnknownHostException ex) {
      log.debug("Local host name unavailable for service.instance.id", ex);
      return "unknown";
    }
  }

  private static String serviceVersion() {
    Package pkg = OpenTelemetryBootstrap.class.getPackage();
    String version = pkg == null ? null : pkg.getImplementationVersion();
    return version == null || version.isBlank() ? FALLBACK_VERSION : version;
  }

  private static String pick(String configured, String environment, String fallback) {
    if (configured != null && !configured.isBlank()) {
      return configured.trim();
    }
    if (environment != null && !environment.isBlank()) {
      return environment.trim();
    }
    return fallback;
  }

  /** Meter plus the provider that owns it; the provider is absent in noop mode. */
  static final class MeterHandle implements AutoCloseable {
    private final Meter meter;
    private final SdkMeterProvider provider;

    private MeterHandle(Meter meter, SdkMeterProvider provider) {
      this.meter = meter;
      this.provider = provider;
    }

    static MeterHandle noop() {
      return new MeterHandle(MeterProvider.noop().get(INSTRUMENTATION_SCOPE), null);
    }

    Meter meter() {
      return meter;
    }

    boolean isNoop() {
      return provider == null;
    }

    void forceFlush() {
      if (provider != null) {
        await(provider.forceFlush(), "flush");
      }
    }

    @Override
    public void close() {
      if (provider == null) {
        return;
      }
      try {
        await(provider.shutdown(), "shutdown");
      } catch (RuntimeException ex) {
        log.warn("Failed to close OpenTelemetry meter provider cleanly", ex);
      }
    }

    private static void await(CompletableResultCode result, String operation) {
      if (!result.join(5, TimeUnit.SECONDS).isSuccess()) {
        log.warn("OpenTelemetry meter provider {} did not complete within 5 seconds", operation);
      }
    }
  }
}
