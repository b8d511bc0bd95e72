package ca.gc.cra.relay.api;

import ca.gc.cra.relay.infrastructure.metrics.MetricsSettings;
import ca.gc.cra.relay.validation.Strings;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Validates the telemetry settings of the effective configuration and turns them into {@link MetricsSettings}.
 */
final class TelemetryConfigurator {
  private static final Logger log = LoggerFactory.getLogger(TelemetryConfigurator.class);
  private static final int MAX_RESOURCE_ATTRIBUTES_LENGTH = 4_096;

  private TelemetryConfigurator() {}

  static MetricsSettings metricsSettings(Map<String, String> effective) {
    String exporter = value(effective, "metricsExporter").toLowerCase(Locale.ROOT);
    if (exporter.isEmpty()) {
      exporter = "otlp";
    }
    if (!exporter.equals("otlp") && !exporter.equals("none")) {
      throw new IllegalArgumentException("metricsExporter must be 'otlp' or 'none'");
    }

    String endpoint = value(effective, "otelEndpoint");
    if (!endpoint.isEmpty()) {
      validateEndpoint(endpoint);
    }

    String resourceAttributes = value(effective, "otelResourceAttributes");
    if (!resourceAttributes.isEmpty()) {
      Strings.requirePrintableAscii("otelResourceAttributes", resourceAttributes, MAX_RESOURCE_ATTRIBUTES_LENGTH);
    }
    log.debug("Metrics exporter {} (endpoint {})", exporter, endpoint.isEmpty() ? "<default>" : endpoint);
    return new MetricsSettings(exporter, endpoint, resourceAttributes);
  }

  private static void validateEndpoint(String raw) {
    URI uri;
    try {
      uri = new URI(raw);
    } catch (URISyntaxException ex) {
      throw new IllegalArgumentException("otelEndpoint must be a valid URI", ex);
    }
    String scheme = uri.getScheme();
    if (scheme == null || (!scheme.equalsIgnoreCase("http") && !scheme.equalsIgnoreCase("https"))) {
      throw new IllegalArgumentException("otelEndpoint must use http or https scheme");
    }
    if (uri.getHost() == null || uri.getHost().isBlank()) {
      throw new IllegalArgumentException("otelEndpoint must include a host");
    }
  }

  private static String value(Map<String, String> map, String key) {
    String raw = map.get(key);
    return raw == null ? "" : raw.trim();
  }
}
