package ca.gc.cra.relay.infrastructure.metrics;

/**
 * Metrics exporter settings resolved from CLI and YAML; blank fields defer to {@code OTEL_*} environment variables.
 *
 * @param exporter {@code otlp} or {@code none}
 * @param endpoint OTLP gRPC endpoint URI
 * @param resourceAttributes extra {@code key=value} resource attributes, comma separated
 * @since 0.1.0
 */
public record MetricsSettings(String exporter, String endpoint, String resourceAttributes) {

  /**
   * Settings that disable export entirely.
   *
   * @return exporter {@code none}
   */
  public static MetricsSettings disabled() {
    return new MetricsSettings("none", "", "");
  }
}
