package ca.gc.cra.relay.infrastructure.metrics;

import ca.gc.cra.relay.application.port.MetricsPort;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.LongHistogram;
import io.opentelemetry.api.metrics.Meter;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Metrics adapter that forwards RELAY counters and histograms to OpenTelemetry.
 *
 * <p>Instruments are created on first use and cached per metric key. Keys such as
 * {@code relay.local.publish.failure} are lower-cased and stripped of characters OpenTelemetry rejects; the
 * original key is kept as the {@code relay.metric.key} attribute.</p>
 */
public final class OpenTelemetryMetricsAdapter implements MetricsPort, AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(OpenTelemetryMetricsAdapter.class);
  private static final AttributeKey<String> METRIC_KEY_ATTRIBUTE = AttributeKey.stringKey("relay.metric.key");
  private static final String FALLBACK_METRIC_NAME = "relay.metric";

  private final OpenTelemetryBootstrap.MeterHandle handle;
  private final Meter meter;
  private final ConcurrentMap<String, Instrument<LongCounter>> counters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Instrument<LongHistogram>> histograms = new ConcurrentHashMap<>();

  /**
   * Creates an adapter exporting according to {@code settings}.
   *
   * @param settings exporter settings
   */
  public OpenTelemetryMetricsAdapter(MetricsSettings settings) {
    this(OpenTelemetryBootstrap.initialize(settings));
  }

  OpenTelemetryMetricsAdapter(OpenTelemetryBootstrap.MeterHandle handle) {
    this.handle = Objects.requireNonNull(handle, "handle");
    this.meter = handle.meter();
    if (handle.isNoop()) {
      log.info("OpenTelemetry metrics adapter running in noop mode");
    }
  }

  @Override
  public void increment(String key) {
    Instrument<LongCounter> instrument =
        counters.computeIfAbsent(Objects.requireNonNull(key, "key"), this::createCounter);
    instrument.handle().add(1, instrument.attributes());
  }

  @Override
  public void observe(String key, long value) {
    Instrument<LongHistogram> instrument =
        histograms.computeIfAbsent(Objects.requireNonNull(key, "key"), this::createHistogram);
    instrument.handle().record(value, instrument.attributes());
  }

  /**
   * Pushes pending measurements to the exporter.
   */
  public void forceFlush() {
    handle.forceFlush();
  }

  /**
   * Flushes and shuts down the meter provider.
   */
  @Override
  public void close() {
    handle.close();
  }

  private Instrument<LongCounter> createCounter(String key) {
    String name = sanitizeName(key);
    LongCounter counter = meter.counterBuilder(name).setUnit("1").setDescription("RELAY counter for " + key).build();
    return new Instrument<>(counter, Attributes.of(METRIC_KEY_ATTRIBUTE, key));
  }

  private Instrument<LongHistogram> createHistogram(String key) {
    String name = sanitizeName(key);
    LongHistogram histogram = meter.histogramBuilder(name).ofLongs()
        .setUnit(key.endsWith(".bytes") ? "By" : "1")
        .setDescription("RELAY observation for " + key)
        .build();
    return new Instrument<>(histogram, Attributes.of(METRIC_KEY_ATTRIBUTE, key));
  }

  static String sanitizeName(String key) {
    String trimmed = key == null ? "" : key.trim().toLowerCase(Locale.ROOT);
    if (trimmed.isEmpty()) {
      return FALLBACK_METRIC_NAME;
    }
    StringBuilder result = new StringBuilder(trimmed.length() + 1);
    if (!Character.isLetter(trimmed.charAt(0))) {
      result.append('m');
    }
    for (int i = 0; i < trimmed.length(); i++) {
      char c = trimmed.charAt(i);
      result.append(Character.isLetterOrDigit(c) || c == '_' || c == '-' || c == '.' ? c : '_');
    }
    String sanitized = result.toString();
    if (!sanitized.equals(key)) {
      log.debug("Sanitized metric name '{}' -> '{}'", key, sanitized);
    }
    return sanitized;
  }

  private record Instrument<T>(T handle, Attributes attributes) {}
}
