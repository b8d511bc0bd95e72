package ca.gc.cra.relay.infrastructure.metrics;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.sdk.metrics.data.HistogramPointData;
import io.opentelemetry.sdk.metrics.data.LongPointData;
import io.opentelemetry.sdk.metrics.data.MetricData;
import io.opentelemetry.sdk.metrics.data.MetricDataType;
import io.opentelemetry.sdk.testing.exporter.InMemoryMetricReader;
import java.util.Collection;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class OpenTelemetryMetricsAdapterTest {
  private static final AttributeKey<String> METRIC_KEY = AttributeKey.stringKey("relay.metric.key");

  private InMemoryMetricReader reader;
  private OpenTelemetryMetricsAdapter adapter;

  @BeforeEach
  void setUp() {
    reader = InMemoryMetricReader.create();
    adapter = new OpenTelemetryMetricsAdapter(OpenTelemetryBootstrap.forTesting(reader));
  }

  @AfterEach
  void tearDown() {
    if (adapter != null) {
      adapter.close();
    }
  }

  @Test
  void incrementRecordsCounterWithKeyAttribute() {
    adapter.increment("relay.local.publish.success");
    adapter.increment("relay.local.publish.success");
    adapter.forceFlush();

    MetricData counter = find(reader.collectAllMetrics(), "relay.local.publish.success");
    assertEquals(MetricDataType.LONG_SUM, counter.getType());
    LongPointData point = counter.getLongSumData().getPoints().iterator().next();
    assertEquals(2L, point.getValue());
    assertEquals("relay.local.publish.success", point.getAttributes().get(METRIC_KEY));
    assertEquals("relay", counter.getResource().getAttribute(AttributeKey.stringKey("service.name")));
    assertEquals("ca.gc.cra", counter.getResource().getAttribute(AttributeKey.stringKey("service.namespace")));
  }

  @Test
  void observeRecordsBatchSizeHistogramInBytes() {
    adapter.observe("relay.local.batch.bytes", 400);
    adapter.observe("relay.local.batch.bytes", 600);
    adapter.forceFlush();

    MetricData histogram = find(reader.collectAllMetrics(), "relay.local.batch.bytes");
    assertEquals(MetricDataType.HISTOGRAM, histogram.getType());
    assertEquals("By", histogram.getUnit());
    HistogramPointData point = histogram.getHistogramData().getPoints().iterator().next();
    assertEquals(2L, point.getCount());
    assertEquals(1000.0, point.getSum());
  }

  @Test
  void nodeNamesAreSanitizedButKeptAsAttribute() {
    adapter.increment("relay.Lab Broker.connect.failure");
    adapter.forceFlush();

    MetricData counter = find(reader.collectAllMetrics(), "relay.lab_broker.connect.failure");
    LongPointData point = counter.getLongSumData().getPoints().iterator().next();
    assertEquals("relay.Lab Broker.connect.failure", point.getAttributes().get(METRIC_KEY));
    assertEquals("m1.bad", OpenTelemetryMetricsAdapter.sanitizeName("1.bad"));
    assertEquals("relay.metric", OpenTelemetryMetricsAdapter.sanitizeName(" "));
  }

  @Test
  void disabledExporterYieldsNoopAdapter() {
    OpenTelemetryBootstrap.MeterHandle result = OpenTelemetryBootstrap.initialize(MetricsSettings.disabled());
    assertTrue(result.isNoop());

    try (OpenTelemetryMetricsAdapter noop = new OpenTelemetryMetricsAdapter(result)) {
      noop.increment("relay.local.publish.success");
      noop.observe("relay.local.batch.bytes", 10);
      noop.forceFlush();
    }
  }

  @Test
  void parsesResourceAttributesAndSkipsMalformedEntries() {
    Attributes attributes = OpenTelemetryBootstrap.parseResourceAttributes("deployment.environment=prod, broken, =x");

    assertEquals(1, attributes.size());
    assertEquals("prod", attributes.get(AttributeKey.stringKey("deployment.environment")));
  }

  @Test
  void blankSettingsFallBackToEnvironment() {
    Map<String, String> env = Map.of(
        "OTEL_METRICS_EXPORTER", "none",
        "OTEL_EXPORTER_OTLP_ENDPOINT", "http://collector:4317",
        "OTEL_RESOURCE_ATTRIBUTES", "team=ops");

    OpenTelemetryBootstrap.Target fromEnv =
        OpenTelemetryBootstrap.resolve(new MetricsSettings("", " ", ""), env::get);
    OpenTelemetryBootstrap.Target explicit =
        OpenTelemetryBootstrap.resolve(new MetricsSettings("otlp", "http://other:4317", ""), env::get);

    assertFalse(fromEnv.enabled());
    assertEquals("http://collector:4317", fromEnv.endpoint());
    assertEquals("ops", fromEnv.attributes().get(AttributeKey.stringKey("team")));
    assertTrue(explicit.enabled());
    assertEquals("http://other:4317", explicit.endpoint());
  }

  @Test
  void defaultsApplyWithoutSettingsOrEnvironment() {
    OpenTelemetryBootstrap.Target target =
        OpenTelemetryBootstrap.resolve(new MetricsSettings(null, null, null), name -> null);

    assertTrue(target.enabled());
    assertEquals(OpenTelemetryBootstrap.DEFAULT_ENDPOINT, target.endpoint());
    assertTrue(target.attributes().isEmpty());
  }

  private static MetricData find(Collection<MetricData> metrics, String name) {
    return metrics.stream()
        .filter(metric -> metric.getName().equals(name))
        .findFirst()
        .orElseThrow(() -> new AssertionError("metric " + name + " was not exported"));
  }
}
