package ca.gc.cra.relay.testutil;

import ca.gc.cra.relay.domain.metric.DataSourceType;
import ca.gc.cra.relay.domain.metric.DataSourceValue;
import ca.gc.cra.relay.domain.metric.MetricRecord;
import java.util.List;

/** Builders for sample records. */
public final class TestRecords {
  private TestRecords() {}

  public static MetricRecord gauge(String typeInstance, double value) {
    return new MetricRecord("web01", "cpu", "0", "percent", typeInstance, 1_700_000_000.0, 10.0,
        List.of(DataSourceValue.gauge("value", value)));
  }

  public static MetricRecord counter(DataSourceType type, double timeSeconds, long value) {
    return new MetricRecord("web01", "interface", "eth0", "if_octets", "", timeSeconds, 10.0,
        List.of(DataSourceValue.counter("rx", type, value)));
  }

  /** A gauge record whose type instance is {@code padding} characters long, to control the encoded size. */
  public static MetricRecord padded(int padding) {
    return new MetricRecord("web01", "cpu", "0", "percent", "x".repeat(padding), 1_700_000_000.0, 10.0,
        List.of(DataSourceValue.gauge("value", 1.0)));
  }
}
