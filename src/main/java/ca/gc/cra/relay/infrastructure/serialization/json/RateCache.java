package ca.gc.cra.relay.infrastructure.serialization.json;

import ca.gc.cra.relay.domain.metric.DataSourceType;
import ca.gc.cra.relay.domain.metric.DataSourceValue;
import ca.gc.cra.relay.domain.metric.MetricRecord;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Converts counter-like samples into per-second rates using the previous sample of the same identifier.
 *
 * <p>COUNTER values wrap at 2<sup>32</sup> when the previous reading fit in 32 bits, otherwise at
 * 2<sup>64</sup>. DERIVE rates may be negative. ABSOLUTE values are divided by the elapsed time. GAUGE values pass
 * through unchanged. The first sample of an identifier yields {@code null} rates.</p>
 *
 * <p>Not thread-safe; owned by one serializer and used under its endpoint lock.</p>
 */
final class RateCache {
  static final long EVICT_AFTER_SECONDS = 900;
  private static final int EVICT_CHECK_EVERY = 1024;

  private final Map<String, Entry> entries = new HashMap<>();
  private int updatesSinceEvict;

  /**
   * Returns one rate per data-source value; {@code null} where no rate can be computed yet.
   *
   * @param record current sample
   * @return rates aligned with {@link MetricRecord#values()}
   */
  Double[] rates(MetricRecord record) {
    List<DataSourceValue> values = record.values();
    String key = record.identifier();
    Entry previous = entries.get(key);
    if (previous != null && previous.raw.length == values.size()) {
      if (previous.time == record.timeSeconds()) {
        return previous.rates.clone();
      }
      if (record.timeSeconds() < previous.time) {
        return new Double[values.size()];
      }
    }

    Double[] rates = new Double[values.size()];
    long[] raw = new long[values.size()];
    for (int i = 0; i < values.size(); i++) {
      DataSourceValue value = values.get(i);
      raw[i] = value.type() == DataSourceType.GAUGE ? 0L : value.value().longValue();
      if (value.type() == DataSourceType.GAUGE) {
        double gauge = value.value().doubleValue();
        rates[i] = Double.isNaN(gauge) ? null : gauge;
      } else if (previous != null && previous.raw.length == values.size()) {
        double elapsed = record.timeSeconds() - previous.time;
        rates[i] = rate(value.type(), previous.raw[i], raw[i], elapsed);
      }
    }
    entries.put(key, new Entry(record.timeSeconds(), raw, rates));
    maybeEvict(record.timeSeconds());
    return rates.clone();
  }

  int size() {
    return entries.size();
  }

  static Double rate(DataSourceType type, long previous, long current, double elapsedSeconds) {
    if (elapsedSeconds <= 0) {
      return null;
    }
    return switch (type) {
      case COUNTER -> unsigned(counterDiff(previous, current)) / elapsedSeconds;
      case DERIVE -> (double) (current - previous) / elapsedSeconds;
      case ABSOLUTE -> unsigned(current) / elapsedSeconds;
      case GAUGE -> (double) current;
    };
  }

  static long counterDiff(long previous, long current) {
    if (Long.compareUnsigned(previous, current) <= 0) {
      return current - previous;
    }
    if (Long.compareUnsigned(previous, 0xFFFF_FFFFL) <= 0) {
      return (1L << 32) - previous + current;
    }
    // 64-bit wrap: two's complement subtraction already yields the unsigned distance
    return current - previous;
  }

  private static double unsigned(long value) {
    if (value >= 0) {
      return value;
    }
    return (double) (value >>> 1) * 2.0 + (value & 1L);
  }

  private void maybeEvict(double nowSeconds) {
    if (++updatesSinceEvict < EVICT_CHECK_EVERY) {
      return;
    }
    updatesSinceEvict = 0;
    Iterator<Entry> it = entries.values().iterator();
    while (it.hasNext()) {
      if (nowSeconds - it.next().time > EVICT_AFTER_SECONDS) {
        it.remove();
      }
    }
  }

  private record Entry(double time, long[] raw, Double[] rates) {}
}
