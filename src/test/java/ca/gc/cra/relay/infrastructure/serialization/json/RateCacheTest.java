package ca.gc.cra.relay.infrastructure.serialization.json;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

import ca.gc.cra.relay.domain.metric.DataSourceType;
import ca.gc.cra.relay.domain.metric.DataSourceValue;
import ca.gc.cra.relay.domain.metric.MetricRecord;
import ca.gc.cra.relay.testutil.TestRecords;
import java.util.List;
import org.junit.jupiter.api.Test;

class RateCacheTest {

  @Test
  void firstSampleHasNoRate() {
    RateCache cache = new RateCache();

    assertArrayEquals(new Double[] {null}, cache.rates(TestRecords.counter(DataSourceType.COUNTER, 10.0, 5)));
  }

  @Test
  void counterWrapsAt32Bits() {
    assertEquals(32L, RateCache.counterDiff(0xFFFF_FFF0L, 0x10L));
  }

  @Test
  void counterWrapsAt64Bits() {
    assertEquals(32L, RateCache.counterDiff(-16L, 16L));
  }

  @Test
  void ratesPerType() {
    assertEquals(10.0, RateCache.rate(DataSourceType.COUNTER, 100, 200, 10.0));
    assertEquals(-10.0, RateCache.rate(DataSourceType.DERIVE, 200, 100, 10.0));
    assertEquals(5.0, RateCache.rate(DataSourceType.ABSOLUTE, 999, 50, 10.0));
    assertNull(RateCache.rate(DataSourceType.COUNTER, 100, 200, 0.0));
  }

  @Test
  void timeGoingBackwardsYieldsNoRate() {
    RateCache cache = new RateCache();
    cache.rates(TestRecords.counter(DataSourceType.COUNTER, 100.0, 5));

    assertArrayEquals(new Double[] {null}, cache.rates(TestRecords.counter(DataSourceType.COUNTER, 90.0, 10)));
  }

  @Test
  void gaugesPassThroughAlongsideCounters() {
    RateCache cache = new RateCache();
    MetricRecord first = new MetricRecord("h", "p", "", "t", "", 0.0, 10.0, List.of(
        DataSourceValue.gauge("g", 3.5), DataSourceValue.counter("c", DataSourceType.DERIVE, 0)));
    MetricRecord second = new MetricRecord("h", "p", "", "t", "", 10.0, 10.0, List.of(
        DataSourceValue.gauge("g", 4.5), DataSourceValue.counter("c", DataSourceType.DERIVE, 30)));

    assertArrayEquals(new Double[] {3.5, null}, cache.rates(first));
    assertArrayEquals(new Double[] {4.5, 3.0}, cache.rates(second));
  }

  @Test
  void idleEntriesAreEvicted() {
    RateCache cache = new RateCache();
    cache.rates(new MetricRecord("idle", "p", "", "t", "", 0.0, 10.0,
        List.of(DataSourceValue.counter("c", DataSourceType.COUNTER, 1))));
    for (int i = 1; i < 1024; i++) {
      cache.rates(TestRecords.counter(DataSourceType.COUNTER, 1_000.0 + i, i));
    }

    assertEquals(1, cache.size());
  }
}
