package ca.gc.cra.relay.infrastructure.host;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.relay.domain.metric.DataSourceType;
import ca.gc.cra.relay.domain.metric.DataSourceValue;
import ca.gc.cra.relay.domain.metric.MetricRecord;
import ca.gc.cra.relay.testutil.LogCapture;
import ca.gc.cra.relay.testutil.ManualClock;
import ch.qos.logback.classic.Level;
import com.fasterxml.jackson.core.JsonProcessingException;
import java.io.BufferedReader;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class NdjsonRecordReaderTest {

  private final NdjsonRecordReader reader = new NdjsonRecordReader(new ManualClock(1_700_000_123_500L));

  @Test
  void parsesFullRecord() {
    MetricRecord record = reader.parseLine("""
        {"values":[1024,2048],"dstypes":["derive","derive"],"dsnames":["rx","tx"],"time":1700000000.25,\
        "interval":10,"host":"web01","plugin":"interface","plugin_instance":"eth0","type":"if_octets",\
        "type_instance":"","meta":{"ignored":[1,2]}}""");

    assertEquals("web01/interface-eth0/if_octets", record.identifier());
    assertEquals(1_700_000_000.25, record.timeSeconds());
    assertEquals(10.0, record.intervalSeconds());
    assertEquals(List.of(
        DataSourceValue.counter("rx", DataSourceType.DERIVE, 1024),
        DataSourceValue.counter("tx", DataSourceType.DERIVE, 2048)), record.values());
  }

  @Test
  void appliesDefaultsForOptionalFields() {
    MetricRecord single = reader.parseLine("{\"values\":[0.5],\"host\":\"h\",\"plugin\":\"load\",\"type\":\"load\"}");
    MetricRecord multi = reader.parseLine("{\"values\":[1,2],\"host\":\"h\",\"plugin\":\"load\",\"type\":\"load\"}");

    assertEquals(List.of(DataSourceValue.gauge("value", 0.5)), single.values());
    assertEquals(1_700_000_123.5, single.timeSeconds());
    assertEquals(NdjsonRecordReader.DEFAULT_INTERVAL_SECONDS, single.intervalSeconds());
    assertEquals("value0", multi.values().get(0).name());
    assertEquals("value1", multi.values().get(1).name());
    assertEquals(DataSourceType.GAUGE, multi.values().get(1).type());
  }

  @Test
  void nullGaugeBecomesNaN() {
    MetricRecord record = reader.parseLine("{\"values\":[null],\"host\":\"h\",\"plugin\":\"p\",\"type\":\"t\"}");

    assertTrue(Double.isNaN(record.values().get(0).value().doubleValue()));
  }

  @Test
  void unsignedCounterAboveLongRangeIsAccepted() {
    MetricRecord record = reader.parseLine(
        "{\"values\":[18446744073709551615],\"dstypes\":[\"counter\"],\"host\":\"h\",\"plugin\":\"p\",\"type\":\"t\"}");

    assertEquals(-1L, record.values().get(0).value().longValue());
  }

  @ParameterizedTest
  @ValueSource(strings = {
      "[1,2,3]",
      "{\"values\":[1],\"plugin\":\"p\",\"type\":\"t\"}",
      "{\"values\":[],\"host\":\"h\",\"plugin\":\"p\",\"type\":\"t\"}",
      "{\"values\":[\"1\"],\"host\":\"h\",\"plugin\":\"p\",\"type\":\"t\"}",
      "{\"values\":[1,2],\"dstypes\":[\"gauge\"],\"host\":\"h\",\"plugin\":\"p\",\"type\":\"t\"}",
      "{\"values\":[1.5],\"dstypes\":[\"counter\"],\"host\":\"h\",\"plugin\":\"p\",\"type\":\"t\"}",
      "{\"values\":[1],\"dstypes\":[\"histogram\"],\"host\":\"h\",\"plugin\":\"p\",\"type\":\"t\"}",
      "{\"values\":[1],\"host\":7,\"plugin\":\"p\",\"type\":\"t\"}",
      "{\"values\":[1],\"host\":\"h\",\"plugin\":\"p\",\"type\":\"t\"} {}",
      "{\"values\":[1],"
  })
  void rejectsMalformedRecords(String line) {
    assertThrows(IllegalArgumentException.class, () -> reader.parseLine(line));
  }

  @Test
  void truncatedJsonReportsParserMessage() {
    IllegalArgumentException ex = assertThrows(
        IllegalArgumentException.class, () -> reader.parseLine("{\"values\":[1,"));

    assertTrue(ex.getMessage().startsWith("invalid JSON: "), ex.getMessage());
    assertTrue(ex.getCause() instanceof JsonProcessingException);
  }

  @Test
  void readAllSkipsBlankAndMalformedLines() throws Exception {
    String input = """
        {"values":[1],"host":"h","plugin":"cpu","type":"percent"}

        not json
        {"values":[2],"host":"h","plugin":"cpu","type":"percent"}
        """;
    List<MetricRecord> records = new ArrayList<>();

    long accepted;
    try (LogCapture logs = LogCapture.of(NdjsonRecordReader.class)) {
      accepted = reader.readAll(new BufferedReader(new StringReader(input)), records::add);
      assertTrue(logs.contains(Level.WARN, "line 3"));
    }

    assertEquals(2, accepted);
    assertEquals(2.0, records.get(1).values().get(0).value().doubleValue());
  }
}
