package ca.gc.cra.relay.infrastructure.host;

import ca.gc.cra.relay.application.port.ClockPort;
import ca.gc.cra.relay.domain.metric.DataSourceType;
import ca.gc.cra.relay.domain.metric.DataSourceValue;
import ca.gc.cra.relay.domain.metric.MetricRecord;
import ca.gc.cra.relay.logging.Logs;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.JsonToken;
import java.io.BufferedReader;
import java.io.IOException;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads newline-delimited JSON records in the same layout the publisher emits, one object per line:
 * {@code {"values":[..],"dstypes":[..],"dsnames":[..],"time":..,"interval":..,"host":..,"plugin":..,...}}.
 *
 * <p>{@code dstypes} defaults to {@code gauge} for every value and {@code dsnames} to {@code value} (or
 * {@code value0}, {@code value1}, ... for several values). {@code time} defaults to now and {@code interval} to
 * {@value #DEFAULT_INTERVAL_SECONDS} seconds. Malformed lines are logged at WARN and skipped.</p>
 */
public final class NdjsonRecordReader {
  private static final Logger log = LoggerFactory.getLogger(NdjsonRecordReader.class);
  static final double DEFAULT_INTERVAL_SECONDS = 10.0;
  private static final int MAX_LOGGED_LINE_BYTES = 256;

  private final JsonFactory factory = new JsonFactory();
  private final ClockPort clock;

  /**
   * Creates a reader.
   *
   * @param clock supplies the default record time
   */
  public NdjsonRecordReader(ClockPort clock) {
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Reads until end of input, handing each valid record to {@code sink}.
   *
   * @param in line source
   * @param sink record consumer
   * @return number of records handed to {@code sink}
   * @throws IOException if reading fails
   */
  public long readAll(BufferedReader in, Consumer<MetricRecord> sink) throws IOException {
    long accepted = 0;
    long lineNumber = 0;
    String line;
    while ((line = in.readLine()) != null) {
      lineNumber++;
      if (line.isBlank()) {
        continue;
      }
      MetricRecord record;
      try {
        record = parseLine(line);
      } catch (IllegalArgumentException ex) {
        log.warn("Skipping malformed record on line {}: {} ({})",
            lineNumber, ex.getMessage(), Logs.truncate(line, MAX_LOGGED_LINE_BYTES));
        continue;
      }
      sink.accept(record);
      accepted++;
    }
    return accepted;
  }

  /**
   * Parses one JSON object into a record.
   *
   * @param line JSON text
   * @return record
   * @throws IllegalArgumentException if the line is not a valid record
   */
  public MetricRecord parseLine(String line) {
    Objects.requireNonNull(line, "line");
    Fields fields = new Fields();
    try (JsonParser parser = factory.createParser(line)) {
      if (parser.nextToken() != JsonToken.START_OBJECT) {
        throw new IllegalArgumentException("record must be a JSON object");
      }
      JsonToken token;
      while ((token = parser.nextToken()) != JsonToken.END_OBJECT) {
        if (token != JsonToken.FIELD_NAME) {
          throw new IllegalArgumentException("expected field name but found " + token);
        }
        String name = parser.getCurrentName();
        parser.nextToken();
        readField(parser, name, fields);
      }
      if (parser.nextToken() != null) {
        throw new IllegalArgumentException("trailing content after record");
      }
    } catch (JsonProcessingException ex) {
      throw new IllegalArgumentException("invalid JSON: " + ex.getOriginalMessage(), ex);
    } catch (IOException ex) {
      throw new IllegalArgumentException("unreadable record: " + ex.getMessage(), ex);
    }
    return fields.toRecord(clock.nowSeconds());
  }

  private static void readField(JsonParser parser, String name, Fields fields) throws IOException {
    switch (name) {
      case "host" -> fields.host = text(parser, name);
      case "plugin" -> fields.plugin = text(parser, name);
      case "plugin_instance" -> fields.pluginInstance = text(parser, name);
      case "type" -> fields.type = text(parser, name);
      case "type_instance" -> fields.typeInstance = text(parser, name);
      case "time" -> fields.time = number(parser, name);
      case "interval" -> fields.interval = number(parser, name);
      case "values" -> fields.values = numbers(parser, name);
      case "dstypes" -> fields.dstypes = texts(parser, name);
      case "dsnames" -> fields.dsnames = texts(parser, name);
      default -> parser.skipChildren();
    }
  }

  private static String text(JsonParser parser, String name) throws IOException {
    if (parser.currentToken() != JsonToken.VALUE_STRING) {
      throw new IllegalArgumentException(name + " must be a string");
    }
    return parser.getText();
  }

  private static Double number(JsonParser parser, String name) throws IOException {
    if (!parser.currentToken().isNumeric()) {
      throw new IllegalArgumentException(name + " must be a number");
    }
    return parser.getDoubleValue();
  }

  private static List<Number> numbers(JsonParser parser, String name) throws IOException {
    requireArray(parser, name);
    List<Number> result = new ArrayList<>();
    JsonToken token;
    while ((token = parser.nextToken()) != JsonToken.END_ARRAY) {
      if (token == JsonToken.VALUE_NULL) {
        result.add(Double.NaN);
      } else if (token == JsonToken.VALUE_NUMBER_INT) {
        result.add(parser.getNumberValue());
      } else if (token == JsonToken.VALUE_NUMBER_FLOAT) {
        result.add(parser.getDoubleValue());
      } else {
        throw new IllegalArgumentException(name + " must only hold numbers or null");
      }
    }
    return result;
  }

  private static List<String> texts(JsonParser parser, String name) throws IOException {
    requireArray(parser, name);
    List<String> result = new ArrayList<>();
    while (parser.nextToken() != JsonToken.END_ARRAY) {
      result.add(text(parser, name));
    }
    return result;
  }

  private static void requireArray(JsonParser parser, String name) {
    if (parser.currentToken() != JsonToken.START_ARRAY) {
      throw new IllegalArgumentException(name + " must be an array");
    }
  }

  private static final class Fields {
    private String host;
    private String plugin;
    private String pluginInstance;
    private String type;
    private String typeInstance;
    private Double time;
    private Double interval;
    private List<Number> values;
    private List<String> dstypes;
    private List<String> dsnames;

    private MetricRecord toRecord(double nowSeconds) {
      if (host == null || plugin == null || type == null) {
        throw new IllegalArgumentException("host, plugin and type are required");
      }
      if (values == null || values.isEmpty()) {
        throw new IllegalArgumentException("values must hold at least one number");
      }
      if (dstypes != null && dstypes.size() != values.size()) {
        throw new IllegalArgumentException("dstypes must match values in length");
      }
      if (dsnames != null && dsnames.size() != values.size()) {
        throw new IllegalArgumentException("dsnames must match values in length");
      }
      List<DataSourceValue> samples = new ArrayList<>(values.size());
      for (int i = 0; i < values.size(); i++) {
        DataSourceType dsType = dstypes == null ? DataSourceType.GAUGE : DataSourceType.fromWireName(dstypes.get(i));
        String dsName = dsnames != null ? dsnames.get(i) : values.size() == 1 ? "value" : "value" + i;
        Number raw = values.get(i);
        Number value = dsType == DataSourceType.GAUGE ? (Number) raw.doubleValue() : (Number) integral(raw, dsName);
        samples.add(new DataSourceValue(dsName, dsType, value));
      }
      return new MetricRecord(
          host, plugin, pluginInstance, type, typeInstance,
          time == null ? nowSeconds : time,
          interval == null ? DEFAULT_INTERVAL_SECONDS : interval,
          samples);
    }

    private static long integral(Number raw, String dsName) {
      if (raw instanceof Double d && (d.isNaN() || d != Math.rint(d))) {
        throw new IllegalArgumentException("counter value " + dsName + " must be an integer");
      }
      if (raw instanceof BigInteger big) {
        if (big.signum() < 0 || big.bitLength() > 64) {
          throw new IllegalArgumentException("counter value " + dsName + " out of range");
        }
      }
      return raw.longValue();
    }
  }
}
