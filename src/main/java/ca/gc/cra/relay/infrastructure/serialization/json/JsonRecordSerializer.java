package ca.gc.cra.relay.infrastructure.serialization.json;

import ca.gc.cra.relay.application.port.BufferRegion;
import ca.gc.cra.relay.application.port.RecordSerializer;
import ca.gc.cra.relay.domain.error.FramingException;
import ca.gc.cra.relay.domain.metric.DataSourceType;
import ca.gc.cra.relay.domain.metric.DataSourceValue;
import ca.gc.cra.relay.domain.metric.MetricRecord;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.StreamWriteFeature;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;

/**
 * <strong>What:</strong> {@link RecordSerializer} framing a batch as a JSON array of record objects.
 * <p><strong>Why:</strong> Downstream consumers of the {@code collectd} topic expect the collectd JSON layout:
 * {@code [{"values":[..],"dstypes":[..],"dsnames":[..],"time":..,"interval":..,"host":..,...}]}.</p>
 * <p><strong>Role:</strong> Adapter implementing the serializer port; one instance per endpoint.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Keep the region a closed, well-formed array after every successful append.</li>
 *   <li>Reject an append that does not fit without touching the region.</li>
 *   <li>Optionally convert counter-like values to per-second rates.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Not thread-safe; the rate cache is mutated under the endpoint lock.</p>
 *
 * @implNote Each append overwrites the closing {@code ]} with {@code ,<record>]}, so the empty batch {@code []}
 * occupies {@value #EMPTY_FRAMING_SIZE} bytes and a record of up to {@code capacity - 2} bytes fits into an empty
 * buffer.
 * @since 0.1.0
 */
public final class JsonRecordSerializer implements RecordSerializer {
  static final int EMPTY_FRAMING_SIZE = 2;
  private static final byte OPEN = '[';
  private static final byte CLOSE = ']';
  private static final byte[] EMPTY = {OPEN, CLOSE};

  private final JsonFactory jsonFactory =
      JsonFactory.builder().enable(StreamWriteFeature.WRITE_BIGDECIMAL_AS_PLAIN).build();
  private final boolean storeRates;
  private final RateCache rateCache;

  /**
   * Creates a serializer.
   *
   * @param storeRates convert COUNTER, DERIVE and ABSOLUTE values to per-second rates reported as gauges
   */
  public JsonRecordSerializer(boolean storeRates) {
    this.storeRates = storeRates;
    this.rateCache = storeRates ? new RateCache() : null;
  }

  @Override
  public int emptyFramingSize() {
    return EMPTY_FRAMING_SIZE;
  }

  @Override
  public void initFraming(BufferRegion region) throws FramingException {
    if (region.filled() != 0 || !region.writeAt(0, EMPTY)) {
      throw new FramingException("cannot open JSON framing in a " + region.capacity() + "-byte buffer");
    }
  }

  @Override
  public boolean append(BufferRegion region, MetricRecord record) throws FramingException {
    requireClosedArray(region);
    int filled = region.filled();
    byte[] encoded = encode(record);
    boolean first = filled <= EMPTY_FRAMING_SIZE;
    byte[] chunk = new byte[encoded.length + (first ? 1 : 2)];
    int offset = 0;
    if (!first) {
      chunk[offset++] = ',';
    }
    System.arraycopy(encoded, 0, chunk, offset, encoded.length);
    chunk[chunk.length - 1] = CLOSE;
    return region.writeAt(filled - 1, chunk);
  }

  @Override
  public void closeFraming(BufferRegion region) throws FramingException {
    requireClosedArray(region);
  }

  /**
   * Encodes one record as a standalone JSON object.
   *
   * @param record record to encode
   * @return UTF-8 JSON bytes
   * @throws FramingException if the record cannot be encoded
   */
  byte[] encode(MetricRecord record) throws FramingException {
    List<DataSourceValue> values = record.values();
    Double[] rates = storeRates ? rateCache.rates(record) : null;
    ByteArrayOutputStream out = new ByteArrayOutputStream(256);
    try (JsonGenerator gen = jsonFactory.createGenerator(out)) {
      gen.writeStartObject();
      gen.writeArrayFieldStart("values");
      for (int i = 0; i < values.size(); i++) {
        if (rates != null) {
          writeDouble(gen, rates[i]);
        } else {
          writeRaw(gen, values.get(i));
        }
      }
      gen.writeEndArray();
      gen.writeArrayFieldStart("dstypes");
      for (DataSourceValue value : values) {
        gen.writeString(storeRates ? DataSourceType.GAUGE.wireName() : value.type().wireName());
      }
      gen.writeEndArray();
      gen.writeArrayFieldStart("dsnames");
      for (DataSourceValue value : values) {
        gen.writeString(value.name());
      }
      gen.writeEndArray();
      gen.writeFieldName("time");
      gen.writeNumber(seconds(record.timeSeconds()));
      gen.writeFieldName("interval");
      gen.writeNumber(seconds(record.intervalSeconds()));
      gen.writeStringField("host", record.host());
      gen.writeStringField("plugin", record.plugin());
      gen.writeStringField("plugin_instance", record.pluginInstance());
      gen.writeStringField("type", record.type());
      gen.writeStringField("type_instance", record.typeInstance());
      gen.writeEndObject();
    } catch (IOException | IllegalArgumentException ex) {
      throw new FramingException("cannot encode record " + record.identifier() + ": " + ex.getMessage(), ex);
    }
    return out.toByteArray();
  }

  private static void writeRaw(JsonGenerator gen, DataSourceValue value) throws IOException {
    switch (value.type()) {
      case GAUGE -> writeDouble(gen, value.value().doubleValue());
      case DERIVE -> gen.writeNumber(value.value().longValue());
      case COUNTER, ABSOLUTE -> gen.writeNumber(Long.toUnsignedString(value.value().longValue()));
    }
  }

  private static void writeDouble(JsonGenerator gen, Double value) throws IOException {
    if (value == null || value.isNaN() || value.isInfinite()) {
      gen.writeNull();
    } else {
      gen.writeNumber(value.doubleValue());
    }
  }

  private static BigDecimal seconds(double value) {
    if (Double.isNaN(value) || Double.isInfinite(value)) {
      throw new IllegalArgumentException("time values must be finite");
    }
    return BigDecimal.valueOf(value).setScale(3, RoundingMode.HALF_UP);
  }

  private static void requireClosedArray(BufferRegion region) throws FramingException {
    int filled = region.filled();
    if (filled < EMPTY_FRAMING_SIZE || region.byteAt(0) != OPEN || region.byteAt(filled - 1) != CLOSE) {
      throw new FramingException("send buffer does not hold a closed JSON array (" + filled + " bytes)");
    }
  }
}
