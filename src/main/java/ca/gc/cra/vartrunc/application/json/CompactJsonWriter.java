package ca.gc.cra.vartrunc.application.json;

import ca.gc.cra.vartrunc.domain.value.ArrayValue;
import ca.gc.cra.vartrunc.domain.value.BooleanValue;
import ca.gc.cra.vartrunc.domain.value.FloatValue;
import ca.gc.cra.vartrunc.domain.value.IntegerValue;
import ca.gc.cra.vartrunc.domain.value.ObjectValue;
import ca.gc.cra.vartrunc.domain.value.StringValue;
import ca.gc.cra.vartrunc.domain.value.Value;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * <strong>What:</strong> Serializes {@link Value} trees to compact JSON (no whitespace, {@code ","} and
 * {@code ":"} separators).
 * <p><strong>Why:</strong> Used for the final-size string fallback and for the bytes uploaded when a payload is
 * offloaded.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Write keys in insertion order, or sorted when a deterministic form is requested.</li>
 *   <li>Write doubles with {@link Double#toString(double)} and non-finite doubles as quoted names.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Thread-safe; the underlying {@link JsonFactory} is shared and generators are
 * per call.</p>
 *
 * @since 0.1.0
 */
public final class CompactJsonWriter {
  private final JsonFactory factory = new JsonFactory();

  /**
   * Writes {@code value} keeping object keys in insertion order.
   *
   * @param value value to serialize
   * @return compact JSON text
   */
  public String write(Value value) {
    return render(value, false);
  }

  /**
   * Writes {@code value} with object keys sorted lexicographically at every level.
   *
   * @param value value to serialize
   * @return deterministic compact JSON text
   */
  public String writeSorted(Value value) {
    return render(value, true);
  }

  /**
   * Writes {@code value} with sorted keys and encodes it as UTF-8.
   *
   * @param value value to serialize
   * @return UTF-8 bytes of the deterministic compact JSON text
   */
  public byte[] toSortedUtf8(Value value) {
    return writeSorted(value).getBytes(StandardCharsets.UTF_8);
  }

  private String render(Value value, boolean sortKeys) {
    StringWriter out = new StringWriter();
    try (JsonGenerator gen = factory.createGenerator(out)) {
      writeValue(gen, value, sortKeys);
    } catch (IOException ex) {
      throw new UncheckedIOException("Failed to serialize value", ex);
    }
    return out.toString();
  }

  private static void writeValue(JsonGenerator gen, Value value, boolean sortKeys) throws IOException {
    switch (value.kind()) {
      case STRING -> gen.writeString(((StringValue) value).value());
      case INTEGER -> gen.writeNumber(((IntegerValue) value).value());
      case FLOAT -> gen.writeNumber(((FloatValue) value).value());
      case BOOLEAN -> gen.writeBoolean(((BooleanValue) value).value());
      case NULL -> gen.writeNull();
      case ARRAY -> {
        gen.writeStartArray();
        for (Value item : ((ArrayValue) value).items()) {
          writeValue(gen, item, sortKeys);
        }
        gen.writeEndArray();
      }
      case OBJECT -> {
        ObjectValue object = (ObjectValue) value;
        gen.writeStartObject();
        if (sortKeys) {
          for (String key : object.sortedKeys()) {
            gen.writeFieldName(key);
            writeValue(gen, object.get(key), true);
          }
        } else {
          for (Map.Entry<String, Value> entry : object.entries().entrySet()) {
            gen.writeFieldName(entry.getKey());
            writeValue(gen, entry.getValue(), false);
          }
        }
        gen.writeEndObject();
      }
    }
  }
}
