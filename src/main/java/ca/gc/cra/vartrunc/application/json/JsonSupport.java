package ca.gc.cra.vartrunc.application.json;

import ca.gc.cra.vartrunc.domain.value.ArrayValue;
import ca.gc.cra.vartrunc.domain.value.BooleanValue;
import ca.gc.cra.vartrunc.domain.value.FloatValue;
import ca.gc.cra.vartrunc.domain.value.IntegerValue;
import ca.gc.cra.vartrunc.domain.value.MaxDepthExceededException;
import ca.gc.cra.vartrunc.domain.value.NullValue;
import ca.gc.cra.vartrunc.domain.value.ObjectValue;
import ca.gc.cra.vartrunc.domain.value.StringValue;
import ca.gc.cra.vartrunc.domain.value.Value;
import ca.gc.cra.vartrunc.domain.value.Values;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Minimal JSON helper that parses documents into {@link Value} trees.
 *
 * <p>Integers that fit a {@code long} become {@link IntegerValue}s; larger integers and decimals become
 * {@link FloatValue}s.</p>
 *
 * @since 0.1.0
 */
public final class JsonSupport {
  private final JsonFactory factory = new JsonFactory();

  /**
   * Parses the supplied JSON document.
   *
   * @param json JSON document; never {@code null}
   * @return parsed value; an empty document yields an empty object
   * @throws IllegalArgumentException when parsing fails or the document has trailing content
   * @throws MaxDepthExceededException when the document nests deeper than {@link Values#MAX_DEPTH}
   */
  public Value parse(String json) {
    Objects.requireNonNull(json, "json");
    try (JsonParser parser = factory.createParser(json)) {
      JsonToken token = parser.nextToken();
      if (token == null) {
        return ObjectValue.EMPTY;
      }
      Value value = readValue(parser, token, 0);
      JsonToken trailing = parser.nextToken();
      if (trailing != null && trailing != JsonToken.NOT_AVAILABLE) {
        throw new IllegalArgumentException("JSON document contains trailing content");
      }
      return value;
    } catch (IOException ex) {
      throw new IllegalArgumentException("Invalid JSON payload", ex);
    }
  }

  /**
   * Parses a JSON object into a plain insertion-ordered map.
   *
   * @param json JSON document whose root is an object
   * @return mutable map of plain Java values
   * @throws IllegalArgumentException when the root is not an object or parsing fails
   */
  public Map<String, Object> parseObject(String json) {
    Value value = parse(json);
    if (!(value instanceof ObjectValue object)) {
      throw new IllegalArgumentException("Expected a JSON object but found " + value.kind());
    }
    return Values.toJavaMap(object);
  }

  private Value readValue(JsonParser parser, JsonToken token, int depth) throws IOException {
    if (depth > Values.MAX_DEPTH) {
      throw new MaxDepthExceededException(depth);
    }
    return switch (token) {
      case START_OBJECT -> readObject(parser, depth);
      case START_ARRAY -> readArray(parser, depth);
      case VALUE_STRING -> StringValue.of(parser.getText());
      case VALUE_NUMBER_INT -> readInteger(parser);
      case VALUE_NUMBER_FLOAT -> FloatValue.of(parser.getDoubleValue());
      case VALUE_TRUE -> BooleanValue.TRUE;
      case VALUE_FALSE -> BooleanValue.FALSE;
      case VALUE_NULL -> NullValue.INSTANCE;
      default -> throw new IllegalArgumentException("Unsupported JSON token: " + token);
    };
  }

  private static Value readInteger(JsonParser parser) throws IOException {
    if (parser.getNumberType() == JsonParser.NumberType.BIG_INTEGER) {
      return FloatValue.of(parser.getDoubleValue());
    }
    return IntegerValue.of(parser.getLongValue());
  }

  private ObjectValue readObject(JsonParser parser, int depth) throws IOException {
    Map<String, Value> map = new LinkedHashMap<>();
    while (true) {
      JsonToken token = parser.nextToken();
      if (token == JsonToken.END_OBJECT) {
        break;
      }
      if (token != JsonToken.FIELD_NAME) {
        throw new IllegalArgumentException("Expected field name but found " + token);
      }
      String fieldName = parser.currentName();
      JsonToken valueToken = parser.nextToken();
      map.put(fieldName, readValue(parser, valueToken, depth + 1));
    }
    return new ObjectValue(map);
  }

  private ArrayValue readArray(JsonParser parser, int depth) throws IOException {
    List<Value> list = new ArrayList<>();
    while (true) {
      JsonToken token = parser.nextToken();
      if (token == JsonToken.END_ARRAY) {
        break;
      }
      list.add(readValue(parser, token, depth + 1));
    }
    return new ArrayValue(list);
  }
}
