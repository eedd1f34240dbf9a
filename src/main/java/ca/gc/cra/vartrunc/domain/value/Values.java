package ca.gc.cra.vartrunc.domain.value;

import java.lang.reflect.Array;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * <strong>What:</strong> Conversions between plain Java object graphs and {@link Value} trees.
 * <p><strong>Why:</strong> Execution payloads arrive as {@code Map<String, Object>} graphs; the truncator works on
 * the closed {@link Value} model.</p>
 * <p><strong>Role:</strong> Domain utility used by the dispatcher, the offload coordinator and the CLI.</p>
 * <p><strong>Thread-safety:</strong> Stateless.</p>
 *
 * @since 0.1.0
 */
public final class Values {
  /** Deepest nesting level accepted by conversion and size estimation; the root sits at depth 0. */
  public static final int MAX_DEPTH = 20;

  private Values() {
    // Utility
  }

  /**
   * Converts a Java object graph into a {@link Value}.
   *
   * <p>Accepted: {@code null}, {@link Value}, {@link CharSequence}, {@link Character}, {@link Boolean},
   * integral {@link Number}s that fit a {@code long}, other {@link Number}s (as doubles), {@link Map} with string
   * keys, {@link Collection} and Java arrays.</p>
   *
   * @param raw object graph; may be {@code null}
   * @return converted value
   * @throws UnknownValueTypeException if a node has an unsupported type or a map has a non-string key
   * @throws MaxDepthExceededException if nesting exceeds {@link #MAX_DEPTH}
   */
  public static Value of(Object raw) {
    return convert(raw, 0);
  }

  /**
   * Converts a string-keyed map into an {@link ObjectValue}.
   *
   * @param raw map; {@code null} yields an empty object
   * @return object value
   */
  public static ObjectValue ofMap(Map<String, ?> raw) {
    if (raw == null) {
      return ObjectValue.EMPTY;
    }
    return (ObjectValue) convert(raw, 0);
  }

  /**
   * Converts a {@link Value} back into plain Java objects.
   *
   * <p>Objects become insertion-ordered {@link LinkedHashMap}s, arrays become {@link ArrayList}s, scalars become
   * {@link String}, {@link Long}, {@link Double}, {@link Boolean} or {@code null}.</p>
   *
   * @param value value to convert; must not be {@code null}
   * @return Java representation
   */
  public static Object toJava(Value value) {
    return switch (value.kind()) {
      case STRING -> ((StringValue) value).value();
      case INTEGER -> ((IntegerValue) value).value();
      case FLOAT -> ((FloatValue) value).value();
      case BOOLEAN -> ((BooleanValue) value).value();
      case NULL -> null;
      case ARRAY -> {
        List<Object> out = new ArrayList<>();
        for (Value item : ((ArrayValue) value).items()) {
          out.add(toJava(item));
        }
        yield out;
      }
      case OBJECT -> toJavaMap((ObjectValue) value);
    };
  }

  /**
   * Converts an {@link ObjectValue} into an insertion-ordered map.
   *
   * @param value object value
   * @return mutable map copy
   */
  public static Map<String, Object> toJavaMap(ObjectValue value) {
    Map<String, Object> out = new LinkedHashMap<>();
    for (Map.Entry<String, Value> entry : value.entries().entrySet()) {
      out.put(entry.getKey(), toJava(entry.getValue()));
    }
    return out;
  }

  private static Value convert(Object raw, int depth) {
    if (depth > MAX_DEPTH) {
      throw new MaxDepthExceededException(depth);
    }
    if (raw == null) {
      return NullValue.INSTANCE;
    }
    if (raw instanceof Value value) {
      return value;
    }
    if (raw instanceof CharSequence text) {
      return StringValue.of(text.toString());
    }
    if (raw instanceof Character ch) {
      return StringValue.of(String.valueOf(ch));
    }
    if (raw instanceof Boolean bool) {
      return BooleanValue.of(bool);
    }
    if (raw instanceof Number number) {
      return convertNumber(number);
    }
    if (raw instanceof Map<?, ?> map) {
      Map<String, Value> entries = new LinkedHashMap<>();
      for (Map.Entry<?, ?> entry : map.entrySet()) {
        if (!(entry.getKey() instanceof String key)) {
          Object offending = entry.getKey();
          throw new UnknownValueTypeException(offending == null ? Void.class : offending.getClass());
        }
        entries.put(key, convert(entry.getValue(), depth + 1));
      }
      return new ObjectValue(entries);
    }
    if (raw instanceof Collection<?> collection) {
      List<Value> items = new ArrayList<>(collection.size());
      for (Object item : collection) {
        items.add(convert(item, depth + 1));
      }
      return new ArrayValue(items);
    }
    if (raw.getClass().isArray()) {
      int length = Array.getLength(raw);
      List<Value> items = new ArrayList<>(length);
      for (int i = 0; i < length; i++) {
        items.add(convert(Array.get(raw, i), depth + 1));
      }
      return new ArrayValue(items);
    }
    throw new UnknownValueTypeException(raw.getClass());
  }

  private static Value convertNumber(Number number) {
    if (number instanceof Long
        || number instanceof Integer
        || number instanceof Short
        || number instanceof Byte) {
      return IntegerValue.of(number.longValue());
    }
    if (number instanceof BigInteger big && big.bitLength() < Long.SIZE) {
      return IntegerValue.of(big.longValue());
    }
    if (number instanceof BigDecimal decimal && decimal.scale() <= 0) {
      try {
        return IntegerValue.of(decimal.longValueExact());
      } catch (ArithmeticException ex) {
        return FloatValue.of(decimal.doubleValue());
      }
    }
    return FloatValue.of(number.doubleValue());
  }
}
