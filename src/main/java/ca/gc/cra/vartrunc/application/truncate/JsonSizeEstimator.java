package ca.gc.cra.vartrunc.application.truncate;

import ca.gc.cra.vartrunc.domain.value.ArrayValue;
import ca.gc.cra.vartrunc.domain.value.BooleanValue;
import ca.gc.cra.vartrunc.domain.value.FloatValue;
import ca.gc.cra.vartrunc.domain.value.IntegerValue;
import ca.gc.cra.vartrunc.domain.value.MaxDepthExceededException;
import ca.gc.cra.vartrunc.domain.value.ObjectValue;
import ca.gc.cra.vartrunc.domain.value.StringValue;
import ca.gc.cra.vartrunc.domain.value.Value;
import ca.gc.cra.vartrunc.domain.value.Values;
import java.util.Map;

/**
 * <strong>What:</strong> Computes the compact-JSON UTF-8 size of a {@link Value} without serializing it.
 * <p><strong>Why:</strong> Every truncation decision compares sizes against a byte budget; encoding whole payloads
 * for each comparison would dominate the cost.</p>
 * <p><strong>Role:</strong> Leaf utility shared by all truncators and the offload coordinator.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Strings count UTF-8 bytes plus two quotes; escaping is not counted.</li>
 *   <li>Numbers count the characters of {@link Long#toString(long)} or {@link Double#toString(double)}.</li>
 *   <li>Containers add brackets, separating commas and, for objects, quoted keys and colons.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless.</p>
 * <p><strong>Performance:</strong> O(n) in the number of nodes and characters; allocates only number text.</p>
 *
 * @since 0.1.0
 */
public final class JsonSizeEstimator {
  private JsonSizeEstimator() {
    // Utility
  }

  /**
   * Estimates the compact-JSON byte size of {@code value}.
   *
   * @param value value to measure
   * @return size in bytes
   * @throws MaxDepthExceededException if nesting exceeds {@link Values#MAX_DEPTH}
   */
  public static int estimate(Value value) {
    return estimate(value, 0);
  }

  /**
   * Estimates the size of a plain Java object graph by converting it first.
   *
   * @param raw object graph; may be {@code null}
   * @return size in bytes
   * @throws ca.gc.cra.vartrunc.domain.value.UnknownValueTypeException if a node has an unsupported type
   * @throws MaxDepthExceededException if nesting exceeds {@link Values#MAX_DEPTH}
   */
  public static int estimateRaw(Object raw) {
    return estimate(Values.of(raw));
  }

  /**
   * Estimates the size of a string including its quotes.
   *
   * @param text string content
   * @return UTF-8 length plus two
   */
  public static int estimateString(String text) {
    return utf8Length(text) + 2;
  }

  /**
   * Counts the bytes {@code text} occupies in UTF-8 without encoding it. Unpaired surrogates count as three bytes.
   *
   * @param text string content
   * @return UTF-8 byte count
   */
  public static int utf8Length(CharSequence text) {
    int bytes = 0;
    int length = text.length();
    for (int i = 0; i < length; i++) {
      char c = text.charAt(i);
      if (c < 0x80) {
        bytes += 1;
      } else if (c < 0x800) {
        bytes += 2;
      } else if (Character.isHighSurrogate(c) && i + 1 < length && Character.isLowSurrogate(text.charAt(i + 1))) {
        bytes += 4;
        i++;
      } else {
        bytes += 3;
      }
    }
    return bytes;
  }

  /**
   * Returns the JSON text of a float. Non-finite values are quoted names.
   *
   * @param value double value
   * @return JSON text
   */
  static String floatText(double value) {
    if (Double.isFinite(value)) {
      return Double.toString(value);
    }
    return '"' + Double.toString(value) + '"';
  }

  private static int estimate(Value value, int depth) {
    if (depth > Values.MAX_DEPTH) {
      throw new MaxDepthExceededException(depth);
    }
    return switch (value.kind()) {
      case STRING -> estimateString(((StringValue) value).value());
      case INTEGER -> Long.toString(((IntegerValue) value).value()).length();
      case FLOAT -> floatText(((FloatValue) value).value()).length();
      case BOOLEAN -> ((BooleanValue) value).value() ? 4 : 5;
      case NULL -> 4;
      case ARRAY -> {
        ArrayValue array = (ArrayValue) value;
        int total = 2;
        for (Value item : array.items()) {
          total += estimate(item, depth + 1);
        }
        yield total + Math.max(array.size() - 1, 0);
      }
      case OBJECT -> {
        ObjectValue object = (ObjectValue) value;
        int total = 2;
        for (Map.Entry<String, Value> entry : object.entries().entrySet()) {
          total += estimateString(entry.getKey()) + 1 + estimate(entry.getValue(), depth + 1);
        }
        yield total + Math.max(object.size() - 1, 0);
      }
    };
  }
}
