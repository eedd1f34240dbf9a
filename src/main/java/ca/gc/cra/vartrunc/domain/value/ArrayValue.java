package ca.gc.cra.vartrunc.domain.value;

import java.util.Arrays;
import java.util.List;

/**
 * JSON array value.
 *
 * @param items elements in order; copied on construction, {@code null} elements rejected
 * @since 0.1.0
 */
public record ArrayValue(List<Value> items) implements Value {
  /** Shared empty array. */
  public static final ArrayValue EMPTY = new ArrayValue(List.of());

  public ArrayValue {
    items = List.copyOf(items);
  }

  /**
   * Creates an array value from the supplied elements.
   *
   * @param items elements in order
   * @return array value
   */
  public static ArrayValue of(Value... items) {
    return new ArrayValue(Arrays.asList(items));
  }

  /**
   * Returns the element count.
   *
   * @return number of elements
   */
  public int size() {
    return items.size();
  }

  /**
   * Returns the element at {@code index}.
   *
   * @param index zero-based position
   * @return element
   */
  public Value get(int index) {
    return items.get(index);
  }

  @Override
  public ValueKind kind() {
    return ValueKind.ARRAY;
  }
}
