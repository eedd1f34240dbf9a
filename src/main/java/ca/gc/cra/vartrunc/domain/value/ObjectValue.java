package ca.gc.cra.vartrunc.domain.value;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * JSON object value.
 *
 * <p>Entries keep the caller's insertion order; equality follows {@link Map#equals(Object)} and therefore
 * ignores order.</p>
 *
 * @param entries key/value pairs; copied on construction, {@code null} keys or values rejected
 * @since 0.1.0
 */
public record ObjectValue(Map<String, Value> entries) implements Value {
  /** Shared empty object. */
  public static final ObjectValue EMPTY = new ObjectValue(Map.of());

  public ObjectValue {
    Map<String, Value> copy = new LinkedHashMap<>();
    for (Map.Entry<String, Value> entry : entries.entrySet()) {
      copy.put(
          Objects.requireNonNull(entry.getKey(), "key"),
          Objects.requireNonNull(entry.getValue(), "value for key " + entry.getKey()));
    }
    entries = Collections.unmodifiableMap(copy);
  }

  /**
   * Returns the number of entries.
   *
   * @return entry count
   */
  public int size() {
    return entries.size();
  }

  /**
   * Returns the value mapped to {@code key}.
   *
   * @param key entry key
   * @return value or {@code null} when absent
   */
  public Value get(String key) {
    return entries.get(key);
  }

  /**
   * Returns the keys sorted in natural {@link String} order.
   *
   * @return new list of sorted keys
   */
  public List<String> sortedKeys() {
    List<String> keys = new ArrayList<>(entries.keySet());
    Collections.sort(keys);
    return keys;
  }

  @Override
  public ValueKind kind() {
    return ValueKind.OBJECT;
  }
}
