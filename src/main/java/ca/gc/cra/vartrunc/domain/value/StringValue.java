package ca.gc.cra.vartrunc.domain.value;

import java.util.Objects;

/**
 * JSON string value.
 *
 * @param value string content; never {@code null}
 * @since 0.1.0
 */
public record StringValue(String value) implements Value {
  /** Shared empty string value. */
  public static final StringValue EMPTY = new StringValue("");

  public StringValue {
    Objects.requireNonNull(value, "value");
  }

  /**
   * Creates a string value.
   *
   * @param value string content; must not be {@code null}
   * @return string value
   */
  public static StringValue of(String value) {
    return value.isEmpty() ? EMPTY : new StringValue(value);
  }

  /**
   * Returns the number of Unicode code points in the content.
   *
   * @return code point count
   */
  public int codePointLength() {
    return value.codePointCount(0, value.length());
  }

  @Override
  public ValueKind kind() {
    return ValueKind.STRING;
  }
}
