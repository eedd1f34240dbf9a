package ca.gc.cra.vartrunc.domain.value;

/**
 * JSON floating point value.
 *
 * @param value double value; non-finite values are written as quoted names
 * @since 0.1.0
 */
public record FloatValue(double value) implements Value {

  /**
   * Creates a float value.
   *
   * @param value numeric value
   * @return float value
   */
  public static FloatValue of(double value) {
    return new FloatValue(value);
  }

  @Override
  public ValueKind kind() {
    return ValueKind.FLOAT;
  }
}
