package ca.gc.cra.vartrunc.domain.value;

/**
 * JSON integer value.
 *
 * @param value signed 64-bit value
 * @since 0.1.0
 */
public record IntegerValue(long value) implements Value {

  /**
   * Creates an integer value.
   *
   * @param value numeric value
   * @return integer value
   */
  public static IntegerValue of(long value) {
    return new IntegerValue(value);
  }

  @Override
  public ValueKind kind() {
    return ValueKind.INTEGER;
  }
}
