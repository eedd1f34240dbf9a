package ca.gc.cra.vartrunc.domain.value;

/**
 * JSON boolean value.
 *
 * @param value boolean content
 * @since 0.1.0
 */
public record BooleanValue(boolean value) implements Value {
  /** Shared {@code true}. */
  public static final BooleanValue TRUE = new BooleanValue(true);
  /** Shared {@code false}. */
  public static final BooleanValue FALSE = new BooleanValue(false);

  /**
   * Returns the shared instance for {@code value}.
   *
   * @param value boolean content
   * @return shared boolean value
   */
  public static BooleanValue of(boolean value) {
    return value ? TRUE : FALSE;
  }

  @Override
  public ValueKind kind() {
    return ValueKind.BOOLEAN;
  }
}
