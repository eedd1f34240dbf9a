package ca.gc.cra.vartrunc.domain.value;

/**
 * JSON {@code null}.
 *
 * @since 0.1.0
 */
public record NullValue() implements Value {
  /** Shared instance. */
  public static final NullValue INSTANCE = new NullValue();

  @Override
  public ValueKind kind() {
    return ValueKind.NULL;
  }
}
