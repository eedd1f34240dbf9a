package ca.gc.cra.vartrunc.domain.value;

/**
 * Raised when a Java object outside the JSON-compatible set is converted into a {@link Value}.
 *
 * @since 0.1.0
 */
public final class UnknownValueTypeException extends IllegalArgumentException {
  private static final long serialVersionUID = 1L;

  private final String typeName;

  /**
   * Creates the exception for an unsupported runtime type.
   *
   * @param type offending class
   */
  public UnknownValueTypeException(Class<?> type) {
    super("Unknown value type: " + type.getName());
    this.typeName = type.getName();
  }

  /**
   * Returns the fully qualified name of the unsupported type.
   *
   * @return class name
   */
  public String typeName() {
    return typeName;
  }
}
