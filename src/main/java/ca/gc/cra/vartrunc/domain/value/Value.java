package ca.gc.cra.vartrunc.domain.value;

/**
 * <strong>What:</strong> A JSON-compatible value: string, integer, float, boolean, null, array or object.
 * <p><strong>Why:</strong> Truncation must handle every variant explicitly; a sealed hierarchy makes the set
 * closed so estimators and truncators cannot silently skip a case.</p>
 * <p><strong>Role:</strong> Domain value consumed by {@code JsonSizeEstimator}, {@code ValueTruncator} and
 * {@code CompactJsonWriter}.</p>
 * <p><strong>Thread-safety:</strong> Every implementation is an immutable record.</p>
 *
 * @since 0.1.0
 * @see Values
 */
public sealed interface Value
    permits StringValue, IntegerValue, FloatValue, BooleanValue, NullValue, ArrayValue, ObjectValue {

  /**
   * Returns the variant tag of this value.
   *
   * @return non-null kind
   */
  ValueKind kind();
}
