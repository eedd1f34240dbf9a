package ca.gc.cra.vartrunc.domain.value;

/**
 * Discriminator for the {@link Value} variants.
 *
 * <p>Dispatch sites switch over this enum with switch expressions so the compiler rejects a missing variant.</p>
 *
 * @since 0.1.0
 */
public enum ValueKind {
  /** UTF-16 text, measured and sliced by code point. */
  STRING,
  /** Signed 64-bit integer. */
  INTEGER,
  /** IEEE-754 double. */
  FLOAT,
  /** {@code true} or {@code false}. */
  BOOLEAN,
  /** JSON {@code null}. */
  NULL,
  /** Ordered sequence of values. */
  ARRAY,
  /** String-keyed mapping of values. */
  OBJECT;

  /**
   * Indicates whether values of this kind hold nested values.
   *
   * @return {@code true} for {@link #ARRAY} and {@link #OBJECT}
   */
  public boolean isContainer() {
    return this == ARRAY || this == OBJECT;
  }
}
