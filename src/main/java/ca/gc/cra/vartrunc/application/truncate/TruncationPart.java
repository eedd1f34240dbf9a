package ca.gc.cra.vartrunc.application.truncate;

import ca.gc.cra.vartrunc.domain.value.Value;
import java.util.Objects;

/**
 * Intermediate result of truncating one value to a byte budget.
 *
 * @param value resulting value
 * @param size compact-JSON size of {@code value} in bytes
 * @param truncated whether {@code value} differs from the input
 * @since 0.1.0
 */
public record TruncationPart(Value value, int size, boolean truncated) {
  public TruncationPart {
    Objects.requireNonNull(value, "value");
  }

  static TruncationPart unchanged(Value value, int size) {
    return new TruncationPart(value, size, false);
  }
}
