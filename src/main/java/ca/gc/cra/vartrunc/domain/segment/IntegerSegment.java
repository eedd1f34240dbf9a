package ca.gc.cra.vartrunc.domain.segment;

import ca.gc.cra.vartrunc.domain.value.BooleanValue;
import ca.gc.cra.vartrunc.domain.value.IntegerValue;
import ca.gc.cra.vartrunc.domain.value.Value;
import java.util.Objects;

/**
 * Integer segment. Booleans are accepted because they are integers in the originating payload model; the
 * dispatcher coerces them to {@code 0} or {@code 1}.
 *
 * @param value {@link IntegerValue} or {@link BooleanValue}
 * @since 0.1.0
 */
public record IntegerSegment(Value value) implements Segment {
  public IntegerSegment {
    Objects.requireNonNull(value, "value");
    if (!(value instanceof IntegerValue) && !(value instanceof BooleanValue)) {
      throw new IllegalArgumentException("IntegerSegment requires an integer or boolean value, got " + value.kind());
    }
  }

  /**
   * Creates an integer segment.
   *
   * @param value integer content
   * @return segment
   */
  public static IntegerSegment of(long value) {
    return new IntegerSegment(IntegerValue.of(value));
  }

  /**
   * Creates an integer segment holding a boolean.
   *
   * @param value boolean content
   * @return segment
   */
  public static IntegerSegment ofBoolean(boolean value) {
    return new IntegerSegment(BooleanValue.of(value));
  }

  @Override
  public SegmentType type() {
    return SegmentType.INTEGER;
  }
}
