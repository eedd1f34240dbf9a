package ca.gc.cra.vartrunc.domain.segment;

import ca.gc.cra.vartrunc.domain.value.ArrayValue;
import java.util.Objects;

/**
 * Array segment.
 *
 * @param value array content
 * @since 0.1.0
 */
public record ArraySegment(ArrayValue value) implements Segment {
  public ArraySegment {
    Objects.requireNonNull(value, "value");
  }

  @Override
  public SegmentType type() {
    return SegmentType.ARRAY;
  }
}
