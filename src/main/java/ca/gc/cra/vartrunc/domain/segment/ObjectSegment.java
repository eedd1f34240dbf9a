package ca.gc.cra.vartrunc.domain.segment;

import ca.gc.cra.vartrunc.domain.value.ObjectValue;
import java.util.Objects;

/**
 * Object segment.
 *
 * @param value object content
 * @since 0.1.0
 */
public record ObjectSegment(ObjectValue value) implements Segment {
  public ObjectSegment {
    Objects.requireNonNull(value, "value");
  }

  @Override
  public SegmentType type() {
    return SegmentType.OBJECT;
  }
}
