package ca.gc.cra.vartrunc.domain.segment;

import ca.gc.cra.vartrunc.domain.value.FloatValue;
import java.util.Objects;

/**
 * Float segment; passed through untouched.
 *
 * @param value float content
 * @since 0.1.0
 */
public record FloatSegment(FloatValue value) implements Segment {
  public FloatSegment {
    Objects.requireNonNull(value, "value");
  }

  @Override
  public SegmentType type() {
    return SegmentType.FLOAT;
  }
}
