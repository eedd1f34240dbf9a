package ca.gc.cra.vartrunc.domain.segment;

import ca.gc.cra.vartrunc.domain.value.StringValue;
import java.util.Objects;

/**
 * String segment.
 *
 * @param value string content
 * @since 0.1.0
 */
public record StringSegment(StringValue value) implements Segment {
  public StringSegment {
    Objects.requireNonNull(value, "value");
  }

  /**
   * Creates a string segment.
   *
   * @param text string content
   * @return segment
   */
  public static StringSegment of(String text) {
    return new StringSegment(StringValue.of(text));
  }

  /**
   * Returns the raw text.
   *
   * @return string content
   */
  public String text() {
    return value.value();
  }

  @Override
  public SegmentType type() {
    return SegmentType.STRING;
  }
}
