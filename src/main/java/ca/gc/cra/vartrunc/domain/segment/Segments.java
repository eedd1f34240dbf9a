package ca.gc.cra.vartrunc.domain.segment;

import ca.gc.cra.vartrunc.domain.value.ArrayValue;
import ca.gc.cra.vartrunc.domain.value.FloatValue;
import ca.gc.cra.vartrunc.domain.value.NullValue;
import ca.gc.cra.vartrunc.domain.value.ObjectValue;
import ca.gc.cra.vartrunc.domain.value.StringValue;
import ca.gc.cra.vartrunc.domain.value.Value;

/**
 * Factory and accessors bridging {@link Value}s and {@link Segment}s.
 *
 * @since 0.1.0
 */
public final class Segments {
  private Segments() {
    // Utility
  }

  /**
   * Wraps a value in its natural segment. Booleans map to {@link IntegerSegment}.
   *
   * @param value value to wrap
   * @return segment carrying {@code value}
   */
  public static Segment of(Value value) {
    return switch (value.kind()) {
      case STRING -> new StringSegment((StringValue) value);
      case INTEGER, BOOLEAN -> new IntegerSegment(value);
      case FLOAT -> new FloatSegment((FloatValue) value);
      case NULL -> NoneSegment.INSTANCE;
      case ARRAY -> new ArraySegment((ArrayValue) value);
      case OBJECT -> new ObjectSegment((ObjectValue) value);
    };
  }

  /**
   * Returns the value a segment carries. File segments have no JSON value and yield {@code null}.
   *
   * @param segment segment to unwrap
   * @return carried value or {@code null} for file segments
   */
  public static Value valueOf(Segment segment) {
    return switch (segment.type()) {
      case INTEGER -> ((IntegerSegment) segment).value();
      case FLOAT -> ((FloatSegment) segment).value();
      case NONE -> NullValue.INSTANCE;
      case STRING -> ((StringSegment) segment).value();
      case ARRAY -> ((ArraySegment) segment).value();
      case OBJECT -> ((ObjectSegment) segment).value();
      case FILE, ARRAY_FILE -> null;
    };
  }
}
