package ca.gc.cra.vartrunc.domain.segment;

/**
 * Absent value; passed through untouched.
 *
 * @since 0.1.0
 */
public record NoneSegment() implements Segment {
  /** Shared instance. */
  public static final NoneSegment INSTANCE = new NoneSegment();

  @Override
  public SegmentType type() {
    return SegmentType.NONE;
  }
}
