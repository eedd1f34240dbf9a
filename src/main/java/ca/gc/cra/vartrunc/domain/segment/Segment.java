package ca.gc.cra.vartrunc.domain.segment;

/**
 * <strong>What:</strong> Tagged wrapper around a value, telling the dispatcher which truncation rule applies.
 * <p><strong>Why:</strong> File references and numbers are exempt from truncation while strings and containers
 * are shaped to a budget; the tag makes that routing explicit.</p>
 * <p><strong>Thread-safety:</strong> Implementations are immutable records.</p>
 *
 * @since 0.1.0
 * @see Segments
 */
public sealed interface Segment
    permits IntegerSegment,
        FloatSegment,
        NoneSegment,
        FileSegment,
        ArrayFileSegment,
        StringSegment,
        ArraySegment,
        ObjectSegment {

  /**
   * Returns the variant tag.
   *
   * @return segment type
   */
  SegmentType type();
}
