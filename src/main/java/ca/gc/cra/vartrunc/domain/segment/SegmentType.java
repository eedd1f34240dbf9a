package ca.gc.cra.vartrunc.domain.segment;

/**
 * Tag identifying a {@link Segment} variant.
 *
 * @since 0.1.0
 */
public enum SegmentType {
  INTEGER,
  FLOAT,
  NONE,
  FILE,
  ARRAY_FILE,
  STRING,
  ARRAY,
  OBJECT
}
