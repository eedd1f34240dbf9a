package ca.gc.cra.vartrunc.domain.segment;

import java.util.List;

/**
 * Sequence of file references; passed through untouched regardless of length.
 *
 * @param files referenced files in order
 * @since 0.1.0
 */
public record ArrayFileSegment(List<FileReference> files) implements Segment {
  public ArrayFileSegment {
    files = List.copyOf(files);
  }

  @Override
  public SegmentType type() {
    return SegmentType.ARRAY_FILE;
  }
}
