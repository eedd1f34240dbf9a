package ca.gc.cra.vartrunc.domain.segment;

import java.util.Objects;

/**
 * Single file reference; passed through untouched.
 *
 * @param file referenced file
 * @since 0.1.0
 */
public record FileSegment(FileReference file) implements Segment {
  public FileSegment {
    Objects.requireNonNull(file, "file");
  }

  @Override
  public SegmentType type() {
    return SegmentType.FILE;
  }
}
