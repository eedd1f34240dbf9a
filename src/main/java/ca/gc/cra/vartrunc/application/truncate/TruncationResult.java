package ca.gc.cra.vartrunc.application.truncate;

import ca.gc.cra.vartrunc.domain.segment.Segment;
import java.util.Objects;

/**
 * Outcome of {@link ValueTruncator#truncate(Segment)}.
 *
 * @param result resulting segment; a {@code StringSegment} when the final-size fallback was taken
 * @param truncated {@code true} when any truncation decision changed the value
 * @since 0.1.0
 */
public record TruncationResult(Segment result, boolean truncated) {
  public TruncationResult {
    Objects.requireNonNull(result, "result");
  }
}
