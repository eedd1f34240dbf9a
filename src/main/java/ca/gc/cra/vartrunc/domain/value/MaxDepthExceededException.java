package ca.gc.cra.vartrunc.domain.value;

/**
 * Raised when a value nests deeper than {@link Values#MAX_DEPTH} levels.
 *
 * @since 0.1.0
 */
public final class MaxDepthExceededException extends IllegalStateException {
  private static final long serialVersionUID = 1L;

  private final int depth;

  /**
   * Creates the exception for the offending depth.
   *
   * @param depth depth at which the ceiling was crossed
   */
  public MaxDepthExceededException(int depth) {
    super("Max depth " + Values.MAX_DEPTH + " exceeded (reached depth " + depth + ")");
    this.depth = depth;
  }

  /**
   * Returns the depth that triggered the failure.
   *
   * @return offending depth
   */
  public int depth() {
    return depth;
  }
}
