package ca.gc.cra.vartrunc.api;

/**
 * <strong>What:</strong> Process exit codes returned by the {@code vartrunc} commands.
 * <p><strong>Why:</strong> Scripts that truncate or offload payloads in batch need to tell bad arguments apart from
 * storage failures.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable.</p>
 *
 * @since 0.1.0
 */
public enum ExitCode {
  /** Successful execution. */
  SUCCESS(0),
  /** Command-line arguments, configuration values or the input document were invalid. */
  INVALID_ARGS(2),
  /** Reading the input or writing a blob failed. */
  IO_ERROR(3),
  /** Configuration was rejected after it was parsed. */
  CONFIG_ERROR(4),
  /** Unexpected runtime failure occurred. */
  RUNTIME_FAILURE(5);

  private final int code;

  ExitCode(int code) {
    this.code = code;
  }

  /**
   * Returns the numeric value handed to the operating system.
   *
   * @return numeric exit code
   */
  public int code() {
    return code;
  }
}
