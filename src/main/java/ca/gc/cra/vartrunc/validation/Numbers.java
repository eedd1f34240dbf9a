package ca.gc.cra.vartrunc.validation;

/**
 * <strong>What:</strong> Numeric validation helpers used by truncator and offload configuration.
 * <p><strong>Why:</strong> Guards against budgets and limits that would make truncation impossible (non-positive
 * byte budgets, string limits too short to carry an ellipsis) before a truncator is constructed.
 * <p><strong>Role:</strong> Domain support utilities invoked by configuration records and the CLI.
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Enforce inclusive numeric bounds declared by configuration records.</li>
 *   <li>Provide consistent error messaging for CLI feedback.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable stateless utility.
 * <p><strong>Performance:</strong> Constant-time range checks.
 * <p><strong>Observability:</strong> Emits no metrics or logs; throws {@link IllegalArgumentException} when
 * validation fails.
 *
 * @since 0.1.0
 * @see Strings
 */
public final class Numbers {
  private Numbers() {
    // Utility
  }

  /**
   * Validates that a numeric value falls within an inclusive range.
   *
   * @param name logical parameter name included in diagnostics; defaults to {@code "value"} when blank
   * @param value candidate value expressed in the caller's units (e.g., bytes, characters)
   * @param min minimum inclusive value in the same units as {@code value}
   * @param max maximum inclusive value in the same units as {@code value}
   * @return the validated value for fluent call sites
   * @throws IllegalArgumentException if {@code value} lies outside {@code [min, max]}
   */
  public static long requireRange(String name, long value, long min, long max) {
    if (value < min || value > max) {
      throw new IllegalArgumentException(
          label(name) + " must be between " + min + " and " + max + " (was " + value + ")");
    }
    return value;
  }

  /**
   * Validates that an {@code int} setting is at least {@code min}.
   *
   * @param name logical parameter name included in diagnostics
   * @param value candidate value
   * @param min minimum inclusive value
   * @return the validated value
   * @throws IllegalArgumentException if {@code value < min}
   */
  public static int requireAtLeast(String name, int value, int min) {
    return (int) requireRange(name, value, min, Integer.MAX_VALUE);
  }

  /**
   * Parses an optional integer setting, falling back to {@code defaultValue} when absent or blank.
   *
   * @param name logical parameter name included in diagnostics
   * @param raw raw text; may be {@code null}
   * @param defaultValue value returned for missing input
   * @return parsed value
   * @throws IllegalArgumentException if {@code raw} is present but not a base-10 integer
   */
  public static int parseInt(String name, String raw, int defaultValue) {
    if (raw == null || raw.isBlank()) {
      return defaultValue;
    }
    try {
      return Integer.parseInt(raw.trim());
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(label(name) + " must be an integer (was " + raw + ")", ex);
    }
  }

  private static String label(String name) {
    return name == null || name.isBlank() ? "value" : name;
  }
}
