package ca.gc.cra.vartrunc.config;

import ca.gc.cra.vartrunc.validation.Numbers;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Immutable limits applied by the value truncator.
 * <p><strong>Why:</strong> Three independent limits (total bytes, characters per string, elements per array) bound
 * what a truncated payload may contain; two leaf ceilings bound individual strings nested inside containers.</p>
 * <p><strong>Role:</strong> Configuration value consumed by {@code ValueTruncator} and its leaf truncators.</p>
 * <p><strong>Thread-safety:</strong> Immutable record; safe for concurrent reads.</p>
 *
 * @param stringLengthLimit maximum code points kept in a string, including the {@code "..."} marker; at least 4
 * @param arrayElementLimit maximum elements kept in an array; at least 1
 * @param maxSizeBytes total compact-JSON byte budget of the result; at least 5, the size of {@code "..."}
 * @param arrayItemCharLimit ceiling, in code points, for a string element nested in an array; at least 4
 * @param objectValueCharLimit ceiling, in code points, for a string value nested in an object; at least 4
 * @since 0.1.0
 */
public record TruncatorConfig(
    int stringLengthLimit,
    int arrayElementLimit,
    int maxSizeBytes,
    int arrayItemCharLimit,
    int objectValueCharLimit) {

  /** Default characters kept per string. */
  public static final int DEFAULT_STRING_LENGTH_LIMIT = 5000;
  /** Default elements kept per array. */
  public static final int DEFAULT_ARRAY_ELEMENT_LIMIT = 100;
  /** Default total byte budget (10 KiB). */
  public static final int DEFAULT_MAX_SIZE_BYTES = 10 * 1024;
  /** Default ceiling for string elements of arrays. */
  public static final int ARRAY_CHAR_LIMIT = 1000;
  /** Default ceiling for string values of objects. */
  public static final int OBJECT_CHAR_LIMIT = 5000;

  private static final int MIN_STRING_LENGTH_LIMIT = 4;
  /** Smallest budget that holds a quoted ellipsis. */
  public static final int MIN_MAX_SIZE_BYTES = 5;

  /**
   * Validates every limit.
   *
   * @throws IllegalArgumentException naming the first setting that is out of range
   */
  public TruncatorConfig {
    Numbers.requireAtLeast("stringLengthLimit", stringLengthLimit, MIN_STRING_LENGTH_LIMIT);
    Numbers.requireAtLeast("arrayElementLimit", arrayElementLimit, 1);
    Numbers.requireAtLeast("maxSizeBytes", maxSizeBytes, MIN_MAX_SIZE_BYTES);
    Numbers.requireAtLeast("arrayItemCharLimit", arrayItemCharLimit, MIN_STRING_LENGTH_LIMIT);
    Numbers.requireAtLeast("objectValueCharLimit", objectValueCharLimit, MIN_STRING_LENGTH_LIMIT);
  }

  /**
   * Creates a configuration with the three primary limits and default leaf ceilings.
   *
   * @param stringLengthLimit maximum code points per string
   * @param arrayElementLimit maximum elements per array
   * @param maxSizeBytes total byte budget
   * @return validated configuration
   */
  public static TruncatorConfig of(int stringLengthLimit, int arrayElementLimit, int maxSizeBytes) {
    return new TruncatorConfig(
        stringLengthLimit, arrayElementLimit, maxSizeBytes, ARRAY_CHAR_LIMIT, OBJECT_CHAR_LIMIT);
  }

  /**
   * Returns the default configuration: 5000 characters, 100 elements, 10 KiB.
   *
   * @return default configuration
   */
  public static TruncatorConfig defaults() {
    return of(DEFAULT_STRING_LENGTH_LIMIT, DEFAULT_ARRAY_ELEMENT_LIMIT, DEFAULT_MAX_SIZE_BYTES);
  }

  /**
   * Returns a copy with a different byte budget.
   *
   * @param budget new total byte budget
   * @return validated copy
   */
  public TruncatorConfig withMaxSizeBytes(int budget) {
    return new TruncatorConfig(
        stringLengthLimit, arrayElementLimit, budget, arrayItemCharLimit, objectValueCharLimit);
  }

  /**
   * Builds a configuration from flat key/value pairs; missing keys fall back to defaults.
   *
   * @param args flattened configuration; must not be {@code null}
   * @return validated configuration
   * @throws IllegalArgumentException if a value is not an integer or is out of range
   */
  public static TruncatorConfig fromMap(Map<String, String> args) {
    Objects.requireNonNull(args, "args");
    return new TruncatorConfig(
        Numbers.parseInt("stringLengthLimit", args.get("stringLengthLimit"), DEFAULT_STRING_LENGTH_LIMIT),
        Numbers.parseInt("arrayElementLimit", args.get("arrayElementLimit"), DEFAULT_ARRAY_ELEMENT_LIMIT),
        Numbers.parseInt("maxSizeBytes", args.get("maxSizeBytes"), DEFAULT_MAX_SIZE_BYTES),
        Numbers.parseInt("arrayItemCharLimit", args.get("arrayItemCharLimit"), ARRAY_CHAR_LIMIT),
        Numbers.parseInt("objectValueCharLimit", args.get("objectValueCharLimit"), OBJECT_CHAR_LIMIT));
  }
}
