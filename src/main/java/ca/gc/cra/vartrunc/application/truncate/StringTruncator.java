package ca.gc.cra.vartrunc.application.truncate;

import ca.gc.cra.vartrunc.domain.value.StringValue;
import ca.gc.cra.vartrunc.validation.Numbers;

/**
 * <strong>What:</strong> Shortens strings to a code point limit and, when needed, a compact-JSON byte budget.
 * <p><strong>Why:</strong> A shortened string always ends with {@value #ELLIPSIS} so readers can tell it was cut.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Apply the character limit first: keep {@code limit - 3} code points and append the ellipsis.</li>
 *   <li>Then re-check the byte budget and keep the longest code point prefix whose quoted form, ellipsis included,
 *   still fits. A shortened string never exceeds the character limit, so shaping twice changes nothing.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 * <p><strong>Performance:</strong> Single pass over the kept prefix; surrogate pairs are never split.</p>
 *
 * @since 0.1.0
 */
public final class StringTruncator {
  /** Marker appended to every shortened string. */
  public static final String ELLIPSIS = "...";

  private static final int ELLIPSIS_LENGTH = ELLIPSIS.length();
  /** Smallest byte budget that can hold a quoted ellipsis. */
  static final int MIN_MARKED_BYTES = ELLIPSIS_LENGTH + 2;

  private final int stringLengthLimit;

  /**
   * Creates a truncator for the given code point limit.
   *
   * @param stringLengthLimit maximum code points in a result; at least 4
   */
  public StringTruncator(int stringLengthLimit) {
    this.stringLengthLimit = Numbers.requireAtLeast("stringLengthLimit", stringLengthLimit, ELLIPSIS_LENGTH + 1);
  }

  /**
   * Applies the character limit only.
   *
   * @param value string to shorten
   * @return the original value when within the limit, otherwise exactly {@code stringLengthLimit} code points
   */
  public TruncationPart truncateString(StringValue value) {
    return shape(value, stringLengthLimit, Integer.MAX_VALUE);
  }

  /**
   * Applies the character limit, then the byte budget.
   *
   * @param value string to shorten
   * @param maxEncodedBytes compact-JSON budget for the result, quotes included
   * @return shaped string
   */
  public TruncationPart truncateString(StringValue value, int maxEncodedBytes) {
    return shape(value, stringLengthLimit, maxEncodedBytes);
  }

  /**
   * Shapes {@code value} to at most {@code charLimit} code points and {@code maxEncodedBytes} bytes.
   *
   * <p>When the budget cannot hold a quoted ellipsis the result is the empty string.</p>
   *
   * @param value string to shorten
   * @param charLimit maximum code points; values below 4 are raised to 4
   * @param maxEncodedBytes compact-JSON budget, quotes included
   * @return shaped string with its size
   */
  public static TruncationPart shape(StringValue value, int charLimit, int maxEncodedBytes) {
    String text = value.value();
    int limit = Math.max(charLimit, ELLIPSIS_LENGTH + 1);
    int codePoints = text.codePointCount(0, text.length());
    int size = JsonSizeEstimator.estimateString(text);
    if (codePoints <= limit && size <= maxEncodedBytes) {
      return TruncationPart.unchanged(value, size);
    }
    if (maxEncodedBytes < MIN_MARKED_BYTES) {
      return new TruncationPart(StringValue.EMPTY, 2, true);
    }
    int keepCodePoints = Math.min(codePoints, limit - ELLIPSIS_LENGTH);
    long byteAllowance = (long) maxEncodedBytes - MIN_MARKED_BYTES;
    int end = prefixEnd(text, keepCodePoints, byteAllowance);
    String shaped = text.substring(0, end) + ELLIPSIS;
    return new TruncationPart(StringValue.of(shaped), JsonSizeEstimator.estimateString(shaped), true);
  }

  /**
   * Returns the longest prefix of {@code text} that, with the ellipsis appended, fits {@code maxEncodedBytes}.
   *
   * @param text text to fit
   * @param maxEncodedBytes compact-JSON budget, quotes included
   * @return {@code text} when it already fits, otherwise a marked prefix or the empty string
   */
  public static String fitToBytes(String text, int maxEncodedBytes) {
    TruncationPart part = shape(StringValue.of(text), Integer.MAX_VALUE, maxEncodedBytes);
    return ((StringValue) part.value()).value();
  }

  /**
   * Returns the configured code point limit.
   *
   * @return limit
   */
  public int stringLengthLimit() {
    return stringLengthLimit;
  }

  private static int prefixEnd(String text, int maxCodePoints, long maxBytes) {
    int index = 0;
    int kept = 0;
    long bytes = 0;
    while (index < text.length() && kept < maxCodePoints) {
      int codePoint = text.codePointAt(index);
      int width = utf8Width(codePoint);
      if (bytes + width > maxBytes) {
        break;
      }
      bytes += width;
      kept++;
      index += Character.charCount(codePoint);
    }
    return index;
  }

  private static int utf8Width(int codePoint) {
    if (codePoint < 0x80) {
      return 1;
    }
    if (codePoint < 0x800) {
      return 2;
    }
    if (codePoint < 0x10000) {
      return 3;
    }
    return 4;
  }
}
