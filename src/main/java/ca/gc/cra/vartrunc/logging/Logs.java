package ca.gc.cra.vartrunc.logging;

/**
 * <strong>What:</strong> Logging hygiene helpers for payload previews.
 * <p><strong>Why:</strong> Execution payloads can be megabytes long and may carry user data; log lines only ever
 * see a short prefix.</p>
 * <p><strong>Thread-safety:</strong> Stateless utilities safe for concurrent use.</p>
 *
 * @since 0.1.0
 * @see LoggingConfigurator
 */
public final class Logs {
  private static final String NULL_PLACEHOLDER = "<null>";

  private Logs() {
    // Utility
  }

  /**
   * Clips a string to at most {@code maxBytes} UTF-8 bytes without splitting a code point, appending the
   * original length.
   *
   * @param value string to clip; {@code null} results in {@code "<null>"}
   * @param maxBytes maximum number of bytes to retain; must be positive
   * @return the original value when it fits, otherwise the clipped prefix plus {@code "? (truncated, X of Y)"}
   * @throws IllegalArgumentException if {@code maxBytes} is not positive
   */
  public static String truncate(String value, int maxBytes) {
    if (value == null) {
      return NULL_PLACEHOLDER;
    }
    if (maxBytes <= 0) {
      throw new IllegalArgumentException("maxBytes must be positive");
    }
    long total = 0;
    int end = -1;
    int index = 0;
    while (index < value.length()) {
      int codePoint = value.codePointAt(index);
      int width = codePoint < 0x80 ? 1 : codePoint < 0x800 ? 2 : codePoint < 0x10000 ? 3 : 4;
      if (end < 0 && total + width > maxBytes) {
        end = index;
      }
      total += width;
      index += Character.charCount(codePoint);
    }
    if (end < 0) {
      return value;
    }
    return value.substring(0, end) + "? (truncated, " + maxBytes + " of " + total + ")";
  }
}
