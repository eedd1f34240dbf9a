package ca.gc.cra.vartrunc.validation;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * <strong>What:</strong> Validation utilities for identifiers and names crossing the storage boundary.
 * <p><strong>Why:</strong> Blob file names and execution identifiers end up in file paths and log lines, so
 * they are sanitized before adapters touch the filesystem.
 * <p><strong>Thread-safety:</strong> Immutable stateless utilities; safe for concurrent access.
 *
 * @since 0.1.0
 * @see Numbers
 */
public final class Strings {
  private static final Pattern FILE_NAME_PATTERN = Pattern.compile("^[A-Za-z0-9._-]+$");

  private Strings() {
    // Utility
  }

  /**
   * Ensures a candidate string is non-null, non-blank, and control-character free.
   *
   * @param name logical parameter name for diagnostics; if {@code null} defaults to {@code "value"}
   * @param value candidate text; must not be {@code null}
   * @return trimmed input with leading/trailing whitespace removed
   * @throws NullPointerException if {@code value} is {@code null}
   * @throws IllegalArgumentException if the trimmed value is blank or contains ISO control characters
   */
  public static String requireNonBlank(String name, String value) {
    String raw = Objects.requireNonNull(value, name == null ? "value" : name);
    if (containsControl(raw)) {
      throw new IllegalArgumentException(message(name, "must not contain control characters"));
    }
    String trimmed = raw.trim();
    if (trimmed.isEmpty()) {
      throw new IllegalArgumentException(message(name, "must not be blank"));
    }
    return trimmed;
  }

  /**
   * Validates a flat file name (no separators) composed of {@code [A-Za-z0-9._-]}.
   *
   * @param name logical parameter name included in exception messages
   * @param fileName candidate file name; must be non-null
   * @return sanitized file name
   * @throws IllegalArgumentException if the name is blank, contains other characters, or is a dot segment
   */
  public static String requireFileName(String name, String fileName) {
    String sanitized = requireNonBlank(name, fileName);
    if (!FILE_NAME_PATTERN.matcher(sanitized).matches()) {
      throw new IllegalArgumentException(message(name,
          "must only contain letters, digits, dot, underscore, or hyphen"));
    }
    if (sanitized.equals(".") || sanitized.equals("..")) {
      throw new IllegalArgumentException(message(name, "must not be a relative path segment"));
    }
    return sanitized;
  }

  private static boolean containsControl(CharSequence value) {
    for (int i = 0; i < value.length(); i++) {
      if (Character.isISOControl(value.charAt(i))) {
        return true;
      }
    }
    return false;
  }

  private static String message(String name, String suffix) {
    String label = (name == null || name.isBlank()) ? "value" : name;
    return label + " " + suffix;
  }
}
