package ca.gc.cra.vartrunc.api;

import ca.gc.cra.vartrunc.validation.Strings;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Turns {@code key=value} CLI arguments into a lookup map.
 *
 * <p>A leading {@code --} on the key is dropped, so {@code --maxSizeBytes=10} and {@code maxSizeBytes=10} are the
 * same setting. Stateless and thread-safe.</p>
 *
 * @since 0.1.0
 */
public final class CliArgsParser {
  private static final Pattern KEY_PATTERN = Pattern.compile("[A-Za-z][A-Za-z0-9._-]*");

  private CliArgsParser() {}

  /**
   * Splits each argument on its first {@code '='}.
   *
   * @param args raw CLI arguments; {@code null} returns an empty map
   * @return mutable map in argument order
   * @throws IllegalArgumentException if an argument is not {@code key=value}, a key repeats, or a value is blank
   *     or carries control characters
   */
  public static Map<String, String> toMap(String[] args) {
    Map<String, String> map = new LinkedHashMap<>();
    if (args == null) {
      return map;
    }
    for (String raw : args) {
      String arg = raw == null ? "" : raw.trim();
      if (arg.isEmpty()) {
        continue;
      }
      int idx = arg.indexOf('=');
      if (idx <= 0) {
        throw new IllegalArgumentException("argument must be key=value (was '" + raw + "')");
      }
      String key = normalizeKey(arg.substring(0, idx).trim());
      String value = Strings.requireNonBlank(key, arg.substring(idx + 1).trim());
      if (map.putIfAbsent(key, value) != null) {
        throw new IllegalArgumentException("argument " + key + " given more than once");
      }
    }
    return map;
  }

  private static String normalizeKey(String key) {
    String bare = key.startsWith("--") ? key.substring(2) : key;
    if (!KEY_PATTERN.matcher(bare).matches()) {
      throw new IllegalArgumentException("invalid argument name: " + key);
    }
    return bare;
  }
}
