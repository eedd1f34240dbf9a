package ca.gc.cra.vartrunc.config;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Supplies flattened default configuration maps for each CLI section.
 *
 * <p>The defaults remain the single source of truth for optional YAML keys.</p>
 */
public final class Defaults {
  private static final Map<String, String> COMMON_DEFAULTS = buildCommonDefaults();

  private Defaults() {}

  /**
   * Returns a flattened map of defaults for the requested section merged with common defaults.
   *
   * @param section target section ({@code truncate} or {@code offload})
   * @return unmodifiable map of default key/value pairs as strings
   * @throws IllegalArgumentException for an unknown section
   */
  public static Map<String, String> asFlatMap(String section) {
    Objects.requireNonNull(section, "section");
    String normalized = section.trim().toLowerCase(Locale.ROOT);
    Map<String, String> defaults = new LinkedHashMap<>(COMMON_DEFAULTS);
    defaults.putAll(switch (normalized) {
      case "truncate" -> buildTruncateDefaults();
      case "offload" -> buildOffloadDefaults();
      default -> throw new IllegalArgumentException("Unsupported section: " + section);
    });
    return Map.copyOf(defaults);
  }

  private static Map<String, String> buildCommonDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("metricsExporter", "none");
    map.put("verbose", "false");
    return Map.copyOf(map);
  }

  private static Map<String, String> buildTruncateDefaults() {
    TruncatorConfig defaults = TruncatorConfig.defaults();
    Map<String, String> map = new LinkedHashMap<>();
    map.put("stringLengthLimit", Integer.toString(defaults.stringLengthLimit()));
    map.put("arrayElementLimit", Integer.toString(defaults.arrayElementLimit()));
    map.put("maxSizeBytes", Integer.toString(defaults.maxSizeBytes()));
    map.put("arrayItemCharLimit", Integer.toString(defaults.arrayItemCharLimit()));
    map.put("objectValueCharLimit", Integer.toString(defaults.objectValueCharLimit()));
    return map;
  }

  private static Map<String, String> buildOffloadDefaults() {
    Map<String, String> map = buildTruncateDefaults();
    // Inline previews are budgeted by the threshold.
    map.remove("maxSizeBytes");
    OffloadConfig defaults = OffloadConfig.defaults();
    map.put("offloadThresholdBytes", Integer.toString(defaults.thresholdBytes()));
    map.put("blobDirectory", defaults.blobDirectory().toString());
    return map;
  }
}
