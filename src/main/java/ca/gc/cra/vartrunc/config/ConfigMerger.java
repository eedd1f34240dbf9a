package ca.gc.cra.vartrunc.config;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Merges configuration from defaults, YAML, and CLI sources while enforcing precedence and invariants.
 */
public final class ConfigMerger {

  private ConfigMerger() {}

  /**
   * Builds an effective configuration map using precedence CLI > YAML > defaults.
   *
   * @param section active configuration section
   * @param yaml optional YAML-derived settings for the section
   * @param cli CLI key/value overrides (may be empty)
   * @param defaults embedded defaults for the section
   * @param warn consumer invoked when a CLI key overrides a YAML key
   * @return immutable merged configuration map
   * @throws IllegalArgumentException when validation fails
   */
  public static Map<String, String> buildEffectiveConfig(
      String section,
      Optional<Map<String, String>> yaml,
      Map<String, String> cli,
      Map<String, String> defaults,
      Consumer<String> warn) {
    Objects.requireNonNull(section, "section");
    Objects.requireNonNull(yaml, "yaml");
    Map<String, String> defaultsCopy = defaults == null ? Map.of() : defaults;
    Map<String, String> yamlCopy = yaml.orElse(Map.of());
    Map<String, String> cliCopy = cli == null ? Map.of() : cli;

    Map<String, String> merged = new LinkedHashMap<>(defaultsCopy);
    merged.putAll(yamlCopy);

    for (Map.Entry<String, String> entry : cliCopy.entrySet()) {
      String key = entry.getKey();
      String value = entry.getValue();
      if (key == null || value == null) {
        continue;
      }
      if (yamlCopy.containsKey(key) && warn != null) {
        warn.accept("CLI overrides YAML for key: " + key);
      }
      merged.put(key, value);
    }

    validate(section, merged);
    return Map.copyOf(merged);
  }

  private static void validate(String section, Map<String, String> effective) {
    if (!"offload".equalsIgnoreCase(section)) {
      return;
    }
    int threshold = parse(effective.get("offloadThresholdBytes"));
    int budget = parse(effective.get("maxSizeBytes"));
    if (threshold > 0 && budget > threshold) {
      throw new IllegalArgumentException(
          "maxSizeBytes (" + budget + ") must not exceed offloadThresholdBytes (" + threshold + ")");
    }
  }

  private static int parse(String value) {
    if (value == null || value.isBlank()) {
      return -1;
    }
    try {
      return Integer.parseInt(value.trim());
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException("Expected an integer but got: " + value, ex);
    }
  }
}
