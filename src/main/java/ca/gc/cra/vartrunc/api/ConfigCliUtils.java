package ca.gc.cra.vartrunc.api;

import ca.gc.cra.vartrunc.config.ConfigMerger;
import ca.gc.cra.vartrunc.config.Defaults;
import ca.gc.cra.vartrunc.config.YamlConfigLoader;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;

/**
 * Shared helpers for mixing CLI flag semantics with YAML/Map based configuration sources.
 */
final class ConfigCliUtils {

  private ConfigCliUtils() {}

  static String extractConfigPath(Map<String, String> args) {
    if (args == null) {
      return null;
    }
    String value = args.remove("config");
    return value == null || value.isBlank() ? null : value.trim();
  }

  /**
   * Resolves the effective configuration for {@code section} from defaults, an optional YAML file and CLI pairs.
   *
   * @param section configuration section
   * @param cli CLI key/value pairs; a {@code config} entry is removed and used as YAML path
   * @param log logger receiving override warnings
   * @return merged configuration
   * @throws IllegalArgumentException if the YAML file is missing or invalid or the merged values conflict
   * @throws IOException if the YAML file cannot be read
   */
  static Map<String, String> effectiveConfig(String section, Map<String, String> cli, Logger log)
      throws IOException {
    String configPath = extractConfigPath(cli);
    Optional<Map<String, String>> yaml = Optional.empty();
    if (configPath != null) {
      Path yamlPath = Path.of(configPath);
      if (!Files.exists(yamlPath)) {
        throw new IllegalArgumentException("Configuration file does not exist: " + yamlPath);
      }
      yaml = YamlConfigLoader.load(yamlPath, section);
    }
    return ConfigMerger.buildEffectiveConfig(section, yaml, cli, Defaults.asFlatMap(section), log::warn);
  }

  static boolean parseBoolean(Map<String, String> map, String key) {
    if (map == null) {
      return false;
    }
    String value = map.get(key);
    if (value == null || value.isBlank()) {
      return false;
    }
    return Boolean.parseBoolean(value.trim());
  }
}
