package ca.gc.cra.vartrunc.config;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Reads a VARTRUNC YAML file into the flat key/value form used by {@link ConfigMerger}.
 *
 * <p>The document root holds one mapping per command plus an optional {@code common} mapping. The requested
 * command's keys override {@code common}. Nested mappings become dotted keys, so
 * {@code limits: {maxSizeBytes: 10}} is returned as {@code limits.maxSizeBytes=10}. Section names match
 * case-insensitively; keys keep their spelling.</p>
 *
 * @since 0.1.0
 */
public final class YamlConfigLoader {
  private static final Logger log = LoggerFactory.getLogger(YamlConfigLoader.class);
  private static final String COMMON_SECTION = "common";

  private YamlConfigLoader() {}

  /**
   * Loads {@code path} and returns the {@code common} keys overlaid with the {@code section} keys.
   *
   * @param path YAML file
   * @param section command section, {@code truncate} or {@code offload}
   * @return flattened settings; empty when the file does not exist, an empty map when the document is empty
   * @throws IOException when the file cannot be read
   * @throws IllegalArgumentException when the document is not a mapping of mappings or holds sequences
   */
  public static Optional<Map<String, String>> load(Path path, String section) throws IOException {
    Objects.requireNonNull(path, "path");
    String wanted = Objects.requireNonNull(section, "section").trim().toLowerCase(Locale.ROOT);
    if (!Files.exists(path)) {
      log.debug("No YAML configuration at {}", path);
      return Optional.empty();
    }

    Object document;
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      document = new Yaml(new SafeConstructor(new LoaderOptions())).load(reader);
    } catch (YAMLException ex) {
      throw new IllegalArgumentException("Failed to parse YAML config at " + path, ex);
    }
    if (document == null) {
      return Optional.of(Map.of());
    }

    Map<String, String> settings = new LinkedHashMap<>();
    Map<?, ?> sections = requireMapping(document, "root");
    sectionNamed(sections, COMMON_SECTION).ifPresent(common -> flattenInto(settings, "", common, COMMON_SECTION));
    sectionNamed(sections, wanted).ifPresent(own -> flattenInto(settings, "", own, wanted));
    log.debug("Loaded {} setting(s) for section '{}' from {}", settings.size(), wanted, path);
    return Optional.of(Map.copyOf(settings));
  }

  private static Optional<Object> sectionNamed(Map<?, ?> sections, String name) {
    return sections.entrySet().stream()
        .filter(entry -> entry.getKey() instanceof String key && key.trim().equalsIgnoreCase(name))
        .<Object>map(Map.Entry::getValue)
        .filter(Objects::nonNull)
        .findFirst();
  }

  private static void flattenInto(Map<String, String> settings, String prefix, Object node, String path) {
    for (Map.Entry<?, ?> entry : requireMapping(node, path).entrySet()) {
      if (!(entry.getKey() instanceof String name) || name.isBlank()) {
        throw new IllegalArgumentException(path + " contains a blank or non-string key");
      }
      String key = prefix + name;
      Object value = entry.getValue();
      if (value instanceof Map<?, ?>) {
        flattenInto(settings, key + '.', value, key);
      } else if (value instanceof Iterable<?>) {
        throw new IllegalArgumentException("YAML sequences are not supported for key " + key);
      } else {
        settings.put(key, value == null ? "" : value.toString());
      }
    }
  }

  private static Map<?, ?> requireMapping(Object node, String path) {
    if (node instanceof Map<?, ?> map) {
      return map;
    }
    throw new IllegalArgumentException(path + " section must be a mapping");
  }
}
