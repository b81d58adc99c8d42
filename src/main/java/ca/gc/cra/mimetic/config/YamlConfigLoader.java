package ca.gc.cra.mimetic.config;

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
import java.util.Set;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Loads MIMETIC configuration from a YAML document.
 *
 * <p>The document has a {@code common} section plus one section per CLI mode ({@code run},
 * {@code calibrate}). Nested mappings flatten to dotted keys, so
 * <pre>
 * common:
 *   actuator:
 *     head:
 *       endpoint: 10.0.0.5:8000
 * </pre>
 * yields {@code actuator.head.endpoint=10.0.0.5:8000}. Mode values override {@code common} values.</p>
 */
public final class YamlConfigLoader {
  private static final Set<String> SECTIONS = Set.of("common", "run", "calibrate");

  private YamlConfigLoader() {}

  /**
   * Loads the {@code common} and {@code mode} sections of a YAML file.
   *
   * @param path YAML file
   * @param mode CLI mode whose section is applied on top of {@code common}
   * @return flattened settings, or empty when the file does not exist
   * @throws IOException when the file cannot be read
   * @throws IllegalArgumentException when the document is malformed or has unknown sections
   */
  public static Optional<Map<String, String>> load(Path path, String mode) throws IOException {
    Objects.requireNonNull(path, "path");
    String section = Objects.requireNonNull(mode, "mode").trim().toLowerCase(Locale.ROOT);
    if (!Files.exists(path)) {
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
    if (!(document instanceof Map<?, ?> root)) {
      throw new IllegalArgumentException("YAML config root must be a mapping: " + path);
    }
    Map<String, Object> common = null;
    Map<String, Object> selected = null;
    for (Map.Entry<?, ?> entry : root.entrySet()) {
      String name = String.valueOf(entry.getKey()).trim().toLowerCase(Locale.ROOT);
      if (!SECTIONS.contains(name)) {
        throw new IllegalArgumentException("Unknown YAML section '" + entry.getKey() + "'; expected one of " + SECTIONS);
      }
      if (entry.getValue() == null) {
        continue;
      }
      if (name.equals("common")) {
        common = mapping(entry.getValue(), name);
      } else if (name.equals(section)) {
        selected = mapping(entry.getValue(), name);
      }
    }
    Map<String, String> flat = new LinkedHashMap<>();
    if (common != null) {
      flatten("", common, flat);
    }
    if (selected != null) {
      flatten("", selected, flat);
    }
    return Optional.of(Map.copyOf(flat));
  }

  private static Map<String, Object> mapping(Object node, String context) {
    if (!(node instanceof Map<?, ?> raw)) {
      throw new IllegalArgumentException("YAML section " + context + " must be a mapping");
    }
    Map<String, Object> map = new LinkedHashMap<>();
    raw.forEach((key, value) -> {
      if (!(key instanceof String name) || name.isBlank()) {
        throw new IllegalArgumentException("YAML section " + context + " has a blank or non-string key");
      }
      map.put(name.trim(), value);
    });
    return map;
  }

  private static void flatten(String prefix, Map<String, Object> source, Map<String, String> target) {
    source.forEach((key, value) -> {
      String composite = prefix.isEmpty() ? key : prefix + '.' + key;
      if (value instanceof Map<?, ?> nested) {
        flatten(composite, mapping(nested, composite), target);
      } else if (value instanceof Iterable<?>) {
        throw new IllegalArgumentException("YAML lists are not supported (key " + composite + ")");
      } else {
        target.put(composite, value == null ? "" : value.toString());
      }
    });
  }
}
