package ca.gc.cra.geotag.config;

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
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Loads a GEOTAG YAML file into the flat key space shared with the CLI.
 *
 * <p>The {@code common} section is read first, then the named section overrides it. Nested mappings flatten to
 * dotted keys, so</p>
 * <pre>
 * geotag:
 *   countryFields:
 *     Canada: name,adminName1
 * </pre>
 * <p>becomes {@code countryFields.Canada=name,adminName1}. Sequences are rejected; {@code null} becomes an
 * empty string.</p>
 *
 * @since 0.1.0
 */
public final class YamlConfigLoader {
  /** Section holding settings shared by {@code run} and {@code plan}. */
  public static final String GEOTAG_SECTION = "geotag";

  private YamlConfigLoader() {}

  /**
   * Loads and flattens the {@code common} and {@code section} mappings.
   *
   * @param path YAML file
   * @param section section name (case-insensitive)
   * @return flattened settings, or empty when the file does not exist
   * @throws IOException if the file cannot be read
   * @throws IllegalArgumentException if the YAML is malformed or has an unsupported shape
   */
  public static Optional<Map<String, String>> load(Path path, String section) throws IOException {
    Objects.requireNonNull(path, "path");
    Objects.requireNonNull(section, "section");
    if (!Files.exists(path)) {
      return Optional.empty();
    }
    String normalized = section.trim().toLowerCase(Locale.ROOT);
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      Object document = new Yaml(new SafeConstructor(new LoaderOptions())).load(reader);
      if (document == null) {
        return Optional.of(Map.of());
      }
      Map<String, Object> root = asMap(document, "root");
      Map<String, String> flattened = new LinkedHashMap<>();
      Object common = findSection(root, "common");
      if (common != null) {
        flatten(asMap(common, "common"), "", flattened);
      }
      Object named = findSection(root, normalized);
      if (named != null) {
        flatten(asMap(named, normalized), "", flattened);
      }
      return Optional.of(Map.copyOf(flattened));
    } catch (YAMLException ex) {
      throw new IllegalArgumentException("Failed to parse YAML config at " + path, ex);
    }
  }

  private static Map<String, Object> asMap(Object node, String context) {
    if (!(node instanceof Map<?, ?> raw)) {
      throw new IllegalArgumentException(context + " section must be a mapping");
    }
    Map<String, Object> map = new LinkedHashMap<>();
    for (Map.Entry<?, ?> entry : raw.entrySet()) {
      if (!(entry.getKey() instanceof String key)) {
        throw new IllegalArgumentException(context + " section contains non-string key " + entry.getKey());
      }
      map.put(key, entry.getValue());
    }
    return map;
  }

  private static Object findSection(Map<String, Object> root, String key) {
    for (Map.Entry<String, Object> entry : root.entrySet()) {
      if (entry.getKey().trim().toLowerCase(Locale.ROOT).equals(key)) {
        return entry.getValue();
      }
    }
    return null;
  }

  private static void flatten(Map<String, Object> source, String prefix, Map<String, String> target) {
    for (Map.Entry<String, Object> entry : source.entrySet()) {
      String key = entry.getKey();
      if (key.isBlank()) {
        throw new IllegalArgumentException("YAML contains blank keys");
      }
      String composite = prefix.isEmpty() ? key : prefix + '.' + key;
      Object value = entry.getValue();
      if (value == null) {
        target.put(composite, "");
      } else if (value instanceof Map<?, ?> nested) {
        flatten(asMap(nested, composite), composite, target);
      } else if (value instanceof Iterable<?>) {
        throw new IllegalArgumentException("YAML sequences are not supported for key " + composite);
      } else {
        target.put(composite, value.toString());
      }
    }
  }
}
