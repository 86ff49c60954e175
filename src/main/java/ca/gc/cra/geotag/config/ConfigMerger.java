package ca.gc.cra.geotag.config;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Merges configuration layers with precedence CLI &gt; YAML &gt; defaults.
 *
 * @since 0.1.0
 */
public final class ConfigMerger {

  private ConfigMerger() {}

  /**
   * Builds the effective flat configuration.
   *
   * @param yaml flattened YAML settings, if a file was loaded
   * @param cli CLI {@code key=value} settings
   * @param defaults embedded defaults from {@link DefaultsForMode}
   * @param warn receives one message per key the CLI overrides in the YAML file; may be {@code null}
   * @return immutable merged map
   * @throws IllegalArgumentException if the merged settings combine options that cannot work together
   */
  public static Map<String, String> buildEffectiveConfig(
      Optional<Map<String, String>> yaml,
      Map<String, String> cli,
      Map<String, String> defaults,
      Consumer<String> warn) {
    Objects.requireNonNull(yaml, "yaml");
    Map<String, String> yamlCopy = yaml.orElse(Map.of());
    Map<String, String> cliCopy = cli == null ? Map.of() : cli;

    Map<String, String> merged = new LinkedHashMap<>(defaults == null ? Map.of() : defaults);
    merged.putAll(yamlCopy);
    for (Map.Entry<String, String> entry : cliCopy.entrySet()) {
      String key = entry.getKey();
      if (key == null || entry.getValue() == null) {
        continue;
      }
      if (yamlCopy.containsKey(key) && warn != null) {
        warn.accept("CLI overrides YAML for key: " + key);
      }
      merged.put(key, entry.getValue());
    }

    validate(merged);
    return Map.copyOf(merged);
  }

  private static void validate(Map<String, String> effective) {
    boolean hasTrack = !trim(effective.get("gpx")).isEmpty();
    boolean hasAugment = !trim(effective.get("augment")).isEmpty();
    boolean geocode = isTrue(effective.get("geocode"));
    boolean hasResults = !trim(effective.get("results")).isEmpty();
    if (!hasTrack && !hasAugment && !geocode && !hasResults) {
      throw new IllegalArgumentException(
          "Nothing to do: configure at least one of gpx, augment, geocode=true or results");
    }
    if (!trim(effective.get("results")).isEmpty()
        && trim(effective.get("results")).equals(trim(effective.get("augment")))) {
      throw new IllegalArgumentException("results must not overwrite the augment input file");
    }
  }

  private static boolean isTrue(String value) {
    String normalized = trim(value).toLowerCase(Locale.ROOT);
    return normalized.equals("true") || normalized.equals("yes") || normalized.equals("1");
  }

  private static String trim(String value) {
    return value == null ? "" : value.trim();
  }
}
