package ca.gc.cra.geotag.config;

import ca.gc.cra.geotag.application.pipeline.Pipeline;
import ca.gc.cra.geotag.infrastructure.geonames.GeoNamesPlaceLookup;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Embedded defaults for each CLI mode, expressed as the same flat keys the YAML file and CLI use.
 * <p>Lowest-precedence layer of {@link ConfigMerger}. {@code plan} never touches photos, so it defaults to a dry
 * run.</p>
 *
 * @since 0.1.0
 */
public final class DefaultsForMode {
  private static final Map<String, String> COMMON_DEFAULTS = buildCommonDefaults();

  private DefaultsForMode() {}

  /**
   * Returns defaults for a mode.
   *
   * @param mode {@code run} or {@code plan} (case-insensitive)
   * @return immutable flat map of defaults
   * @throws IllegalArgumentException for an unknown mode
   */
  public static Map<String, String> asFlatMap(String mode) {
    Objects.requireNonNull(mode, "mode");
    Map<String, String> defaults = new LinkedHashMap<>(COMMON_DEFAULTS);
    switch (mode.trim().toLowerCase(Locale.ROOT)) {
      case "run" -> defaults.put("dryRun", "false");
      case "plan" -> defaults.put("dryRun", "true");
      default -> throw new IllegalArgumentException("Unsupported mode: " + mode);
    }
    return Map.copyOf(defaults);
  }

  private static Map<String, String> buildCommonDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("metricsExporter", "otlp");
    map.put("otelEndpoint", "");
    map.put("otelResourceAttributes", "");
    map.put("photos", "");
    map.put("gpx", "");
    map.put("policy", "average");
    map.put("maxDelta", "600");
    map.put("maxDistance", "1000");
    map.put("satisfy", "any");
    map.put("timezone", "UTC");
    map.put("timeOffset", "0");
    map.put("overwrite", "false");
    map.put("augment", "");
    map.put("results", "");
    map.put("geocode", "false");
    map.put("geonamesUser", "");
    map.put("geonamesUrl", GeoNamesPlaceLookup.DEFAULT_BASE_URL);
    map.put("throttle", "0");
    map.put("queueCapacity", Integer.toString(Pipeline.DEFAULT_QUEUE_CAPACITY));
    return Map.copyOf(map);
  }
}
