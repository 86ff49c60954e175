package ca.gc.cra.geotag.config;

import ca.gc.cra.geotag.application.pipeline.Pipeline;
import ca.gc.cra.geotag.domain.correlate.CorrelationPolicy;
import ca.gc.cra.geotag.domain.correlate.CorrelationSettings;
import ca.gc.cra.geotag.domain.correlate.SatisfyMode;
import ca.gc.cra.geotag.domain.place.CountryFields;
import ca.gc.cra.geotag.infrastructure.geonames.GeoNamesPlaceLookup;
import ca.gc.cra.geotag.validation.Numbers;
import ca.gc.cra.geotag.validation.Paths;
import ca.gc.cra.geotag.validation.Strings;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.ZoneId;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Validated settings for one {@code geotag run} or {@code geotag plan} invocation.
 * <p><strong>Why:</strong> Turns the merged flat key/value map (defaults, YAML, CLI) into typed values once,
 * so the composition root never parses strings.</p>
 * <p><strong>Role:</strong> Input to {@link CompositionRoot}.</p>
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 *
 * @param photos directory holding the photos (and their metadata sidecars)
 * @param gpx GPS track file; empty disables correlation
 * @param correlation correlation policy and thresholds
 * @param timezone zone the camera clock was set to; empty means resolve from the track's first point
 * @param timeOffset how far the camera clock runs ahead of true time
 * @param overwrite whether to replace positions and place names photos already carry
 * @param augment prior-run CSV merged into metadata; empty disables augmentation
 * @param results CSV file receiving one row per photo; empty disables the result table
 * @param geocode whether to resolve place names
 * @param geonamesUser GeoNames account name; required for geocoding and automatic time zones
 * @param geonamesUrl GeoNames service root
 * @param throttle maximum GeoNames requests per hour; {@code 0} means unthrottled
 * @param queueCapacity capacity of each inter-stage queue
 * @param dryRun whether to skip metadata commits
 * @param countryFields per-country locality field overrides, keyed by country name
 * @since 0.1.0
 */
public record GeotagConfig(
    Path photos,
    Optional<Path> gpx,
    CorrelationSettings correlation,
    Optional<ZoneId> timezone,
    Duration timeOffset,
    boolean overwrite,
    Optional<Path> augment,
    Optional<Path> results,
    boolean geocode,
    Optional<String> geonamesUser,
    String geonamesUrl,
    double throttle,
    int queueCapacity,
    boolean dryRun,
    Map<String, CountryFields> countryFields) {

  static final String AUTO_TIMEZONE = "auto";
  static final String COUNTRY_FIELDS_PREFIX = "countryFields.";
  private static final int MAX_QUEUE_CAPACITY = 1_024;
  private static final int MAX_USERNAME_LENGTH = 128;

  public GeotagConfig {
    Objects.requireNonNull(photos, "photos");
    gpx = Objects.requireNonNullElse(gpx, Optional.empty());
    Objects.requireNonNull(correlation, "correlation");
    timezone = Objects.requireNonNullElse(timezone, Optional.empty());
    Objects.requireNonNull(timeOffset, "timeOffset");
    augment = Objects.requireNonNullElse(augment, Optional.empty());
    results = Objects.requireNonNullElse(results, Optional.empty());
    geonamesUser = Objects.requireNonNullElse(geonamesUser, Optional.<String>empty())
        .map(String::trim)
        .filter(s -> !s.isEmpty());
    Objects.requireNonNull(geonamesUrl, "geonamesUrl");
    Numbers.requireNonNegative("throttle", throttle);
    Numbers.requireRange("queueCapacity", queueCapacity, 1, MAX_QUEUE_CAPACITY);
    countryFields = Map.copyOf(Objects.requireNonNull(countryFields, "countryFields"));
    if (geocode && geonamesUser.isEmpty()) {
      throw new IllegalArgumentException("geonamesUser is required when geocode=true");
    }
    if (timezone.isEmpty() && gpx.isPresent() && geonamesUser.isEmpty()) {
      throw new IllegalArgumentException("timezone=auto requires geonamesUser");
    }
  }

  /**
   * Builds a configuration from the merged flat map.
   *
   * <p>File system checks run here: the photo directory must exist (and be writable unless
   * {@code dryRun}), input files must be readable, and the result file's directory writable.</p>
   *
   * @param args merged key/value settings
   * @return validated configuration
   * @throws IllegalArgumentException if a value is missing, malformed or out of range
   */
  public static GeotagConfig fromMap(Map<String, String> args) {
    Objects.requireNonNull(args, "args");
    boolean dryRun = parseBoolean(args.get("dryRun"), false);

    String photosRaw = optionalString(args.get("photos"))
        .orElseThrow(() -> new IllegalArgumentException("photos is required"));
    Path photos = Paths.requireDirectory("photos", parsePath("photos", photosRaw), !dryRun);
    Optional<Path> gpx = optionalString(args.get("gpx"))
        .map(raw -> Paths.requireReadableFile("gpx", parsePath("gpx", raw)));
    Optional<Path> augment = optionalString(args.get("augment"))
        .map(raw -> Paths.requireReadableFile("augment", parsePath("augment", raw)));
    Optional<Path> results = optionalString(args.get("results"))
        .map(raw -> Paths.requireWritableFile("results", parsePath("results", raw)));

    CorrelationSettings correlation = new CorrelationSettings(
        CorrelationPolicy.fromString(args.get("policy")),
        Duration.ofSeconds(parseLong("maxDelta", args.get("maxDelta"), 600L, 0L, Long.MAX_VALUE / 1_000L)),
        Numbers.requireNonNegative("maxDistance", parseDouble("maxDistance", args.get("maxDistance"), 1_000d)),
        SatisfyMode.fromString(args.get("satisfy")));

    Optional<ZoneId> timezone = parseZone(args.get("timezone"));
    Duration timeOffset = Duration.ofSeconds(
        parseLong("timeOffset", args.get("timeOffset"), 0L, -366L * 86_400L, 366L * 86_400L));

    Optional<String> user = optionalString(args.get("geonamesUser"))
        .map(raw -> Strings.requirePrintableAscii("geonamesUser", raw, MAX_USERNAME_LENGTH));
    String url = optionalString(args.get("geonamesUrl")).orElse(GeoNamesPlaceLookup.DEFAULT_BASE_URL);
    if (!url.startsWith("http://") && !url.startsWith("https://")) {
      throw new IllegalArgumentException("geonamesUrl must use http or https (was " + url + ")");
    }

    return new GeotagConfig(
        photos,
        gpx,
        correlation,
        timezone,
        timeOffset,
        parseBoolean(args.get("overwrite"), false),
        augment,
        results,
        parseBoolean(args.get("geocode"), false),
        user,
        url,
        parseDouble("throttle", args.get("throttle"), 0d),
        (int) parseLong("queueCapacity", args.get("queueCapacity"), Pipeline.DEFAULT_QUEUE_CAPACITY, 1L,
            MAX_QUEUE_CAPACITY),
        dryRun,
        countryFields(args));
  }

  private static Map<String, CountryFields> countryFields(Map<String, String> args) {
    Map<String, CountryFields> fields = new LinkedHashMap<>();
    for (Map.Entry<String, String> entry : args.entrySet()) {
      String key = entry.getKey();
      if (key != null && key.startsWith(COUNTRY_FIELDS_PREFIX)) {
        String country = key.substring(COUNTRY_FIELDS_PREFIX.length()).trim();
        if (country.isEmpty()) {
          throw new IllegalArgumentException("countryFields key must name a country");
        }
        fields.put(country, CountryFields.parse(entry.getValue()));
      }
    }
    return fields;
  }

  private static Optional<ZoneId> parseZone(String raw) {
    String value = optionalString(raw).orElse("UTC");
    if (AUTO_TIMEZONE.equals(value.toLowerCase(Locale.ROOT))) {
      return Optional.empty();
    }
    try {
      return Optional.of(ZoneId.of(value));
    } catch (DateTimeException ex) {
      throw new IllegalArgumentException("timezone must be a zone id or 'auto' (was " + value + ")", ex);
    }
  }

  private static Path parsePath(String name, String raw) {
    try {
      return Path.of(raw);
    } catch (InvalidPathException ex) {
      throw new IllegalArgumentException(name + " is not a valid path: " + raw, ex);
    }
  }

  private static long parseLong(String name, String raw, long defaultValue, long min, long max) {
    Optional<String> value = optionalString(raw);
    if (value.isEmpty()) {
      return defaultValue;
    }
    try {
      return Numbers.requireRange(name, Long.parseLong(value.get()), min, max);
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(name + " must be a whole number (was " + value.get() + ")", ex);
    }
  }

  private static double parseDouble(String name, String raw, double defaultValue) {
    Optional<String> value = optionalString(raw);
    if (value.isEmpty()) {
      return defaultValue;
    }
    try {
      return Double.parseDouble(value.get());
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(name + " must be a number (was " + value.get() + ")", ex);
    }
  }

  private static boolean parseBoolean(String value, boolean defaultValue) {
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    String normalized = value.trim().toLowerCase(Locale.ROOT);
    return switch (normalized) {
      case "true", "yes", "1" -> true;
      case "false", "no", "0" -> false;
      default -> throw new IllegalArgumentException("expected true/false but was " + value);
    };
  }

  private static Optional<String> optionalString(String value) {
    if (value == null) {
      return Optional.empty();
    }
    String trimmed = value.trim();
    return trimmed.isEmpty() ? Optional.empty() : Optional.of(trimmed);
  }
}
