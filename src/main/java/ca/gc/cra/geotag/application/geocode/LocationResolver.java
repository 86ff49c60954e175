package ca.gc.cra.geotag.application.geocode;

import ca.gc.cra.geotag.application.port.MetricsPort;
import ca.gc.cra.geotag.application.port.PlaceLookup;
import ca.gc.cra.geotag.application.port.PlaceLookupException;
import ca.gc.cra.geotag.domain.geo.Position;
import ca.gc.cra.geotag.domain.place.CountryFieldTable;
import ca.gc.cra.geotag.domain.place.CountryFields;
import ca.gc.cra.geotag.domain.place.LocalityRecord;
import ca.gc.cra.geotag.domain.place.PlaceInfo;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Caching, rate-limited front for the remote place lookup.
 * <p><strong>Caches:</strong> resolved places keyed by exact latitude/longitude and country names keyed by country
 * code. Both live for the whole run and are unbounded, since a run covers a finite, known set of photos.</p>
 * <p><strong>Pacing:</strong> only cache misses go through the {@link Throttle}; hits skip the network and the
 * wait.</p>
 * <p><strong>Thread-safety:</strong> Not thread-safe. Confined to the geocode stage thread, the only reader and
 * writer of the caches and the throttle state.</p>
 *
 * @since 0.1.0
 */
public final class LocationResolver {
  private final PlaceLookup lookup;
  private final Throttle throttle;
  private final CountryFieldTable fieldTable;
  private final MetricsPort metrics;
  private final Map<Coordinate, PlaceInfo> places = new HashMap<>();
  private final Map<String, String> countryNames = new HashMap<>();

  /**
   * Creates a resolver.
   *
   * @param lookup remote lookup
   * @param throttle call pacing
   * @param fieldTable per-country locality field selection
   * @param metrics metrics sink
   */
  public LocationResolver(
      PlaceLookup lookup, Throttle throttle, CountryFieldTable fieldTable, MetricsPort metrics) {
    this.lookup = Objects.requireNonNull(lookup, "lookup");
    this.throttle = Objects.requireNonNull(throttle, "throttle");
    this.fieldTable = Objects.requireNonNull(fieldTable, "fieldTable");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Resolves place names for a position.
   *
   * @param position position to resolve; elevation is ignored
   * @return city, province/state, and country names
   * @throws PlaceLookupException if the remote lookup fails; nothing is cached in that case
   * @throws InterruptedException if interrupted while throttled or during the call
   */
  public PlaceInfo resolve(Position position) throws PlaceLookupException, InterruptedException {
    Coordinate key = new Coordinate(position.latitude(), position.longitude());
    PlaceInfo cached = places.get(key);
    if (cached != null) {
      metrics.increment("geocode.cache.hit");
      return cached;
    }
    metrics.increment("geocode.cache.miss");
    throttle.acquire();
    LocalityRecord locality = lookup.location(key.latitude(), key.longitude());
    String countryName = countryName(locality.countryCode());
    CountryFields fields = fieldTable.fieldsFor(countryName);
    PlaceInfo place = new PlaceInfo(
        locality.field(fields.cityField()).orElse(""),
        locality.field(fields.provinceField()).orElse(""),
        countryName,
        locality.countryCode());
    places.put(key, place);
    return place;
  }

  private String countryName(String countryCode) throws PlaceLookupException, InterruptedException {
    if (countryCode.isBlank()) {
      return "";
    }
    String cached = countryNames.get(countryCode);
    if (cached != null) {
      return cached;
    }
    String name = lookup.countryName(countryCode);
    countryNames.put(countryCode, name);
    return name;
  }

  int cachedPlaces() {
    return places.size();
  }

  int cachedCountries() {
    return countryNames.size();
  }

  private record Coordinate(double latitude, double longitude) {}
}
