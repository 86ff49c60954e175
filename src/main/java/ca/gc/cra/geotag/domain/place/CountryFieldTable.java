package ca.gc.cra.geotag.domain.place;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Default locality field pair plus explicit per-country overrides keyed by country name.
 *
 * <p>Lookup is a plain keyed lookup with fallback to the default.</p>
 *
 * @since 0.1.0
 */
public final class CountryFieldTable {
  /** Field pair used for countries without an override. */
  public static final CountryFields DEFAULT_FIELDS = new CountryFields("name", "adminName1");

  private final CountryFields defaults;
  private final Map<String, CountryFields> overrides;

  /**
   * Creates a table.
   *
   * @param defaults fallback pair
   * @param overrides overrides keyed by country display name; copied
   */
  public CountryFieldTable(CountryFields defaults, Map<String, CountryFields> overrides) {
    this.defaults = Objects.requireNonNull(defaults, "defaults");
    this.overrides = Map.copyOf(Objects.requireNonNull(overrides, "overrides"));
  }

  /**
   * Returns the built-in table.
   *
   * @return table with the default pair and overrides for the United States and United Kingdom
   */
  public static CountryFieldTable standard() {
    return new CountryFieldTable(DEFAULT_FIELDS, builtInOverrides());
  }

  /**
   * Returns the built-in table extended with extra overrides; extras win on conflict.
   *
   * @param extra additional overrides keyed by country name
   * @return merged table
   */
  public static CountryFieldTable withOverrides(Map<String, CountryFields> extra) {
    Map<String, CountryFields> merged = new LinkedHashMap<>(builtInOverrides());
    merged.putAll(Objects.requireNonNull(extra, "extra"));
    return new CountryFieldTable(DEFAULT_FIELDS, merged);
  }

  /**
   * Selects the field pair for a country.
   *
   * @param countryName display name as returned by the place lookup
   * @return override when present, else the default pair
   */
  public CountryFields fieldsFor(String countryName) {
    if (countryName == null) {
      return defaults;
    }
    CountryFields override = overrides.get(countryName);
    return override != null ? override : defaults;
  }

  public Map<String, CountryFields> overrides() {
    return overrides;
  }

  private static Map<String, CountryFields> builtInOverrides() {
    Map<String, CountryFields> map = new LinkedHashMap<>();
    map.put("United States", new CountryFields("name", "adminCode1"));
    map.put("United Kingdom", new CountryFields("adminName2", "adminName1"));
    return map;
  }
}
