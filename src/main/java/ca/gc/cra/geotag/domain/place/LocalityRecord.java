package ca.gc.cra.geotag.domain.place;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Raw reverse-geocoding answer for one coordinate: a country code plus named locality fields.
 *
 * @param countryCode ISO 3166 alpha-2 code; never {@code null}
 * @param fields provider-specific locality fields such as {@code name} or {@code adminName1}; copied
 * @since 0.1.0
 */
public record LocalityRecord(String countryCode, Map<String, String> fields) {

  public LocalityRecord {
    Objects.requireNonNull(countryCode, "countryCode");
    fields = Map.copyOf(Objects.requireNonNull(fields, "fields"));
  }

  /**
   * Looks up a locality field.
   *
   * @param name field name
   * @return non-blank value when present
   */
  public Optional<String> field(String name) {
    if (name == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(fields.get(name)).filter(v -> !v.isBlank());
  }
}
