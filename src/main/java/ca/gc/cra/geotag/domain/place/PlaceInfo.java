package ca.gc.cra.geotag.domain.place;

import java.util.Objects;

/**
 * Place names attached to a photo.
 *
 * @param city city-equivalent name; may be empty
 * @param provinceState province- or state-equivalent name; may be empty
 * @param countryName country display name; may be empty
 * @param countryCode ISO 3166 alpha-2 code
 * @since 0.1.0
 */
public record PlaceInfo(String city, String provinceState, String countryName, String countryCode) {

  public PlaceInfo {
    city = Objects.requireNonNullElse(city, "");
    provinceState = Objects.requireNonNullElse(provinceState, "");
    countryName = Objects.requireNonNullElse(countryName, "");
    countryCode = Objects.requireNonNullElse(countryCode, "");
  }
}
