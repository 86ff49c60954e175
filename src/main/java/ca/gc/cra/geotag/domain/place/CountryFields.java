package ca.gc.cra.geotag.domain.place;

import java.util.Objects;

/**
 * Names of the locality fields that hold the city- and province-equivalent for a country.
 *
 * @param cityField locality field used as the city
 * @param provinceField locality field used as the province or state
 * @since 0.1.0
 */
public record CountryFields(String cityField, String provinceField) {

  public CountryFields {
    Objects.requireNonNull(cityField, "cityField");
    Objects.requireNonNull(provinceField, "provinceField");
  }

  /**
   * Parses {@code "cityField,provinceField"}.
   *
   * @param text comma-separated pair
   * @return parsed pair
   * @throws IllegalArgumentException if the text does not contain exactly two non-blank names
   */
  public static CountryFields parse(String text) {
    if (text == null) {
      throw new IllegalArgumentException("country fields must be 'cityField,provinceField'");
    }
    String[] parts = text.split(",");
    if (parts.length != 2 || parts[0].isBlank() || parts[1].isBlank()) {
      throw new IllegalArgumentException("country fields must be 'cityField,provinceField' (was " + text + ")");
    }
    return new CountryFields(parts[0].trim(), parts[1].trim());
  }
}
