package ca.gc.cra.geotag.domain.item;

/**
 * Columns of the result table, in output order.
 *
 * @since 0.1.0
 */
public enum ResultField {
  FILE("File"),
  DATE("Date"),
  LATITUDE("Latitude"),
  LONGITUDE("Longitude"),
  ELEVATION("Elevation"),
  CITY("City"),
  PROVINCE_STATE("ProvinceState"),
  COUNTRY_NAME("CountryName");

  private final String header;

  ResultField(String header) {
    this.header = header;
  }

  /**
   * Returns the column header text.
   *
   * @return header used in tabular files
   */
  public String header() {
    return header;
  }
}
