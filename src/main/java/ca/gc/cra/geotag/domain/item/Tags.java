package ca.gc.cra.geotag.domain.item;

/**
 * Tag names read and written by the pipeline stages. Stores treat them as opaque keys.
 *
 * @since 0.1.0
 */
public final class Tags {
  public static final String DATE_TIME_ORIGINAL = "Exif.Photo.DateTimeOriginal";
  public static final String GPS_LATITUDE = "Exif.GPSInfo.GPSLatitude";
  public static final String GPS_LATITUDE_REF = "Exif.GPSInfo.GPSLatitudeRef";
  public static final String GPS_LONGITUDE = "Exif.GPSInfo.GPSLongitude";
  public static final String GPS_LONGITUDE_REF = "Exif.GPSInfo.GPSLongitudeRef";
  public static final String GPS_ALTITUDE = "Exif.GPSInfo.GPSAltitude";
  public static final String GPS_ALTITUDE_REF = "Exif.GPSInfo.GPSAltitudeRef";
  public static final String CITY = "Iptc.Application2.City";
  public static final String PROVINCE_STATE = "Iptc.Application2.ProvinceState";
  public static final String COUNTRY_NAME = "Iptc.Application2.CountryName";
  public static final String COUNTRY_CODE = "Iptc.Application2.CountryCode";

  private Tags() {}
}
