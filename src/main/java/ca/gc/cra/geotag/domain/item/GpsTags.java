package ca.gc.cra.geotag.domain.item;

import ca.gc.cra.geotag.domain.geo.Position;
import java.util.List;
import java.util.Optional;

/**
 * <strong>What:</strong> Codec between {@link Position} and EXIF-style GPS tags.
 * <p><strong>Format:</strong> latitude/longitude as three rationals (degrees, minutes, seconds) plus a hemisphere
 * reference letter; altitude as one rational plus a reference integer (0 above, 1 below sea level).</p>
 * <p><strong>Thread-safety:</strong> Stateless.</p>
 *
 * @since 0.1.0
 */
public final class GpsTags {
  private static final long SECONDS_DENOMINATOR = 10_000L;
  private static final long ALTITUDE_DENOMINATOR = 100L;

  private GpsTags() {
    // Utility
  }

  /**
   * Writes {@code position} into the item's GPS tags, marking it dirty. A position without elevation removes any
   * altitude tags left from an earlier position.
   *
   * @param item target item
   * @param position position to encode
   */
  public static void write(WorkItem item, Position position) {
    double lat = position.latitude();
    double lon = position.longitude();
    item.set(Tags.GPS_LATITUDE, TagValue.rationals(toDms(Math.abs(lat))));
    item.set(Tags.GPS_LATITUDE_REF, TagValue.text(lat < 0 ? "S" : "N"));
    item.set(Tags.GPS_LONGITUDE, TagValue.rationals(toDms(Math.abs(lon))));
    item.set(Tags.GPS_LONGITUDE_REF, TagValue.text(lon < 0 ? "W" : "E"));
    if (position.hasElevation()) {
      writeAltitude(item, position.elevation());
    } else {
      item.remove(Tags.GPS_ALTITUDE);
      item.remove(Tags.GPS_ALTITUDE_REF);
    }
  }

  /**
   * Writes only the altitude tags, marking the item dirty.
   *
   * @param item target item
   * @param elevation metres relative to sea level
   */
  public static void writeAltitude(WorkItem item, double elevation) {
    item.set(Tags.GPS_ALTITUDE,
        TagValue.rationals(List.of(Rational.of(Math.abs(elevation), ALTITUDE_DENOMINATOR))));
    item.set(Tags.GPS_ALTITUDE_REF, TagValue.integer(elevation < 0 ? 1L : 0L));
  }

  /**
   * Decodes the item's GPS tags.
   *
   * @param item source item
   * @return position when both latitude and longitude tags are present
   * @throws ItemProcessingException if a present tag has the wrong shape
   */
  public static Optional<Position> read(WorkItem item) {
    if (!item.contains(Tags.GPS_LATITUDE) || !item.contains(Tags.GPS_LONGITUDE)) {
      return Optional.empty();
    }
    double lat = fromDms(item, Tags.GPS_LATITUDE);
    double lon = fromDms(item, Tags.GPS_LONGITUDE);
    if (item.text(Tags.GPS_LATITUDE_REF).map(r -> r.trim().equalsIgnoreCase("S")).orElse(false)) {
      lat = -lat;
    }
    if (item.text(Tags.GPS_LONGITUDE_REF).map(r -> r.trim().equalsIgnoreCase("W")).orElse(false)) {
      lon = -lon;
    }
    Double elevation = null;
    if (item.contains(Tags.GPS_ALTITUDE)) {
      List<Rational> alt = rationals(item, Tags.GPS_ALTITUDE);
      if (alt.isEmpty()) {
        throw new ItemProcessingException(item.identity(), Tags.GPS_ALTITUDE + " is empty");
      }
      elevation = alt.get(0).doubleValue();
      boolean below = item.get(Tags.GPS_ALTITUDE_REF)
          .map(v -> v instanceof TagValue.Integer i && i.value() == 1L)
          .orElse(false);
      if (below) {
        elevation = -elevation;
      }
    }
    try {
      return Optional.of(new Position(lat, lon, elevation));
    } catch (IllegalArgumentException ex) {
      throw new ItemProcessingException(item.identity(), "GPS tags out of range", ex);
    }
  }

  // rounds once in seconds units so 59.99999" carries into the minutes
  static List<Rational> toDms(double value) {
    long units = Math.round(value * 3_600d * SECONDS_DENOMINATOR);
    long perMinute = 60L * SECONDS_DENOMINATOR;
    long perDegree = 60L * perMinute;
    return List.of(
        new Rational(units / perDegree, 1L),
        new Rational((units % perDegree) / perMinute, 1L),
        new Rational(units % perMinute, SECONDS_DENOMINATOR));
  }

  private static double fromDms(WorkItem item, String tag) {
    List<Rational> parts = rationals(item, tag);
    if (parts.isEmpty() || parts.size() > 3) {
      throw new ItemProcessingException(item.identity(), tag + " must hold 1 to 3 rationals");
    }
    double value = 0d;
    double scale = 1d;
    for (Rational part : parts) {
      value += part.doubleValue() / scale;
      scale *= 60d;
    }
    return value;
  }

  private static List<Rational> rationals(WorkItem item, String tag) {
    TagValue value = item.get(tag).orElseThrow();
    if (value instanceof TagValue.RationalList list) {
      return list.values();
    }
    throw new ItemProcessingException(item.identity(), tag + " must be a rational list");
  }
}
