package ca.gc.cra.geotag.application.port;

import ca.gc.cra.geotag.domain.geo.Position;
import ca.gc.cra.geotag.domain.place.LocalityRecord;
import java.time.ZoneId;

/**
 * <strong>What:</strong> Port to the remote reverse-geocoding service.
 * <p><strong>Role:</strong> Called only from {@code LocationResolver}, which caches and paces the calls.</p>
 * <p><strong>Thread-safety:</strong> Implementations are invoked from a single stage thread plus, once at startup,
 * the driver thread.</p>
 *
 * @since 0.1.0
 */
public interface PlaceLookup {

  /**
   * Reverse-geocodes a coordinate.
   *
   * @param latitude latitude in decimal degrees
   * @param longitude longitude in decimal degrees
   * @return country code and locality fields
   * @throws PlaceLookupException on network or response faults
   * @throws InterruptedException if the calling thread is interrupted during the call
   */
  LocalityRecord location(double latitude, double longitude) throws PlaceLookupException, InterruptedException;

  /**
   * Resolves a country display name.
   *
   * @param countryCode ISO 3166 alpha-2 code
   * @return display name
   * @throws PlaceLookupException on network or response faults
   * @throws InterruptedException if the calling thread is interrupted during the call
   */
  String countryName(String countryCode) throws PlaceLookupException, InterruptedException;

  /**
   * Resolves the time zone at a position.
   *
   * @param position position to query
   * @return zone identifier
   * @throws PlaceLookupException on network or response faults
   * @throws InterruptedException if the calling thread is interrupted during the call
   */
  ZoneId timezone(Position position) throws PlaceLookupException, InterruptedException;
}
