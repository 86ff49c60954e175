/**
 * <strong>Purpose:</strong> Geographic value types and the GPS track model.
 * <p>{@link ca.gc.cra.geotag.domain.geo.Track} is immutable once built: sorted by time, exact duplicates removed,
 * and searched by binary search. {@link ca.gc.cra.geotag.domain.geo.GeoMath} computes haversine distances on a
 * sphere of radius 6,371 km.</p>
 * <p><strong>Concurrency:</strong> Every type here is immutable and safe to share across stage threads.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.geotag.domain.geo;
