/**
 * GeoNames reverse-geocoding adapter.
 */
package ca.gc.cra.geotag.infrastructure.geonames;
