/**
 * Caching and pacing in front of {@link ca.gc.cra.geotag.application.port.PlaceLookup}; confined to the geocode
 * stage thread.
 */
package ca.gc.cra.geotag.application.geocode;
