/**
 * GPX track file adapter.
 */
package ca.gc.cra.geotag.infrastructure.gpx;
