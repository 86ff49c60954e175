/**
 * Per-photo work item, its typed tag values, and codecs between tags and domain values (GPS coordinates,
 * capture time).
 */
package ca.gc.cra.geotag.domain.item;
