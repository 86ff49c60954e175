/**
 * Maps a photo timestamp onto a track position under a tie-break policy and acceptance thresholds.
 */
package ca.gc.cra.geotag.domain.correlate;
