/**
 * Place-name values and the per-country table choosing which locality fields name the city and province.
 */
package ca.gc.cra.geotag.domain.place;
