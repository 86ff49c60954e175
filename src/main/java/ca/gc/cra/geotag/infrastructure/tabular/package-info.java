/**
 * CSV adapters for augmentation input and result output (Jackson CSV).
 */
package ca.gc.cra.geotag.infrastructure.tabular;
