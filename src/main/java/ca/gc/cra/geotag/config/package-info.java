/**
 * <strong>Purpose:</strong> Configuration layering and wiring for GEOTAG.
 * <p>{@link ca.gc.cra.geotag.config.DefaultsForMode}, {@link ca.gc.cra.geotag.config.YamlConfigLoader} and
 * CLI pairs are merged by {@link ca.gc.cra.geotag.config.ConfigMerger}, validated into
 * {@link ca.gc.cra.geotag.config.GeotagConfig}, and turned into ports, stages and the run use case by
 * {@link ca.gc.cra.geotag.config.CompositionRoot}.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.geotag.config;
