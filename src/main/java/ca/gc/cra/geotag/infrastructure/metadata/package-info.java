/**
 * Metadata store adapters.
 *
 * <p>{@link ca.gc.cra.geotag.infrastructure.metadata.JsonSidecarMetadataStore} persists tags in JSON sidecar
 * files; {@link ca.gc.cra.geotag.infrastructure.metadata.InMemoryMetadataStore} keeps them on the heap.</p>
 */
package ca.gc.cra.geotag.infrastructure.metadata;
