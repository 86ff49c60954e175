/**
 * <strong>Purpose:</strong> Command-line surface of GEOTAG: the {@code run} and {@code plan} subcommands, argument
 * parsing and exit codes.
 * <p>Flags preceding the subcommand (for example {@code --verbose}) apply globally; flags after it are handled by
 * {@link ca.gc.cra.geotag.api.GeotagCli}.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.geotag.api;
