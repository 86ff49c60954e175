/**
 * Input validation helpers shared by configuration parsing and the CLI.
 */
package ca.gc.cra.geotag.validation;
