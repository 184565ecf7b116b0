/**
 * Input guards used by configuration, the CLI and the JDBC bulk helpers.
 */
package ca.gc.cra.pglo.validation;
