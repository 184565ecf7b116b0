/**
 * Configuration model, YAML loading, precedence rules and wiring.
 * <p>Precedence is CLI {@code key=value} over the YAML file over built-in defaults; connection settings left blank
 * fall back to {@code PGLO_*} environment variables.</p>
 */
package ca.gc.cra.pglo.config;
