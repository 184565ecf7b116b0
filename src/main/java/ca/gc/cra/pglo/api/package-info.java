/**
 * Command-line entry points.
 * <p>Arguments are {@code key=value} pairs plus {@code --flags}. Results go to stdout; diagnostics go to the log.
 * Exit codes are listed in {@link ca.gc.cra.pglo.api.ExitCode}.</p>
 */
package ca.gc.cra.pglo.api;
