/**
 * Logback runtime tweaks and redaction helpers.
 */
package ca.gc.cra.pglo.logging;
