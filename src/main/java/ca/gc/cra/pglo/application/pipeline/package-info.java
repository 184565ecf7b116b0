/**
 * Use cases built on the large-object handle: bulk import and export, the scoped repository facade and the
 * chunk-per-scope upload writer.
 */
package ca.gc.cra.pglo.application.pipeline;
