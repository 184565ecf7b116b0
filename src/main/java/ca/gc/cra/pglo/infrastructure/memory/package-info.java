/**
 * In-memory reference backend mirroring PostgreSQL large-object behaviour, used by the test suite and for local
 * runs without a database.
 */
package ca.gc.cra.pglo.infrastructure.memory;
