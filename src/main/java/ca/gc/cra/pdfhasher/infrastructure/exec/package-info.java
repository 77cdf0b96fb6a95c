/**
 * Executor factories for the ingest worker pool.
 *
 * @since 0.1.0
 */
package ca.gc.cra.pdfhasher.infrastructure.exec;
