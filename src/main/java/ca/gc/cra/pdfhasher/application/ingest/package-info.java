/**
 * <strong>Purpose:</strong> Exactly-once processing of a single document.
 * <p><strong>Pipeline role:</strong> Application layer between the scan/watch use cases and the ports.</p>
 * <p><strong>Concurrency:</strong> {@link ca.gc.cra.pdfhasher.application.ingest.ProcessingCoordinator} may be
 * shared by several workers; per-document exclusion comes from the in-flight guards.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.pdfhasher.application.ingest;
