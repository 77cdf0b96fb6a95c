/**
 * <strong>Purpose:</strong> Scan and monitor use cases feeding documents to the coordinator.
 * <p><strong>Pipeline role:</strong> Application layer entry points invoked by the CLI.</p>
 * <p><strong>Concurrency:</strong> Catch-up scans may fan out over a bounded worker pool; monitoring runs on the
 * caller's thread.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.pdfhasher.application.pipeline;
