/**
 * <strong>Purpose:</strong> Per-document processing states and scan outcomes.
 * <p><strong>Pipeline role:</strong> Domain layer; produced by the coordinator and aggregated by scans.</p>
 * <p><strong>Observability:</strong> Each terminal state maps to an {@code ingest.document.<state>} counter.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.pdfhasher.domain.ingest;
