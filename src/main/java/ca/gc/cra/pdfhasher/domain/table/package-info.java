/**
 * Tab-separated table formats: the object table schema and its legacy migration, ledger lines, and the
 * hash-count projection.
 * <p><strong>Concurrency:</strong> Pure functions and immutable records; file access lives in
 * {@code infrastructure.persistence}.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.pdfhasher.domain.table;
