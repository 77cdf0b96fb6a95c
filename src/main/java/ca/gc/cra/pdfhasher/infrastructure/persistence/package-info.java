/**
 * <strong>Purpose:</strong> File-backed tables, dedup store, guards and stamps.
 * <p><strong>Pipeline role:</strong> Infrastructure adapters for the persistence ports.</p>
 * <p><strong>Durability:</strong> Tables are append-only or replaced through a temp file and atomic rename, so
 * readers never see a partially written file.</p>
 * <p><strong>Concurrency:</strong> Each table has its own {@code NamedFileLock}.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.pdfhasher.infrastructure.persistence;
