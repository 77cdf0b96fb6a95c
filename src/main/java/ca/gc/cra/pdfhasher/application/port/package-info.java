/**
 * <strong>Purpose:</strong> Ports the ingest pipeline depends on: external tools, durable tables, the dedup store
 * and the in-flight guards.
 * <p><strong>Pipeline role:</strong> Application boundary; adapters in {@code infrastructure} implement these
 * interfaces.</p>
 * <p><strong>Concurrency:</strong> Implementations must be safe to call from several coordinator workers.</p>
 * <p><strong>Error model:</strong> Tool ports degrade to blank values; persistence ports throw
 * {@link java.io.IOException}, which the coordinator treats as fatal.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.pdfhasher.application.port;
