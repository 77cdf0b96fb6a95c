/**
 * <strong>Purpose:</strong> Logging utilities that tune verbosity and bound external-tool output before emission.
 * <p><strong>Pipeline role:</strong> Cross-cutting support for the CLI and the tool adapters.</p>
 * <p><strong>Concurrency:</strong> Stateless helpers; thread-safe.</p>
 * <p><strong>Observability:</strong> Coordinates with SLF4J/Logback; no custom metrics.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.pdfhasher.logging;
