/**
 * <strong>Purpose:</strong> Adapters implementing the application ports against the local file system and external
 * command-line tools.
 * <p><strong>Pipeline role:</strong> Infrastructure layer wired by {@code config.CompositionRoot}.</p>
 * <p><strong>Concurrency:</strong> Persistence adapters serialize writers with named file locks that exclude both
 * threads and processes.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.pdfhasher.infrastructure;
