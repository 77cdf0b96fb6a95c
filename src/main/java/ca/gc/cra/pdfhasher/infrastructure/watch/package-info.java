/**
 * <strong>Purpose:</strong> Watchers reporting new documents in the input directory.
 * <p><strong>Modes:</strong> {@code native} uses {@link java.nio.file.WatchService}; {@code poll} rescans on a
 * fixed interval for file systems without change notification (network shares).</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.pdfhasher.infrastructure.watch;
