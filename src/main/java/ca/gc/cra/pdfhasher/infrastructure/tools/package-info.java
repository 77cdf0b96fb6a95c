/**
 * <strong>Purpose:</strong> Adapters invoking external command-line tools: {@code mutool}, {@code pdfsig},
 * {@code exiftool}, {@code otfinfo} and {@code fc-scan}.
 * <p><strong>Execution:</strong> Every command runs through {@link ca.gc.cra.pdfhasher.infrastructure.tools.CommandRunner}
 * with a timeout and output captured to temp files.</p>
 * <p><strong>Degradation:</strong> Optional tools that are missing or fail yield blank values; only the extractor
 * reports failures.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.pdfhasher.infrastructure.tools;
