/**
 * Command-line entry point of the ingest pipeline.
 * <p><strong>Role:</strong> Parses flags and {@code key=value} arguments, builds the configuration and maps
 * failures to {@link ca.gc.cra.pdfhasher.api.ExitCode}s.</p>
 */
package ca.gc.cra.pdfhasher.api;
