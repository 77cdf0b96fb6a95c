/**
 * Argument and configuration validation helpers shared by the CLI and configuration layers.
 *
 * <p>All helpers are stateless and report violations as {@link java.lang.IllegalArgumentException}
 * so the CLI can map them to the configuration exit code.</p>
 */
package ca.gc.cra.pdfhasher.validation;
