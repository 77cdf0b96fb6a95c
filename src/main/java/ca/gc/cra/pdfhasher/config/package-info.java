/**
 * Configuration loading, merging and the composition root for the ingest CLI.
 * <p><strong>Precedence:</strong> CLI {@code key=value} pairs override the YAML file, which overrides
 * {@link ca.gc.cra.pdfhasher.config.DefaultsForMode}.</p>
 * <p><strong>Concurrency:</strong> Configuration objects are immutable; safe to share.</p>
 */
package ca.gc.cra.pdfhasher.config;
