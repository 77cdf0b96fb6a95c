/**
 * Content hashing adapters.
 *
 * @since 0.1.0
 */
package ca.gc.cra.pdfhasher.infrastructure.hash;
