/**
 * Document identity, extracted objects, and filename-derived filing attributes.
 *
 * @since 0.1.0
 */
package ca.gc.cra.pdfhasher.domain.document;
