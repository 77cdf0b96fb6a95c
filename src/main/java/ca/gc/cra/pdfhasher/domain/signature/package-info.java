/**
 * Signature report model and the line scanner that fills it.
 *
 * <p>Reports come from an external verifier; only the first four signature blocks are retained because
 * the object table has four signature column groups.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.pdfhasher.domain.signature;
