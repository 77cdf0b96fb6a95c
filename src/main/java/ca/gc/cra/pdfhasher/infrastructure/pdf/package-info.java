/**
 * In-process PDF metadata adapters built on Apache PDFBox.
 *
 * @since 0.1.0
 */
package ca.gc.cra.pdfhasher.infrastructure.pdf;
