/**
 * Named locks combining a JVM lock with an OS file lock.
 *
 * @since 0.1.0
 */
package ca.gc.cra.pdfhasher.infrastructure.persistence.lock;
