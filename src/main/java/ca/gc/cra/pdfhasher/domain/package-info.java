/**
 * Core domain model for the PDFHASHER ingest → extract → record pipeline.
 * <p><strong>Role:</strong> Domain layer value objects, parsers, and table formats without infrastructure dependencies.</p>
 * <p><strong>Concurrency:</strong> Types are immutable unless noted; safe to share across worker threads.</p>
 * <p><strong>Metrics:</strong> Document states feed the {@code ingest.document.*} counters.</p>
 */
package ca.gc.cra.pdfhasher.domain;
