/**
 * <strong>Purpose:</strong> Record model for the ingestion pipeline: the flat-file layout, normalized
 * records, and rejection outcomes.
 * <p><strong>Concurrency:</strong> All types are immutable and safe to pass between threads.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.xlog.domain.record;
