/**
 * Time values shared by the normalizer and the persistence writer.
 * <p><strong>Concurrency:</strong> Snapshots are immutable; publication is handled by
 * {@code ca.gc.cra.xlog.application.clock.ClockState}.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.xlog.domain.time;
