/**
 * Flat-file persistence adapters.
 * <p><strong>Concurrency:</strong> Sinks are owned by the writer thread; {@code close()} may race with it and is
 * synchronized.</p>
 */
package ca.gc.cra.xlog.infrastructure.persistence;
