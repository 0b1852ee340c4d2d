/**
 * Application layer orchestration for the XLOG ingestion daemon.
 * <p><strong>Role:</strong> Hosts the normalizer, clock state and the listener -> queue -> writer pipeline.</p>
 * <p><strong>Concurrency:</strong> One thread per client connection feeds an unbounded FIFO drained by a single
 * writer thread.</p>
 * <p><strong>Metrics:</strong> Emits namespaces {@code ingest.*}, {@code writer.*} and {@code shutdown.*}.</p>
 */
package ca.gc.cra.xlog.application;
