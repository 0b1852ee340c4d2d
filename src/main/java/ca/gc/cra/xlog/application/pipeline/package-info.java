/**
 * Ingestion pipeline: protocol handling, the single persistence writer, shutdown and server orchestration.
 * <p><strong>Concurrency:</strong> Connection threads produce into the {@link
 * ca.gc.cra.xlog.application.pipeline.XlogContext} queue; the {@code xlog-writer} thread is its only consumer.</p>
 * <p><strong>Metrics:</strong> {@code ingest.lines.*}, {@code writer.*}, {@code shutdown.drain.timeout}.</p>
 */
package ca.gc.cra.xlog.application.pipeline;
