/**
 * TCP adapters: the ingestion listener, per-connection sessions and the line-protocol client.
 * <p><strong>Concurrency:</strong> Thread per connection; sessions share only the protocol handler.</p>
 * <p><strong>Metrics:</strong> {@code ingest.connections.opened}, {@code ingest.connections.closed}.</p>
 */
package ca.gc.cra.xlog.infrastructure.net;
