package ca.gc.cra.xlog.application.port;

import java.io.IOException;
import java.net.InetSocketAddress;

/**
 * Network front end accepting client connections and feeding lines into the pipeline.
 *
 * @since 0.1.0
 */
public interface IngestionListener extends AutoCloseable {
  /**
   * Binds and starts the accept loop on a background thread.
   *
   * @throws IOException when the socket cannot be bound
   */
  void start() throws IOException;

  /**
   * Returns the bound address; useful when binding to an ephemeral port.
   *
   * @return local address
   * @throws IllegalStateException if not started
   */
  InetSocketAddress localAddress();

  /**
   * Stops accepting, closes open client connections and releases the socket. Idempotent.
   */
  @Override
  void close();
}
