package ca.gc.cra.xlog.infrastructure.net;

import ca.gc.cra.xlog.application.pipeline.LineProtocolHandler;
import ca.gc.cra.xlog.application.pipeline.XlogContext;
import ca.gc.cra.xlog.application.port.IngestionListener;
import ca.gc.cra.xlog.application.port.MetricsPort;
import ca.gc.cra.xlog.infrastructure.exec.ExecutorFactories;
import ca.gc.cra.xlog.logging.Logs;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.net.SocketException;
import java.time.Duration;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> TCP front end accepting line-protocol clients.
 * <p><strong>Threads:</strong> one {@code xlog-listener} accept thread plus one daemon thread per connection from an
 * unbounded cached pool.</p>
 * <p><strong>Failure model:</strong> Connection faults are classified, logged and close only that connection. Accept
 * failures while running are logged and the loop continues.</p>
 * <p><strong>Thread-safety:</strong> {@link #close()} may be called from any thread and is idempotent.</p>
 *
 * @since 0.1.0
 */
public final class TcpIngestionListener implements IngestionListener {
  private static final Logger log = LoggerFactory.getLogger(TcpIngestionListener.class);
  private static final Duration POOL_TERMINATION_WAIT = Duration.ofSeconds(2);

  private final String host;
  private final int port;
  private final int backlog;
  private final LineProtocolHandler handler;
  private final XlogContext context;
  private final MetricsPort metrics;
  private final String ipPrefix;

  private final Set<Socket> clients = ConcurrentHashMap.newKeySet();
  private final AtomicBoolean started = new AtomicBoolean();
  private final AtomicBoolean closing = new AtomicBoolean();

  private volatile ServerSocket serverSocket;
  private volatile ExecutorService connectionPool;

  /**
   * Creates a listener.
   *
   * @param host bind address
   * @param port bind port; {@code 0} picks an ephemeral port
   * @param backlog accept backlog
   * @param handler per-line protocol handler
   * @param context shared server state (connection counters)
   * @param metrics metrics sink
   * @param ipPrefix address prefix elided from diagnostics
   */
  public TcpIngestionListener(
      String host,
      int port,
      int backlog,
      LineProtocolHandler handler,
      XlogContext context,
      MetricsPort metrics,
      String ipPrefix) {
    this.host = Objects.requireNonNull(host, "host");
    this.port = port;
    this.backlog = backlog;
    this.handler = Objects.requireNonNull(handler, "handler");
    this.context = Objects.requireNonNull(context, "context");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.ipPrefix = ipPrefix == null ? "" : ipPrefix;
  }

  @Override
  public void start() throws IOException {
    if (!started.compareAndSet(false, true)) {
      throw new IllegalStateException("Listener already started");
    }
    ServerSocket socket = new ServerSocket();
    try {
      socket.setReuseAddress(true);
      socket.bind(new InetSocketAddress(host, port), backlog);
    } catch (IOException ex) {
      socket.close();
      throw ex;
    }
    serverSocket = socket;
    connectionPool = ExecutorFactories.newConnectionPool("xlog-conn", null);
    ExecutorFactories.newThread("xlog-listener", true, this::acceptLoop, null).start();
    log.info("Listening at {} (backlog {})", socket.getLocalSocketAddress(), backlog);
  }

  @Override
  public InetSocketAddress localAddress() {
    ServerSocket socket = serverSocket;
    if (socket == null) {
      throw new IllegalStateException("Listener not started");
    }
    return (InetSocketAddress) socket.getLocalSocketAddress();
  }

  @Override
  public void close() {
    if (!closing.compareAndSet(false, true)) {
      return;
    }
    ServerSocket socket = serverSocket;
    if (socket != null) {
      try {
        socket.close();
      } catch (IOException ex) {
        log.warn("Failed to close server socket", ex);
      }
    }
    for (Socket client : clients) {
      closeClient(client);
    }
    ExecutorService pool = connectionPool;
    if (pool != null) {
      pool.shutdown();
      try {
        if (!pool.awaitTermination(POOL_TERMINATION_WAIT.toMillis(), TimeUnit.MILLISECONDS)) {
          log.warn("Connection threads still running after {}", POOL_TERMINATION_WAIT);
          pool.shutdownNow();
        }
      } catch (InterruptedException ie) {
        Thread.currentThread().interrupt();
        pool.shutdownNow();
      }
    }
    log.info("Listener closed; {} connections served", context.totalConnections());
  }

  private void acceptLoop() {
    ServerSocket socket = serverSocket;
    while (!closing.get()) {
      Socket client;
      try {
        client = socket.accept();
      } catch (SocketException ex) {
        if (closing.get() || socket.isClosed()) {
          break;
        }
        log.error("Accept failed", ex);
        continue;
      } catch (IOException ex) {
        log.error("Accept failed", ex);
        continue;
      }
      dispatch(client);
    }
    log.debug("Accept loop finished");
  }

  private void dispatch(Socket client) {
    clients.add(client);
    if (closing.get()) {
      clients.remove(client);
      closeClient(client);
      return;
    }
    try {
      connectionPool.execute(() -> serve(client));
    } catch (RejectedExecutionException ex) {
      log.warn("Connection from {} rejected during shutdown", client.getInetAddress().getHostAddress());
      clients.remove(client);
      closeClient(client);
    }
  }

  private void serve(Socket client) {
    ConnectionSession session = new ConnectionSession(client, handler, closing::get);
    String shortAddress = Logs.shortenAddress(session.clientAddress(), ipPrefix);
    MDC.put("conn", shortAddress);
    int open = context.connectionOpened();
    metrics.increment("ingest.connections.opened");
    log.info("Connection {} ({} open) from {}", context.totalConnections(), open, shortAddress);
    try {
      ConnectionFault fault = session.serve();
      switch (fault.severity()) {
        case INFO -> log.info("{}: {}", fault.description(), shortAddress);
        case WARN -> log.warn("{}: {}", fault.description(), shortAddress);
        case ERROR -> log.error("{}: {}: {}", fault.description(), shortAddress,
            session.failure().map(Throwable::getMessage).orElse("unknown"));
      }
    } catch (RuntimeException ex) {
      log.error("Connection handler failed for {}", shortAddress, ex);
    } finally {
      clients.remove(client);
      closeClient(client);
      int remaining = context.connectionClosed();
      metrics.increment("ingest.connections.closed");
      log.info("Connection closed -> {} open", remaining);
      MDC.remove("conn");
    }
  }

  private static void closeClient(Socket client) {
    try {
      client.close();
    } catch (IOException ex) {
      log.debug("Failed to close client socket", ex);
    }
  }
}
