package ca.gc.cra.xlog.application.pipeline;

import ca.gc.cra.xlog.application.normalize.RecordNormalizer;
import ca.gc.cra.xlog.application.port.IngestionListener;
import ca.gc.cra.xlog.application.port.LogFilePort;
import ca.gc.cra.xlog.application.port.MetricsPort;
import java.io.IOException;
import java.time.Duration;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Runs the ordered shutdown sequence exactly once.
 * <p><strong>Sequence:</strong> close the listener, enqueue the {@code ends} marker, wait for the queue to drain,
 * stop the writer and wait for its acknowledgement, then close the sink.</p>
 * <p><strong>Failure model:</strong> Each step logs its own failure and the sequence continues; timeouts are
 * reported at ERROR and in the returned {@link ShutdownReport}.</p>
 * <p><strong>Thread-safety:</strong> {@link #shutdown(String)} is synchronized; later calls return the first
 * report.</p>
 *
 * @since 0.1.0
 */
public final class ShutdownCoordinator {
  private static final Logger log = LoggerFactory.getLogger(ShutdownCoordinator.class);

  private final XlogContext context;
  private final IngestionListener listener;
  private final RecordNormalizer normalizer;
  private final PersistenceWriter writer;
  private final LogFilePort sink;
  private final MetricsPort metrics;
  private final Duration drainTimeout;
  private final Duration drainPoll;
  private final Duration writerStopTimeout;

  private ShutdownReport report;

  /**
   * Creates the coordinator.
   *
   * @param context shared server state
   * @param listener network listener to close first
   * @param normalizer normalizer used for the {@code ends} marker
   * @param writer persistence writer
   * @param sink flat-file sink closed last
   * @param metrics metrics sink
   * @param drainTimeout maximum time to wait for the queue to empty
   * @param drainPoll interval between queue checks
   * @param writerStopTimeout maximum time to wait for the writer to stop
   */
  public ShutdownCoordinator(
      XlogContext context,
      IngestionListener listener,
      RecordNormalizer normalizer,
      PersistenceWriter writer,
      LogFilePort sink,
      MetricsPort metrics,
      Duration drainTimeout,
      Duration drainPoll,
      Duration writerStopTimeout) {
    this.context = Objects.requireNonNull(context, "context");
    this.listener = Objects.requireNonNull(listener, "listener");
    this.normalizer = Objects.requireNonNull(normalizer, "normalizer");
    this.writer = Objects.requireNonNull(writer, "writer");
    this.sink = Objects.requireNonNull(sink, "sink");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.drainTimeout = Objects.requireNonNull(drainTimeout, "drainTimeout");
    this.drainPoll = Objects.requireNonNull(drainPoll, "drainPoll");
    this.writerStopTimeout = Objects.requireNonNull(writerStopTimeout, "writerStopTimeout");
  }

  /**
   * Runs the shutdown sequence.
   *
   * @param endsMessage text of the final marker record
   * @return report of the first (and only) run
   */
  public synchronized ShutdownReport shutdown(String endsMessage) {
    if (report != null) {
      return report;
    }
    log.warn("Server shutdown ({})", context.stopReason().orElse("no reason given"));
    closeListener();
    enqueueEndsMarker(endsMessage);

    boolean interrupted = false;
    boolean drained = false;
    try {
      drained = awaitDrain();
    } catch (InterruptedException ie) {
      interrupted = true;
    }
    if (!drained) {
      metrics.increment("shutdown.drain.timeout");
      log.error("Writer did not empty its queue ({} records left)", context.queue().size());
    }

    writer.requestStop();
    boolean writerStopped = false;
    if (!interrupted) {
      try {
        writerStopped = writer.awaitStopped(writerStopTimeout);
      } catch (InterruptedException ie) {
        interrupted = true;
      }
    }
    if (!writerStopped) {
      log.error("Writer did not acknowledge stop within {}", writerStopTimeout);
    }

    closeSink();
    if (interrupted) {
      Thread.currentThread().interrupt();
    }
    report = new ShutdownReport(drained, writerStopped);
    log.info("Shutdown complete: drained={}, writerStopped={}", drained, writerStopped);
    return report;
  }

  private void closeListener() {
    try {
      listener.close();
    } catch (RuntimeException ex) {
      log.error("Failed to close listener", ex);
    }
  }

  private void enqueueEndsMarker(String endsMessage) {
    try {
      context.queue().add(normalizer.formatMarker(endsMessage));
    } catch (RuntimeException ex) {
      log.error("Failed to enqueue ends marker", ex);
    }
  }

  private boolean awaitDrain() throws InterruptedException {
    long deadline = System.nanoTime() + drainTimeout.toNanos();
    while (true) {
      if (context.queue().isEmpty()) {
        return true;
      }
      if (writer.isStopped() || System.nanoTime() >= deadline) {
        return false;
      }
      Thread.sleep(drainPoll.toMillis());
    }
  }

  private void closeSink() {
    try {
      sink.close();
    } catch (IOException ex) {
      log.error("Failed to close log file", ex);
    }
  }
}
