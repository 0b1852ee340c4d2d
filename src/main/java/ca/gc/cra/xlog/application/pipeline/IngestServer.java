package ca.gc.cra.xlog.application.pipeline;

import ca.gc.cra.xlog.application.clock.ClockState;
import ca.gc.cra.xlog.application.normalize.RecordNormalizer;
import ca.gc.cra.xlog.application.port.IngestionListener;
import ca.gc.cra.xlog.domain.time.ClockSnapshot;
import java.net.InetSocketAddress;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.Objects;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Runs the ingestion daemon: starts the writer, records the {@code begins} marker, opens the listener and waits for
 * the stop flag, then always hands over to the {@link ShutdownCoordinator}.
 *
 * <p>Instances are not reusable; invoke {@link #run()} at most once.</p>
 *
 * @since 0.1.0
 */
public final class IngestServer {
  private static final Logger log = LoggerFactory.getLogger(IngestServer.class);

  private final XlogContext context;
  private final ClockState clock;
  private final RecordNormalizer normalizer;
  private final PersistenceWriter writer;
  private final IngestionListener listener;
  private final ShutdownCoordinator coordinator;
  private final String instanceName;
  private final Duration stopWaitInterval;

  private final AtomicBoolean ran = new AtomicBoolean();
  private final CountDownLatch listening = new CountDownLatch(1);
  private final CountDownLatch finished = new CountDownLatch(1);

  /**
   * Creates the server.
   *
   * @param context shared server state
   * @param clock clock used for marker timestamps
   * @param normalizer normalizer used for the {@code begins} marker
   * @param writer persistence writer (not yet started)
   * @param listener network listener (not yet started)
   * @param coordinator shutdown sequence
   * @param instanceName process identity used in marker messages
   * @param stopWaitInterval how long the main loop waits on the stop flag between checks
   */
  public IngestServer(
      XlogContext context,
      ClockState clock,
      RecordNormalizer normalizer,
      PersistenceWriter writer,
      IngestionListener listener,
      ShutdownCoordinator coordinator,
      String instanceName,
      Duration stopWaitInterval) {
    this.context = Objects.requireNonNull(context, "context");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.normalizer = Objects.requireNonNull(normalizer, "normalizer");
    this.writer = Objects.requireNonNull(writer, "writer");
    this.listener = Objects.requireNonNull(listener, "listener");
    this.coordinator = Objects.requireNonNull(coordinator, "coordinator");
    this.instanceName = Objects.requireNonNull(instanceName, "instanceName");
    this.stopWaitInterval = Objects.requireNonNull(stopWaitInterval, "stopWaitInterval");
  }

  /**
   * Serves until the stop flag is raised, then shuts down.
   *
   * @return shutdown report
   * @throws Exception startup failure, main-loop failure or fatal writer failure
   */
  public ShutdownReport run() throws Exception {
    if (!ran.compareAndSet(false, true)) {
      throw new IllegalStateException("Ingest server already ran");
    }
    MDC.put("pipeline", "serve");
    Exception primaryFailure = null;
    ShutdownReport report;
    try {
      try {
        writer.start();
        context.queue().add(normalizer.formatMarker(instanceName + " begins @ " + localStamp()));
        listener.start();
        listening.countDown();
        log.info("Server running on {}", listener.localAddress());
        while (!context.awaitStop(stopWaitInterval)) {
          log.trace("Open connections: {}", context.openConnections());
        }
      } catch (InterruptedException ie) {
        Thread.currentThread().interrupt();
        context.requestStop("interrupted");
      } catch (Exception ex) {
        log.error("Server failure", ex);
        primaryFailure = ex;
        context.requestStop("server failure: " + ex.getMessage());
      } finally {
        listening.countDown();
        report = coordinator.shutdown(instanceName + " ends @ " + localStamp());
      }
      if (primaryFailure == null && context.writerFailure().isPresent()) {
        Throwable cause = context.writerFailure().get();
        primaryFailure = new IllegalStateException("Persistence writer failed: " + cause.getMessage(), cause);
      }
      if (primaryFailure != null) {
        throw primaryFailure;
      }
      log.info("Server finished after {} connections", context.totalConnections());
      return report;
    } finally {
      finished.countDown();
      MDC.remove("pipeline");
    }
  }

  /**
   * Requests shutdown; {@link #run()} returns once the sequence completes.
   *
   * @param reason short description of the trigger
   */
  public void requestStop(String reason) {
    context.requestStop(reason);
  }

  /**
   * Waits until the listener is accepting connections (or startup failed).
   *
   * @param timeout maximum wait
   * @return bound address
   * @throws InterruptedException if interrupted while waiting
   * @throws IllegalStateException if the listener did not start within the timeout
   */
  public InetSocketAddress awaitListening(Duration timeout) throws InterruptedException {
    if (!listening.await(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
      throw new IllegalStateException("Server did not start within " + timeout);
    }
    return listener.localAddress();
  }

  /**
   * Waits for {@link #run()} to return.
   *
   * @param timeout maximum wait
   * @return {@code true} if the server finished within the timeout
   * @throws InterruptedException if interrupted while waiting
   */
  public boolean awaitTermination(Duration timeout) throws InterruptedException {
    return finished.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
  }

  /**
   * Returns the shared context, mostly for diagnostics.
   *
   * @return context
   */
  public XlogContext context() {
    return context;
  }

  private String localStamp() {
    ClockSnapshot now = clock.refresh();
    Instant instant = Instant.ofEpochMilli(Math.round(now.utcEpoch() * 1000.0d));
    LocalDateTime local = LocalDateTime.ofInstant(instant, clock.localZone()).truncatedTo(ChronoUnit.SECONDS);
    return DateTimeFormatter.ISO_LOCAL_DATE_TIME.format(local);
  }
}
