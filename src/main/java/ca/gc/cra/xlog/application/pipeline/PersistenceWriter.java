package ca.gc.cra.xlog.application.pipeline;

import ca.gc.cra.xlog.application.clock.ClockState;
import ca.gc.cra.xlog.application.json.JsonSupport;
import ca.gc.cra.xlog.application.port.ConsolePort;
import ca.gc.cra.xlog.application.port.LogFilePort;
import ca.gc.cra.xlog.application.port.MetricsPort;
import ca.gc.cra.xlog.application.port.RecordViewer;
import ca.gc.cra.xlog.domain.path.LogPathTemplate;
import ca.gc.cra.xlog.domain.record.FormattedRecord;
import ca.gc.cra.xlog.domain.record.ViewedRecord;
import ca.gc.cra.xlog.domain.time.ClockSnapshot;
import ca.gc.cra.xlog.infrastructure.exec.ExecutorFactories;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Single consumer draining the record queue into the time-rotated flat file and, when
 * rendering is enabled, the console viewer.
 * <p><strong>Why:</strong> One writer means the file is never shared and records land in queue order.</p>
 * <p><strong>Rotation:</strong> At most once per elapsed second the target path is re-resolved from the clock; a
 * different path closes the current file and the next write opens the new one. The same check flushes and syncs
 * the batch written since the previous check.</p>
 * <p><strong>Failure model:</strong> Viewer failures are printed and ignored. File I/O failures drop the handle and
 * the open is retried on the next record, unless no viewer is configured, in which case they are fatal. Fatal
 * errors are recorded on the {@link XlogContext} and raise the stop flag.</p>
 * <p><strong>Thread-safety:</strong> {@link #start()} once; {@link #requestStop()} and
 * {@link #awaitStopped(Duration)} may be called from any thread.</p>
 *
 * @since 0.1.0
 */
public final class PersistenceWriter {
  private static final Logger log = LoggerFactory.getLogger(PersistenceWriter.class);
  private static final double ROLL_CHECK_INTERVAL_SECONDS = 1.0d;

  private final XlogContext context;
  private final ClockState clock;
  private final LogPathTemplate pathTemplate;
  private final LogFilePort sink;
  private final RecordViewer viewer;
  private final JsonSupport json;
  private final MetricsPort metrics;
  private final ConsolePort console;
  private final Duration pollInterval;

  private final AtomicBoolean started = new AtomicBoolean();
  private final AtomicBoolean stopRequested = new AtomicBoolean();
  private final CountDownLatch stopped = new CountDownLatch(1);

  private double lastRollCheck = Double.NEGATIVE_INFINITY;
  private Path targetPath;
  private int unflushed;

  /**
   * Creates the writer.
   *
   * @param context shared server state providing the queue
   * @param clock clock refreshed before each roll check
   * @param pathTemplate file path template; disabled templates turn persistence off
   * @param sink flat-file sink
   * @param viewer console viewer, or {@code null} when rendering is off
   * @param json JSON helper used to decode records for the viewer
   * @param metrics metrics sink
   * @param console raw console for progress dots and viewer failures
   * @param pollInterval bounded queue poll so stop requests are noticed promptly
   */
  public PersistenceWriter(
      XlogContext context,
      ClockState clock,
      LogPathTemplate pathTemplate,
      LogFilePort sink,
      RecordViewer viewer,
      JsonSupport json,
      MetricsPort metrics,
      ConsolePort console,
      Duration pollInterval) {
    this.context = Objects.requireNonNull(context, "context");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.pathTemplate = Objects.requireNonNull(pathTemplate, "pathTemplate");
    this.sink = Objects.requireNonNull(sink, "sink");
    this.viewer = viewer;
    this.json = Objects.requireNonNull(json, "json");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.console = Objects.requireNonNull(console, "console");
    this.pollInterval = Objects.requireNonNull(pollInterval, "pollInterval");
    if (pollInterval.isNegative() || pollInterval.isZero()) {
      throw new IllegalArgumentException("pollInterval must be positive");
    }
  }

  /**
   * Starts the {@code xlog-writer} thread.
   *
   * @throws IllegalStateException if already started
   */
  public void start() {
    if (!started.compareAndSet(false, true)) {
      throw new IllegalStateException("Persistence writer already started");
    }
    Thread thread = ExecutorFactories.newThread("xlog-writer", true, this::runLoop, this::handleCrash);
    thread.start();
    log.info("Persistence writer started (path template: {}, rendering: {})",
        pathTemplate.enabled() ? pathTemplate.template() : "<none>", viewer != null);
  }

  /**
   * Asks the writer to close the file and exit at its next loop iteration.
   */
  public void requestStop() {
    stopRequested.set(true);
  }

  /**
   * Waits until the writer has acknowledged a stop request (or died).
   *
   * @param timeout maximum wait
   * @return {@code true} if the writer stopped within the timeout
   * @throws InterruptedException if interrupted while waiting
   */
  public boolean awaitStopped(Duration timeout) throws InterruptedException {
    return stopped.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
  }

  /**
   * Indicates whether the writer loop has exited.
   *
   * @return {@code true} once stopped
   */
  public boolean isStopped() {
    return stopped.getCount() == 0;
  }

  private void runLoop() {
    MDC.put("pipeline", "writer");
    try {
      while (true) {
        if (stopRequested.get()) {
          closeSink();
          log.info("Persistence writer stopped; {} records left in queue", context.queue().size());
          return;
        }
        FormattedRecord record = context.queue().poll(pollInterval.toMillis(), TimeUnit.MILLISECONDS);
        if (record == null) {
          continue;
        }
        handle(record);
      }
    } catch (InterruptedException ie) {
      Thread.currentThread().interrupt();
      log.warn("Persistence writer interrupted");
      closeSink();
    } catch (RuntimeException ex) {
      log.error("Persistence writer failed", ex);
      context.failWriter(ex);
      closeSink();
    } finally {
      stopped.countDown();
      MDC.remove("pipeline");
    }
  }

  private void handle(FormattedRecord record) {
    if (pathTemplate.enabled()) {
      persist(record);
    } else if (viewer == null) {
      throw new IllegalStateException("No log path and no viewer; record cannot be delivered");
    }
    if (viewer != null) {
      render(record);
    }
  }

  private void persist(FormattedRecord record) {
    try {
      ClockSnapshot now = clock.refresh();
      if (now.utcEpoch() >= lastRollCheck + ROLL_CHECK_INTERVAL_SECONDS) {
        lastRollCheck = now.utcEpoch();
        flushBatch();
        rollCheck(now);
      }
      if (sink.currentPath().isEmpty()) {
        sink.open(targetPath);
        log.info("Opened log file {}", targetPath);
      }
      sink.append(record.toFileLine());
      unflushed++;
      metrics.increment("writer.records.persisted");
    } catch (IOException ex) {
      metrics.increment("writer.persist.error");
      log.error("Failed to persist record to {}", targetPath, ex);
      closeSink();
      if (viewer == null) {
        throw new UncheckedIOException("Persistence failed without a viewer", ex);
      }
    }
  }

  private void rollCheck(ClockSnapshot now) throws IOException {
    Path resolved = pathTemplate.resolve(now)
        .orElseThrow(() -> new IllegalStateException("Path template resolved to nothing"));
    Optional<Path> open = sink.currentPath();
    if (open.isPresent() && !open.get().equals(resolved)) {
      log.info("Rotating log file {} -> {}", open.get(), resolved);
      sink.close();
      unflushed = 0;
      metrics.increment("writer.rotations");
    }
    targetPath = resolved;
  }

  private void flushBatch() throws IOException {
    if (unflushed == 0) {
      return;
    }
    sink.sync();
    metrics.observe("writer.flush.batch", unflushed);
    unflushed = 0;
    if (viewer == null) {
      console.progress();
    }
  }

  private void render(FormattedRecord record) {
    try {
      Map<String, Object> event = json.parseObject(record.json());
      viewer.view(new ViewedRecord(record, event));
    } catch (Exception ex) {
      metrics.increment("writer.viewer.error");
      console.viewerFailure("!! " + record.line() + " !! " + ex.getMessage() + " !!");
    }
  }

  private void closeSink() {
    try {
      sink.close();
    } catch (IOException ex) {
      metrics.increment("writer.persist.error");
      log.error("Failed to close log file {}", targetPath, ex);
    }
    unflushed = 0;
  }

  private void handleCrash(Thread thread, Throwable ex) {
    log.error("Persistence writer thread {} terminated unexpectedly", thread.getName(), ex);
    context.failWriter(ex);
    stopped.countDown();
  }
}
