package ca.gc.cra.xlog.application.pipeline;

import ca.gc.cra.xlog.domain.record.FormattedRecord;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Per-server shared state: the record queue, the stop signal, the writer failure slot and
 * connection counters.
 * <p><strong>Why:</strong> Keeping this state on an instance rather than in statics lets several servers run in
 * one JVM.</p>
 * <p><strong>Thread-safety:</strong> All members are concurrent primitives; safe from any thread.</p>
 *
 * @since 0.1.0
 */
public final class XlogContext {
  private static final Logger log = LoggerFactory.getLogger(XlogContext.class);

  private final BlockingQueue<FormattedRecord> queue = new LinkedBlockingQueue<>();
  private final CountDownLatch stopSignal = new CountDownLatch(1);
  private final AtomicReference<String> stopReason = new AtomicReference<>();
  private final AtomicReference<Throwable> writerFailure = new AtomicReference<>();
  private final AtomicInteger openConnections = new AtomicInteger();
  private final AtomicLong totalConnections = new AtomicLong();

  /**
   * Returns the FIFO shared by connection threads (producers) and the writer (sole consumer).
   *
   * @return unbounded record queue
   */
  public BlockingQueue<FormattedRecord> queue() {
    return queue;
  }

  /**
   * Raises the stop flag. Only the first reason is kept.
   *
   * @param reason short description of the trigger
   */
  public void requestStop(String reason) {
    if (stopReason.compareAndSet(null, reason)) {
      log.warn("Stop requested: {}", reason);
    }
    stopSignal.countDown();
  }

  /**
   * Indicates whether stop has been requested.
   *
   * @return {@code true} once {@link #requestStop(String)} was called
   */
  public boolean stopRequested() {
    return stopSignal.getCount() == 0;
  }

  /**
   * Waits for the stop flag.
   *
   * @param timeout maximum wait
   * @return {@code true} if stop was requested within the timeout
   * @throws InterruptedException if interrupted while waiting
   */
  public boolean awaitStop(Duration timeout) throws InterruptedException {
    return stopSignal.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
  }

  /**
   * Returns the first recorded stop reason.
   *
   * @return reason or empty while running
   */
  public Optional<String> stopReason() {
    return Optional.ofNullable(stopReason.get());
  }

  /**
   * Records a fatal writer failure and raises the stop flag.
   *
   * @param failure fatal error
   */
  public void failWriter(Throwable failure) {
    writerFailure.compareAndSet(null, failure);
    requestStop("writer failure: " + failure.getMessage());
  }

  /**
   * Returns the fatal writer failure, if any.
   *
   * @return failure or empty
   */
  public Optional<Throwable> writerFailure() {
    return Optional.ofNullable(writerFailure.get());
  }

  /**
   * Counts a newly accepted connection.
   *
   * @return number of open connections after the increment
   */
  public int connectionOpened() {
    totalConnections.incrementAndGet();
    return openConnections.incrementAndGet();
  }

  /**
   * Counts a closed connection.
   *
   * @return number of open connections after the decrement
   */
  public int connectionClosed() {
    return openConnections.decrementAndGet();
  }

  /**
   * Returns the number of currently open connections.
   *
   * @return open connections
   */
  public int openConnections() {
    return openConnections.get();
  }

  /**
   * Returns the number of connections accepted since start.
   *
   * @return total connections
   */
  public long totalConnections() {
    return totalConnections.get();
  }
}
