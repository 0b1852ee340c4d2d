package ca.gc.cra.xlog.infrastructure.exec;

import java.lang.Thread.UncaughtExceptionHandler;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Factory helpers for the named threads and pools used by the XLOG server.
 */
public final class ExecutorFactories {
  private static final Logger log = LoggerFactory.getLogger(ExecutorFactories.class);
  private static final long CONNECTION_IDLE_SECONDS = 60L;

  private ExecutorFactories() {}

  /**
   * Builds an unbounded cached pool running one daemon thread per client connection.
   *
   * @param prefix thread-name prefix used to tag connection threads
   * @param handler uncaught exception handler installed on each thread; {@code null} logs the failure
   * @return configured executor service
   */
  public static ExecutorService newConnectionPool(String prefix, UncaughtExceptionHandler handler) {
    String threadPrefix = (prefix == null || prefix.isBlank()) ? "xlog-conn" : prefix;
    UncaughtExceptionHandler effectiveHandler = Objects.requireNonNullElse(handler, ExecutorFactories::logUncaught);
    AtomicInteger index = new AtomicInteger();
    ThreadFactory factory =
        runnable -> {
          Thread thread = new Thread(runnable);
          thread.setName(threadPrefix + "-" + index.getAndIncrement());
          thread.setDaemon(true);
          thread.setUncaughtExceptionHandler(effectiveHandler);
          return thread;
        };

    return new ThreadPoolExecutor(
        0,
        Integer.MAX_VALUE,
        CONNECTION_IDLE_SECONDS,
        TimeUnit.SECONDS,
        new SynchronousQueue<>(),
        factory,
        new ThreadPoolExecutor.AbortPolicy());
  }

  /**
   * Creates, but does not start, a named worker thread.
   *
   * @param name thread name
   * @param daemon whether the thread should not keep the JVM alive
   * @param task body
   * @param handler uncaught exception handler; {@code null} logs the failure
   * @return unstarted thread
   */
  public static Thread newThread(String name, boolean daemon, Runnable task, UncaughtExceptionHandler handler) {
    Thread thread = new Thread(Objects.requireNonNull(task, "task"), Objects.requireNonNull(name, "name"));
    thread.setDaemon(daemon);
    thread.setUncaughtExceptionHandler(Objects.requireNonNullElse(handler, ExecutorFactories::logUncaught));
    return thread;
  }

  private static void logUncaught(Thread thread, Throwable ex) {
    log.error("Uncaught failure on thread {}", thread.getName(), ex);
  }
}
