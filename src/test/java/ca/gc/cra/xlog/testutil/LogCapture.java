package ca.gc.cra.xlog.testutil;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.util.List;
import org.slf4j.LoggerFactory;

/** Attaches a Logback {@link ListAppender} to one logger for the duration of a test. */
public final class LogCapture implements AutoCloseable {
  private final Logger logger;
  private final ListAppender<ILoggingEvent> appender = new ListAppender<>();
  private final Level originalLevel;
  private final boolean originalAdditive;

  private LogCapture(Logger logger, Level level) {
    this.logger = logger;
    this.originalLevel = logger.getLevel();
    this.originalAdditive = logger.isAdditive();
    logger.setAdditive(false);
    if (level != null) {
      logger.setLevel(level);
    }
    appender.start();
    logger.addAppender(appender);
  }

  public static LogCapture of(Class<?> type) {
    return new LogCapture((Logger) LoggerFactory.getLogger(type), null);
  }

  public static LogCapture of(String name, Level level) {
    return new LogCapture((Logger) LoggerFactory.getLogger(name), level);
  }

  public List<ILoggingEvent> events() {
    return List.copyOf(appender.list);
  }

  public boolean contains(Level level, String fragment) {
    return appender.list.stream()
        .anyMatch(e -> e.getLevel() == level && e.getFormattedMessage().contains(fragment));
  }

  @Override
  public void close() {
    logger.detachAppender(appender);
    appender.stop();
    logger.setAdditive(originalAdditive);
    logger.setLevel(originalLevel);
  }
}
