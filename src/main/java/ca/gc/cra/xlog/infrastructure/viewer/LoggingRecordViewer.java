package ca.gc.cra.xlog.infrastructure.viewer;

import ca.gc.cra.xlog.application.port.RecordViewer;
import ca.gc.cra.xlog.domain.record.FormattedRecord;
import ca.gc.cra.xlog.domain.record.ViewedRecord;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.event.Level;

/**
 * Renders records through the {@code xlog.viewer} logger, choosing the level from the record's error level.
 *
 * <p>Mapping: {@code 0} TRACE, {@code 1} DEBUG, {@code 2} INFO, {@code 3} WARN, {@code 4}/{@code 5} ERROR, anything
 * else INFO.</p>
 *
 * @since 0.1.0
 */
public final class LoggingRecordViewer implements RecordViewer {
  /** Logger name records are rendered under. */
  public static final String LOGGER_NAME = "xlog.viewer";

  private final Logger viewerLog;

  /**
   * Creates a viewer rendering to {@value #LOGGER_NAME}.
   */
  public LoggingRecordViewer() {
    this(LoggerFactory.getLogger(LOGGER_NAME));
  }

  LoggingRecordViewer(Logger viewerLog) {
    this.viewerLog = Objects.requireNonNull(viewerLog, "viewerLog");
  }

  @Override
  public void view(ViewedRecord viewed) {
    Objects.requireNonNull(viewed, "viewed");
    FormattedRecord record = viewed.record();
    viewerLog.atLevel(levelFor(record.errorLevel()))
        .log("{} {} {} {}", record.id(), record.errorLevel(), record.subLevel(), viewed.message());
  }

  /**
   * Maps an error-level column to a logging level.
   *
   * @param errorLevel error level text
   * @return logging level
   */
  static Level levelFor(String errorLevel) {
    if (errorLevel == null) {
      return Level.INFO;
    }
    int value;
    try {
      value = Integer.parseInt(errorLevel.strip());
    } catch (NumberFormatException ex) {
      return Level.INFO;
    }
    return switch (value) {
      case 0 -> Level.TRACE;
      case 1 -> Level.DEBUG;
      case 2 -> Level.INFO;
      case 3 -> Level.WARN;
      case 4, 5 -> Level.ERROR;
      default -> Level.INFO;
    };
  }
}
