package ca.gc.cra.xlog.infrastructure.viewer;

import ca.gc.cra.xlog.application.port.RecordViewer;
import java.lang.reflect.InvocationTargetException;
import java.util.Locale;

/**
 * Resolves a configured viewer identifier to a {@link RecordViewer}.
 *
 * <p>{@code logging} selects {@link LoggingRecordViewer}; any other value is treated as the fully-qualified name of
 * a public {@link RecordViewer} implementation with a no-arg constructor.</p>
 *
 * @since 0.1.0
 */
public final class ViewerFactory {
  /** Identifier of the built-in logging viewer. */
  public static final String LOGGING = "logging";

  private ViewerFactory() {}

  /**
   * Creates the viewer named by {@code id}.
   *
   * @param id viewer identifier or class name
   * @return viewer instance
   * @throws IllegalArgumentException if the class cannot be found, instantiated or does not implement the port
   */
  public static RecordViewer create(String id) {
    if (id == null || id.isBlank()) {
      throw new IllegalArgumentException("viewer must not be blank");
    }
    String trimmed = id.trim();
    if (LOGGING.equals(trimmed.toLowerCase(Locale.ROOT))) {
      return new LoggingRecordViewer();
    }
    Class<?> type;
    try {
      type = Class.forName(trimmed);
    } catch (ClassNotFoundException ex) {
      throw new IllegalArgumentException("Unknown viewer: " + trimmed, ex);
    }
    if (!RecordViewer.class.isAssignableFrom(type)) {
      throw new IllegalArgumentException(trimmed + " does not implement " + RecordViewer.class.getName());
    }
    try {
      return (RecordViewer) type.getDeclaredConstructor().newInstance();
    } catch (InstantiationException | IllegalAccessException | NoSuchMethodException ex) {
      throw new IllegalArgumentException("Cannot instantiate viewer " + trimmed, ex);
    } catch (InvocationTargetException ex) {
      throw new IllegalArgumentException("Viewer " + trimmed + " failed to initialize", ex.getCause());
    }
  }
}
