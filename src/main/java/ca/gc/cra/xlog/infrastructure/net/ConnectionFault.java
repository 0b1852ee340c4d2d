package ca.gc.cra.xlog.infrastructure.net;

import java.io.EOFException;
import java.io.IOException;
import java.net.SocketException;
import java.util.Locale;

/**
 * How a client connection ended. Each fault closes only the connection it occurred on.
 *
 * @since 0.1.0
 */
public enum ConnectionFault {
  /** Client closed its side cleanly. */
  END_OF_STREAM(Severity.INFO, "client closed connection"),
  /** Peer reset the connection. */
  RESET(Severity.INFO, "client reset connection"),
  /** Connection aborted locally, usually because the listener is shutting down. */
  ABORTED(Severity.INFO, "client connection aborted"),
  /** Stream ended in the middle of a read. */
  EOF(Severity.WARN, "client socket closed unexpectedly"),
  /** Any other I/O failure. */
  IO_ERROR(Severity.ERROR, "client connection error");

  /** Log level a fault is reported at. */
  public enum Severity { INFO, WARN, ERROR }

  private final Severity severity;
  private final String description;

  ConnectionFault(Severity severity, String description) {
    this.severity = severity;
    this.description = description;
  }

  /**
   * Returns the level the fault is logged at.
   *
   * @return severity
   */
  public Severity severity() {
    return severity;
  }

  /**
   * Returns a short operator-facing description.
   *
   * @return description
   */
  public String description() {
    return description;
  }

  /**
   * Maps an I/O failure raised while serving a connection to a fault category.
   *
   * @param ex failure
   * @param closing whether the listener was shutting down when the failure happened
   * @return fault category
   */
  public static ConnectionFault classify(IOException ex, boolean closing) {
    if (ex instanceof EOFException) {
      return EOF;
    }
    if (ex instanceof SocketException) {
      String message = ex.getMessage() == null ? "" : ex.getMessage().toLowerCase(Locale.ROOT);
      if (message.contains("reset") || message.contains("broken pipe")) {
        return RESET;
      }
      if (closing || message.contains("socket closed") || message.contains("abort")) {
        return ABORTED;
      }
    }
    return IO_ERROR;
  }
}
