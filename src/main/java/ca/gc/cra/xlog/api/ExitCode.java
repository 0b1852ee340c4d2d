package ca.gc.cra.xlog.api;

import java.io.IOException;

/**
 * Process exit statuses returned by the XLOG commands.
 *
 * @since 0.1.0
 */
public enum ExitCode {
  /** Successful execution. */
  SUCCESS(0),
  /** Command-line arguments were invalid. */
  INVALID_ARGS(2),
  /** Socket or file I/O failed. */
  IO_ERROR(3),
  /** Configuration was rejected while wiring the server. */
  CONFIG_ERROR(4),
  /** Unexpected failure, including a fatal writer error. */
  RUNTIME_FAILURE(5),
  /** Interrupted (SIGINT). */
  INTERRUPTED(130);

  private final int code;

  ExitCode(int code) {
    this.code = code;
  }

  /**
   * Returns the numeric status handed to {@link System#exit(int)}.
   *
   * @return numeric exit code
   */
  public int code() {
    return code;
  }

  /**
   * Maps a failure escaping a command to its exit status.
   *
   * @param failure exception thrown by the command body
   * @return matching exit code
   */
  static ExitCode forFailure(Throwable failure) {
    if (failure instanceof IOException) {
      return IO_ERROR;
    }
    if (failure instanceof InterruptedException) {
      return INTERRUPTED;
    }
    if (failure instanceof IllegalArgumentException) {
      return CONFIG_ERROR;
    }
    return RUNTIME_FAILURE;
  }
}
