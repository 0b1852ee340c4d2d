package ca.gc.cra.xlog.application.port;

/**
 * Raw operator console used for output that must not go through the logging backend: progress dots and viewer
 * failure reports.
 *
 * @since 0.1.0
 */
public interface ConsolePort {
  /**
   * Emits one progress marker (a single {@code '.'} without newline) for a flushed batch.
   */
  void progress();

  /**
   * Reports a viewer failure on the error stream.
   *
   * @param line complete line to print
   */
  void viewerFailure(String line);

  /**
   * Console that discards everything.
   */
  ConsolePort NO_OP = new ConsolePort() {
    @Override public void progress() {}

    @Override public void viewerFailure(String line) {}
  };
}
