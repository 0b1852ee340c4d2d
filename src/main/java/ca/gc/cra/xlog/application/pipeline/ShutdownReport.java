package ca.gc.cra.xlog.application.pipeline;

/**
 * Outcome of the shutdown sequence.
 *
 * @param drained whether the queue emptied before the drain timeout
 * @param writerStopped whether the writer acknowledged the stop request in time
 * @since 0.1.0
 */
public record ShutdownReport(boolean drained, boolean writerStopped) {
  /**
   * Indicates a fully clean shutdown.
   *
   * @return {@code true} when drained and the writer stopped
   */
  public boolean clean() {
    return drained && writerStopped;
  }
}
