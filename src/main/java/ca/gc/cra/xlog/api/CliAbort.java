package ca.gc.cra.xlog.api;

/**
 * Signals that a command must stop early with the carried exit code; the cause has already been logged.
 */
final class CliAbort extends Exception {
  private static final long serialVersionUID = 1L;

  private final ExitCode exitCode;

  CliAbort(ExitCode exitCode) {
    super(null, null, false, false);
    this.exitCode = exitCode;
  }

  ExitCode exitCode() {
    return exitCode;
  }
}
