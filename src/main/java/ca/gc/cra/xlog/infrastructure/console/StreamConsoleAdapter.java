package ca.gc.cra.xlog.infrastructure.console;

import ca.gc.cra.xlog.application.port.ConsolePort;
import java.io.FileDescriptor;
import java.io.FileOutputStream;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * {@link ConsolePort} writing to the process standard streams.
 *
 * <p>Uses native file descriptors rather than {@code System.out}/{@code System.err} so output bypasses any logging
 * redirection. Viewer failures go to stderr so they are still seen when the logging backend is the thing that
 * broke.</p>
 */
public final class StreamConsoleAdapter implements ConsolePort {
  private final PrintWriter out;
  private final PrintWriter err;

  /**
   * Creates an adapter bound to the process stdout and stderr.
   */
  public StreamConsoleAdapter() {
    this(
        new PrintWriter(new OutputStreamWriter(new FileOutputStream(FileDescriptor.out), StandardCharsets.UTF_8)),
        new PrintWriter(new OutputStreamWriter(new FileOutputStream(FileDescriptor.err), StandardCharsets.UTF_8)));
  }

  /**
   * Creates an adapter over explicit writers.
   *
   * @param out progress stream
   * @param err failure stream
   */
  public StreamConsoleAdapter(PrintWriter out, PrintWriter err) {
    this.out = Objects.requireNonNull(out, "out");
    this.err = Objects.requireNonNull(err, "err");
  }

  @Override
  public void progress() {
    out.print('.');
    out.flush();
  }

  @Override
  public void viewerFailure(String line) {
    err.println(line);
    err.flush();
  }
}
