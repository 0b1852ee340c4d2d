package ca.gc.cra.xlog.api;

import java.io.FileDescriptor;
import java.io.FileOutputStream;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;

/**
 * Writes usage text and dry-run plans straight to the stdout file descriptor, independent of the logging setup.
 */
public final class CliPrinter {
  private static final PrintWriter STDOUT = new PrintWriter(
      new OutputStreamWriter(new FileOutputStream(FileDescriptor.out), StandardCharsets.UTF_8), true);
  private static volatile PrintWriter override;

  private CliPrinter() {}

  /**
   * Prints the given lines.
   *
   * @param lines lines to emit; {@code null} prints nothing
   */
  public static void println(String... lines) {
    if (lines == null) {
      return;
    }
    PrintWriter writer = override != null ? override : STDOUT;
    for (String line : lines) {
      writer.println(line);
    }
    writer.flush();
  }

  static void setWriterForTesting(PrintWriter writer) {
    override = writer;
  }

  static void clearTestWriter() {
    override = null;
  }
}
