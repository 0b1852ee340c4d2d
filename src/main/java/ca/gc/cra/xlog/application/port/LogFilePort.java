package ca.gc.cra.xlog.application.port;

import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Optional;

/**
 * <strong>What:</strong> Append-only flat-file sink driven by the persistence writer.
 * <p><strong>Why:</strong> Separates rotation decisions (writer) from file-system I/O (adapter).</p>
 * <p><strong>Thread-safety:</strong> The writer thread owns the sink; only {@link #close()} may be invoked
 * from another thread during shutdown, so implementations must make it idempotent and thread-safe.</p>
 *
 * @since 0.1.0
 */
public interface LogFilePort extends Closeable {
  /**
   * Ensures {@code path} is open for append, creating parent directories as needed. A no-op when the same path
   * is already open; any other open file is closed first.
   *
   * @param path target file
   * @throws IOException when directories cannot be created or the file cannot be opened
   */
  void open(Path path) throws IOException;

  /**
   * Appends one newline-terminated line and flushes it to the operating system.
   *
   * @param line text including the trailing newline
   * @throws IOException when the write fails
   * @throws IllegalStateException when no file is open
   */
  void append(String line) throws IOException;

  /**
   * Forces written content to the storage device.
   *
   * @throws IOException when the sync fails
   */
  void sync() throws IOException;

  /**
   * Returns the path currently open.
   *
   * @return open path or empty when closed
   */
  Optional<Path> currentPath();

  /**
   * Flushes, syncs and closes the open file if any. Safe to call repeatedly.
   *
   * @throws IOException when the close fails
   */
  @Override
  void close() throws IOException;
}
