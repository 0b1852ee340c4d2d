package ca.gc.cra.xlog.infrastructure.persistence;

import ca.gc.cra.xlog.application.port.LogFilePort;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.channels.Channels;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Objects;
import java.util.Optional;

/**
 * File-channel backed {@link LogFilePort} appending UTF-8 lines.
 *
 * <p>Each {@link #append(String)} is flushed to the channel immediately (line buffering); {@link #sync()} forces the
 * channel to the device. Methods are synchronized so the shutdown path may close the file while the writer thread
 * owns it.</p>
 *
 * @since 0.1.0
 */
public final class FlatFileLogSink implements LogFilePort {
  private FileChannel channel;
  private Writer writer;
  private Path path;

  /**
   * Creates a closed sink.
   */
  public FlatFileLogSink() {}

  @Override
  public synchronized void open(Path target) throws IOException {
    Objects.requireNonNull(target, "target");
    if (target.equals(path)) {
      return;
    }
    close();
    Path parent = target.toAbsolutePath().getParent();
    if (parent != null) {
      Files.createDirectories(parent);
    }
    FileChannel opened =
        FileChannel.open(target, StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.APPEND);
    this.channel = opened;
    this.writer = new BufferedWriter(new OutputStreamWriter(Channels.newOutputStream(opened), StandardCharsets.UTF_8));
    this.path = target;
  }

  @Override
  public synchronized void append(String line) throws IOException {
    if (writer == null) {
      throw new IllegalStateException("No log file open");
    }
    writer.write(line);
    writer.flush();
  }

  @Override
  public synchronized void sync() throws IOException {
    if (writer == null) {
      return;
    }
    writer.flush();
    channel.force(false);
  }

  @Override
  public synchronized Optional<Path> currentPath() {
    return Optional.ofNullable(path);
  }

  @Override
  public synchronized void close() throws IOException {
    if (writer == null) {
      return;
    }
    Writer closing = writer;
    FileChannel closingChannel = channel;
    writer = null;
    channel = null;
    path = null;
    try {
      closing.flush();
      closingChannel.force(true);
    } finally {
      closing.close();
    }
  }
}
