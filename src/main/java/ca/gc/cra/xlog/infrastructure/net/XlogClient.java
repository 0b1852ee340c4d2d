package ca.gc.cra.xlog.infrastructure.net;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Objects;

/**
 * Blocking line-protocol client: sends one line and waits for its reply.
 *
 * <p>Not thread-safe; use one client per thread.</p>
 *
 * @since 0.1.0
 */
public final class XlogClient implements AutoCloseable {
  private final Socket socket;
  private final BufferedReader in;
  private final Writer out;

  private XlogClient(Socket socket) throws IOException {
    this.socket = socket;
    this.in = new BufferedReader(new InputStreamReader(socket.getInputStream(), StandardCharsets.UTF_8));
    this.out = new BufferedWriter(new OutputStreamWriter(socket.getOutputStream(), StandardCharsets.UTF_8));
  }

  /**
   * Connects to a server.
   *
   * @param address server address
   * @param timeout connect and read timeout
   * @return connected client
   * @throws IOException when the connection fails
   */
  public static XlogClient connect(InetSocketAddress address, Duration timeout) throws IOException {
    Objects.requireNonNull(address, "address");
    int millis = (int) Math.min(Integer.MAX_VALUE, timeout.toMillis());
    Socket socket = new Socket();
    try {
      socket.connect(address, millis);
      socket.setSoTimeout(millis);
      socket.setTcpNoDelay(true);
      return new XlogClient(socket);
    } catch (IOException ex) {
      socket.close();
      throw ex;
    }
  }

  /**
   * Sends one line and returns the server's reply.
   *
   * @param line non-blank line without newline (blank lines get no reply)
   * @return reply line without terminator
   * @throws IOException when the exchange fails or the server closed the connection
   * @throws IllegalArgumentException if {@code line} is blank or contains a newline
   */
  public String send(String line) throws IOException {
    Objects.requireNonNull(line, "line");
    if (line.isBlank() || line.indexOf('\n') >= 0 || line.indexOf('\r') >= 0) {
      throw new IllegalArgumentException("line must be non-blank and single-line");
    }
    out.write(line);
    out.write('\n');
    out.flush();
    String reply = in.readLine();
    if (reply == null) {
      throw new EOFException("Server closed connection");
    }
    return reply;
  }

  /**
   * Returns the remote address.
   *
   * @return server address
   */
  public InetSocketAddress remoteAddress() {
    return (InetSocketAddress) socket.getRemoteSocketAddress();
  }

  @Override
  public void close() throws IOException {
    socket.close();
  }
}
