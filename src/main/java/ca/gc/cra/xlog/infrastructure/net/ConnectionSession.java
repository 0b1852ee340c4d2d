package ca.gc.cra.xlog.infrastructure.net;

import ca.gc.cra.xlog.application.pipeline.LineProtocolHandler;
import ca.gc.cra.xlog.application.pipeline.LineReply;
import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.util.Optional;
import java.util.function.BooleanSupplier;

/**
 * Serves one client connection: reads lines, hands them to the {@link LineProtocolHandler} and writes back
 * newline-terminated replies.
 *
 * <p>Runs on its own connection thread; not shared.</p>
 */
final class ConnectionSession {
  private final Socket socket;
  private final String clientAddress;
  private final LineProtocolHandler handler;
  private final BooleanSupplier closing;
  private IOException failure;

  ConnectionSession(Socket socket, LineProtocolHandler handler, BooleanSupplier closing) {
    this.socket = socket;
    this.clientAddress = socket.getInetAddress().getHostAddress();
    this.handler = handler;
    this.closing = closing;
  }

  String clientAddress() {
    return clientAddress;
  }

  /**
   * Returns the I/O failure that ended the session, if any.
   *
   * @return failure or empty after a clean end of stream
   */
  Optional<IOException> failure() {
    return Optional.ofNullable(failure);
  }

  /**
   * Serves the connection until the client goes away or the socket fails.
   *
   * @return how the connection ended
   */
  ConnectionFault serve() {
    try (BufferedReader in =
            new BufferedReader(new InputStreamReader(socket.getInputStream(), StandardCharsets.UTF_8));
        Writer out =
            new BufferedWriter(new OutputStreamWriter(socket.getOutputStream(), StandardCharsets.UTF_8))) {
      String line;
      while ((line = in.readLine()) != null) {
        LineReply reply = handler.handle(clientAddress, line);
        try {
          if (reply.text() != null) {
            out.write(reply.text());
            out.write('\n');
            out.flush();
          }
        } finally {
          // stopping closes client sockets, so it follows the flushed reply
          if (reply.stop()) {
            handler.requestStop(clientAddress);
          }
        }
      }
      return ConnectionFault.END_OF_STREAM;
    } catch (IOException ex) {
      failure = ex;
      return ConnectionFault.classify(ex, closing.getAsBoolean());
    }
  }
}
