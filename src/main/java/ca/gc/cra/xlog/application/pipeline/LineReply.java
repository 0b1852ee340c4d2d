package ca.gc.cra.xlog.application.pipeline;

import java.util.Optional;

/**
 * Outcome of one protocol line: the text to send back, if any, and whether the sender asked the server to stop.
 *
 * <p>The stop must be requested only after the reply has been flushed to the client.</p>
 *
 * @param text reply without newline; {@code null} when nothing is sent
 * @param stop {@code true} for a stop command
 * @since 0.1.0
 */
public record LineReply(String text, boolean stop) {
  /** No reply and no stop. */
  public static final LineReply NONE = new LineReply(null, false);

  /**
   * Creates a plain reply.
   *
   * @param text reply text
   * @return reply that does not stop the server
   */
  public static LineReply of(String text) {
    return new LineReply(text, false);
  }

  /**
   * Returns the reply text, if any.
   *
   * @return text or empty
   */
  public Optional<String> reply() {
    return Optional.ofNullable(text);
  }
}
