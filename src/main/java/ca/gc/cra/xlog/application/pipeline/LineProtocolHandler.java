package ca.gc.cra.xlog.application.pipeline;

import ca.gc.cra.xlog.application.normalize.RecordNormalizer;
import ca.gc.cra.xlog.application.port.MetricsPort;
import ca.gc.cra.xlog.domain.record.NormalizeResult;
import ca.gc.cra.xlog.domain.record.RecordFormat;
import ca.gc.cra.xlog.logging.Logs;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Interprets one inbound protocol line and produces the reply to send back.
 *
 * <ul>
 *   <li>empty line: ignored, no reply</li>
 *   <li>{@code !STOP!}: replies {@code OK} with a stop intent; the caller raises the stop flag through
 *   {@link #requestStop(String)} once the reply is flushed</li>
 *   <li>{@code !...!}: echo check, replies {@code OK|<line>}</li>
 *   <li>anything else: normalized and enqueued ({@code OK}) or refused ({@code E: <reason>})</li>
 * </ul>
 *
 * <p>Safe for concurrent use by all connection threads.</p>
 *
 * @since 0.1.0
 */
public final class LineProtocolHandler {
  private static final Logger log = LoggerFactory.getLogger(LineProtocolHandler.class);
  private static final int MAX_LOGGED_LINE_BYTES = 1024;

  /** Control line requesting server shutdown. */
  public static final String STOP_COMMAND = "!STOP!";
  /** Acknowledgement for accepted lines. */
  public static final String OK = "OK";
  /** Prefix of error replies. */
  public static final String ERROR_PREFIX = "E: ";

  private final XlogContext context;
  private final RecordNormalizer normalizer;
  private final MetricsPort metrics;
  private final String ipPrefix;

  /**
   * Creates a handler.
   *
   * @param context shared server state (queue and stop flag)
   * @param normalizer record normalizer
   * @param metrics metrics sink
   * @param ipPrefix address prefix elided from diagnostics; may be empty
   */
  public LineProtocolHandler(
      XlogContext context, RecordNormalizer normalizer, MetricsPort metrics, String ipPrefix) {
    this.context = Objects.requireNonNull(context, "context");
    this.normalizer = Objects.requireNonNull(normalizer, "normalizer");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.ipPrefix = ipPrefix == null ? "" : ipPrefix;
  }

  /**
   * Handles one line received from {@code clientAddress}.
   *
   * @param clientAddress textual peer address
   * @param rawLine line without its terminator
   * @return reply to send, {@link LineReply#NONE} when nothing must be sent
   */
  public LineReply handle(String clientAddress, String rawLine) {
    String line = rawLine == null ? "" : rawLine.stripTrailing();
    if (line.isEmpty()) {
      return LineReply.NONE;
    }
    if (STOP_COMMAND.equals(line)) {
      return new LineReply(OK, true);
    }
    if (line.charAt(0) == '!' && line.charAt(line.length() - 1) == '!') {
      metrics.increment("ingest.lines.echo");
      return LineReply.of(OK + "|" + line);
    }

    String prefixed = clientAddress + RecordFormat.DELIMITER + line;
    NormalizeResult result = normalizer.normalize(prefixed);
    if (result.accepted()) {
      context.queue().add(result.record());
      metrics.increment("ingest.lines.accepted");
      return LineReply.of(OK);
    }
    String message = result.rejection().message();
    metrics.increment("ingest.lines.rejected");
    log.error("{}{} from {}", ERROR_PREFIX, message, Logs.shortenAddress(clientAddress, ipPrefix));
    log.error(":: {}", Logs.truncate(prefixed, MAX_LOGGED_LINE_BYTES));
    return LineReply.of(ERROR_PREFIX + message);
  }

  /**
   * Raises the server stop flag on behalf of a client whose stop command has been acknowledged.
   *
   * @param clientAddress textual peer address
   */
  public void requestStop(String clientAddress) {
    context.requestStop(STOP_COMMAND + " from " + Logs.shortenAddress(clientAddress, ipPrefix));
  }
}
