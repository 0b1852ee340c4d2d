package ca.gc.cra.xlog.domain.record;

/**
 * Distinct reasons a submitted line is refused by the normalizer, in validation order.
 *
 * @since 0.1.0
 */
public enum RejectReason {
  /** No delimiter between the source address and the payload. */
  BAD_SPLIT("split _ip|payload"),
  /** Source address fails the dotted-quad shape check. */
  BAD_IP("bad _ip"),
  /** Payload is empty or not bounded by braces. */
  BAD_BRACKETS("bad json dict"),
  /** Payload is not a single JSON object. */
  BAD_JSON("json parse"),
  /** Unexpected failure while formatting. */
  INTERNAL("normalize");

  private final String label;

  RejectReason(String label) {
    this.label = label;
  }

  /**
   * Returns the short label used as the prefix of client-facing error messages.
   *
   * @return label text
   */
  public String label() {
    return label;
  }
}
