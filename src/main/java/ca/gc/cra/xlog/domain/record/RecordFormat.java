package ca.gc.cra.xlog.domain.record;

/**
 * Constants describing the versioned, tab-delimited flat-file record layout.
 *
 * <pre>
 * version TAB rx-ts TAB event-ts TAB _id TAB _si TAB _el TAB _sl TAB sha1 TAB canonical-json
 * </pre>
 *
 * @since 0.1.0
 */
public final class RecordFormat {
  /** Flat-file format tag carried as the first field. */
  public static final String VERSION = "1";
  /** Field delimiter, also used between the source address and the payload of inbound lines. */
  public static final char DELIMITER = '\t';
  /** Number of delimited fields in a persisted record. */
  public static final int FIELD_COUNT = 9;

  /** Sender address injected by the server. */
  public static final String KEY_IP = "_ip";
  /** Event timestamp, UTC epoch seconds. */
  public static final String KEY_TIMESTAMP = "_ts";
  /** Major client identifier. */
  public static final String KEY_ID = "_id";
  /** Minor client identifier. */
  public static final String KEY_SUB_ID = "_si";
  /** Error level, {@code 0..5} by convention. */
  public static final String KEY_ERROR_LEVEL = "_el";
  /** Free-form one-character flag column. */
  public static final String KEY_SUB_LEVEL = "_sl";
  /** Conventional human-readable message key. */
  public static final String KEY_MESSAGE = "_msg";

  /** Default for {@code _id}/{@code _si}. */
  public static final String DEFAULT_ID = "____";
  /** Default for {@code _el}/{@code _sl}. */
  public static final String DEFAULT_LEVEL = "_";

  private RecordFormat() {}
}
