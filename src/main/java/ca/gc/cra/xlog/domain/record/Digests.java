package ca.gc.cra.xlog.domain.record;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/** SHA-1 helpers for record fingerprints. */
public final class Digests {
  private static final HexFormat HEX = HexFormat.of();

  private Digests() {}

  /**
   * Computes the lowercase SHA-1 hex digest of the UTF-8 bytes of {@code text}.
   *
   * @param text input text
   * @return 40-character lowercase hex digest
   */
  public static String sha1Hex(String text) {
    try {
      MessageDigest digest = MessageDigest.getInstance("SHA-1");
      return HEX.formatHex(digest.digest(text.getBytes(StandardCharsets.UTF_8)));
    } catch (NoSuchAlgorithmException ex) {
      throw new IllegalStateException("SHA-1 unavailable", ex);
    }
  }
}
