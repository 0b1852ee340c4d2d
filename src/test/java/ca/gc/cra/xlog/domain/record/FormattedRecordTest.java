package ca.gc.cra.xlog.domain.record;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class FormattedRecordTest {
  private static final String JSON = "{\"_msg\":\"hi\"}";

  private static FormattedRecord sample() {
    return new FormattedRecord(
        "1", "1704067200.0000", "1704067200.0000", "0001", "____", "2", "_", Digests.sha1Hex(JSON), JSON);
  }

  @Test
  void lineJoinsNineTabSeparatedFields() {
    String line = sample().line();

    assertEquals(9, line.split("\t", -1).length);
    assertTrue(line.startsWith("1\t1704067200.0000\t"));
    assertTrue(line.endsWith("\t" + JSON));
    assertEquals(line + "\n", sample().toFileLine());
  }

  @Test
  void decodeReadsBackStoredLine() {
    FormattedRecord decoded = FormattedRecord.decode(sample().toFileLine());

    assertEquals(sample(), decoded);
    assertTrue(decoded.digestMatches());
  }

  @Test
  void decodeKeepsTabsInsideJsonField() {
    String json = "{\"a\":\"x\ty\"}";
    String line = "1\tr\te\tid\tsi\tel\tsl\t" + Digests.sha1Hex(json) + "\t" + json;

    assertEquals(json, FormattedRecord.decode(line).json());
  }

  @Test
  void tamperedJsonFailsDigestCheck() {
    FormattedRecord original = sample();
    FormattedRecord tampered = new FormattedRecord(
        original.version(),
        original.receivedTimestamp(),
        original.eventTimestamp(),
        original.id(),
        original.subId(),
        original.errorLevel(),
        original.subLevel(),
        original.sha1(),
        "{\"_msg\":\"bye\"}");

    assertFalse(tampered.digestMatches());
  }

  @Test
  void rejectsShortLinesAndDelimitersInPrefixFields() {
    assertThrows(IllegalArgumentException.class, () -> FormattedRecord.decode("1\t2\t3"));
    assertThrows(IllegalArgumentException.class,
        () -> new FormattedRecord("1", "r", "e", "a\tb", "si", "el", "sl", "sha", "{}"));
  }

  @Test
  void digestIsLowercaseSha1Hex() {
    assertEquals("a9993e364706816aba3e25717850c26c9cd0d89d", Digests.sha1Hex("abc"));
  }
}
