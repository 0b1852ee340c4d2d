package ca.gc.cra.xlog.application.normalize;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.xlog.application.clock.ClockState;
import ca.gc.cra.xlog.application.json.JsonSupport;
import ca.gc.cra.xlog.domain.record.Digests;
import ca.gc.cra.xlog.domain.record.FormattedRecord;
import ca.gc.cra.xlog.domain.record.NormalizeResult;
import ca.gc.cra.xlog.domain.record.RejectReason;
import ca.gc.cra.xlog.testutil.ManualClock;
import java.time.ZoneOffset;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class RecordNormalizerTest {
  private ManualClock clock;
  private RecordNormalizer normalizer;
  private final JsonSupport json = new JsonSupport();

  @BeforeEach
  void setUp() {
    clock = new ManualClock(1_704_067_200.5);
    normalizer = new RecordNormalizer(new ClockState(clock, ZoneOffset.UTC), json);
  }

  private FormattedRecord accept(String line) {
    NormalizeResult result = normalizer.normalize(line);
    assertTrue(result.accepted(), () -> "rejected: " + result.rejection().message());
    return result.record();
  }

  @Test
  void minimalEventGetsDefaultsAndReceiptTimestamp() {
    FormattedRecord record = accept("10.0.0.1\t{\"_msg\":\"hello\"}");

    assertEquals("1", record.version());
    assertEquals("1704067200.5000", record.receivedTimestamp());
    assertEquals(record.receivedTimestamp(), record.eventTimestamp());
    assertEquals("____", record.id());
    assertEquals("____", record.subId());
    assertEquals("_", record.errorLevel());
    assertEquals("_", record.subLevel());
    assertEquals(
        "{\"_el\":\"_\",\"_id\":\"____\",\"_ip\":\"10.0.0.1\",\"_msg\":\"hello\","
            + "\"_si\":\"____\",\"_sl\":\"_\",\"_ts\":\"1704067200.5000\"}",
        record.json());
  }

  @Test
  void lineHasNineFieldsAndDigestCoversJson() {
    FormattedRecord record = accept("10.0.0.1\t{\"_msg\":\"hello\",\"n\":1}");

    String[] fields = record.line().split("\t", -1);
    assertEquals(9, fields.length);
    assertEquals(Digests.sha1Hex(fields[8]), fields[7]);
    assertTrue(record.digestMatches());
  }

  @Test
  void integerControlValuesAreZeroPadded() {
    FormattedRecord record = accept("10.0.0.1\t{\"_id\":7,\"_si\":42,\"_el\":3,\"_sl\":12}");

    assertEquals("0007", record.id());
    assertEquals("0042", record.subId());
    assertEquals("3", record.errorLevel());
    assertEquals("12", record.subLevel());
    Map<String, Object> stored = json.parseObject(record.json());
    assertEquals("0007", stored.get("_id"));
    assertEquals("12", stored.get("_sl"));
  }

  @Test
  void stringAndNullControlValues() {
    FormattedRecord record = accept("10.0.0.1\t{\"_id\":\"abc\",\"_si\":null,\"_el\":2.5}");

    assertEquals("abc", record.id());
    assertEquals("____", record.subId());
    assertEquals("2.5", record.errorLevel());
  }

  @Test
  void booleanControlValuesCountAsIntegers() {
    FormattedRecord record =
        accept("10.0.0.1\t{\"_id\":true,\"_si\":false,\"_el\":true,\"_sl\":false}");

    assertEquals("0001", record.id());
    assertEquals("0000", record.subId());
    assertEquals("1", record.errorLevel());
    assertEquals("0", record.subLevel());
    Map<String, Object> stored = json.parseObject(record.json());
    assertEquals("1", stored.get("_el"));
    assertEquals("0", stored.get("_sl"));
  }

  @Test
  void numericEventTimestampIsFormattedButKeptInJson() {
    FormattedRecord record = accept("10.0.0.1\t{\"_ts\":1700000000.25}");

    assertEquals("1700000000.2500", record.eventTimestamp());
    assertNotEquals(record.receivedTimestamp(), record.eventTimestamp());
    assertEquals(1_700_000_000.25d, ((Number) json.parseObject(record.json()).get("_ts")).doubleValue());
  }

  @Test
  void stringEventTimestampIsKept() {
    assertEquals("yesterday", accept("10.0.0.1\t{\"_ts\":\"yesterday\"}").eventTimestamp());
    assertEquals("1704067200.5000", accept("10.0.0.1\t{\"_ts\":\"\"}").eventTimestamp());
  }

  @Test
  void falsyEventTimestampsFallBackToReceiptTime() {
    for (String ts : new String[] {"0", "0.0", "false", "null", "{}", "[]"}) {
      FormattedRecord record = accept("10.0.0.1\t{\"_ts\":" + ts + "}");

      assertEquals("1704067200.5000", record.eventTimestamp(), ts);
      assertEquals("1704067200.5000", json.parseObject(record.json()).get("_ts"), ts);
    }
  }

  @Test
  void normalizingStoredJsonAgainIsIdempotent() {
    FormattedRecord first = accept("10.0.0.1\t{\"_id\":5,\"_msg\":\"x\",\"nested\":{\"b\":2,\"a\":1}}");
    clock.advance(30);

    FormattedRecord second = accept("10.0.0.1\t" + first.json());

    assertEquals(first.json(), second.json());
    assertEquals(first.sha1(), second.sha1());
    assertEquals(first.eventTimestamp(), second.eventTimestamp());
    assertNotEquals(first.receivedTimestamp(), second.receivedTimestamp());
  }

  @Test
  void clientSuppliedIpIsOverwritten() {
    FormattedRecord record = accept("10.0.0.1\t{\"_ip\":\"6.6.6.6\"}");

    assertEquals("10.0.0.1", json.parseObject(record.json()).get("_ip"));
  }

  @Test
  void rejectionsCarryTheirReason() {
    assertRejected("not-an-ip\t{}", RejectReason.BAD_IP);
    assertRejected("1.2.3.4\t{bad", RejectReason.BAD_BRACKETS);
    assertRejected("1.2.3.4\tnotjson", RejectReason.BAD_BRACKETS);
    assertRejected("1.2.3.4\t{bad}", RejectReason.BAD_JSON);
    assertRejected("1.2.3.4\t{} {}", RejectReason.BAD_JSON);
    assertRejected("no delimiter", RejectReason.BAD_SPLIT);
    assertRejected("1.2.3.4\t{\"_id\":\"a\\tb\"}", RejectReason.INTERNAL);
  }

  @Test
  void rejectionMessageStartsWithLabel() {
    NormalizeResult result = normalizer.normalize("not-an-ip\t{}");

    assertTrue(result.rejection().message().startsWith("bad _ip"));
    assertEquals("not-an-ip\t{}", result.rejection().rawLine());
  }

  @Test
  void markerUsesSelfAddressAndMarkerIds() {
    FormattedRecord marker = normalizer.formatMarker("xlog begins @ 2024-01-01T00:00:00");

    assertEquals(RecordNormalizer.MARKER_ID, marker.id());
    assertEquals(RecordNormalizer.MARKER_ID, marker.subId());
    assertEquals("0", marker.errorLevel());
    assertEquals("_", marker.subLevel());
    Map<String, Object> event = json.parseObject(marker.json());
    assertEquals(RecordNormalizer.SELF_ADDRESS, event.get("_ip"));
    assertEquals("xlog begins @ 2024-01-01T00:00:00", event.get("_msg"));
  }

  @Test
  void addressShapeCheck() {
    assertTrue(RecordNormalizer.looksLikeIpv4("192.168.1.20"));
    assertFalse(RecordNormalizer.looksLikeIpv4("1.2.3"));
    assertFalse(RecordNormalizer.looksLikeIpv4("0:0:0:0:0:0:0:1"));
    assertFalse(RecordNormalizer.looksLikeIpv4("a.b.c.d"));
    assertFalse(RecordNormalizer.looksLikeIpv4(""));
  }

  private void assertRejected(String line, RejectReason reason) {
    NormalizeResult result = normalizer.normalize(line);
    assertFalse(result.accepted(), line);
    assertEquals(reason, result.rejection().reason(), line);
  }
}
