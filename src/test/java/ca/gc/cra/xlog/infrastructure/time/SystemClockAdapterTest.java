package ca.gc.cra.xlog.infrastructure.time;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import org.junit.jupiter.api.Test;

class SystemClockAdapterTest {

  @Test
  void keepsSubMillisecondPrecision() {
    Clock fixed = Clock.fixed(Instant.ofEpochSecond(1_704_067_200L, 123_456_000L), ZoneOffset.UTC);
    SystemClockAdapter adapter = new SystemClockAdapter(fixed);

    assertEquals(1_704_067_200_123L, adapter.nowMillis());
    assertEquals(1_704_067_200.123456d, adapter.nowEpochSeconds(), 1e-6);
  }
}
