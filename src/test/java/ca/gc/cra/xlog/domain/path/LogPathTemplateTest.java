package ca.gc.cra.xlog.domain.path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.xlog.domain.time.ClockSnapshot;
import java.nio.file.Path;
import java.time.ZoneOffset;
import org.junit.jupiter.api.Test;

class LogPathTemplateTest {
  private static final ClockSnapshot AFTERNOON =
      ClockSnapshot.of(1_718_285_405d, ZoneOffset.UTC); // 2024-06-13T13:30:05Z

  @Test
  void substitutesEveryPlaceholder() {
    LogPathTemplate template =
        LogPathTemplate.of("logs/~y~/~ym~/~me~-~ymd~-~h~-~hm~-~hms~.log", "edge01");

    assertEquals(
        Path.of("logs/24/2406/edge01-240613-13-1330-133005.log"),
        template.resolve(AFTERNOON).orElseThrow());
  }

  @Test
  void sameInstantResolvesToSamePath() {
    LogPathTemplate template = LogPathTemplate.of("logs/~ymd~.log", "xlog");

    assertEquals(template.resolve(AFTERNOON), template.resolve(AFTERNOON));
  }

  @Test
  void blankTemplateDisablesPersistence() {
    LogPathTemplate template = LogPathTemplate.of("  ", "xlog");

    assertFalse(template.enabled());
    assertTrue(template.resolve(AFTERNOON).isEmpty());
    assertFalse(LogPathTemplate.disabled().enabled());
  }

  @Test
  void textWithoutPlaceholdersIsUsedVerbatim() {
    assertEquals(
        Path.of("fixed.log"),
        LogPathTemplate.of("fixed.log", "xlog").resolve(AFTERNOON).orElseThrow());
  }
}
