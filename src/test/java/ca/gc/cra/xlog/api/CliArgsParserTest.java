package ca.gc.cra.xlog.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Map;
import org.junit.jupiter.api.Test;

class CliArgsParserTest {

  @Test
  void parsesKeyValuePairsAndKeepsLastDuplicate() {
    Map<String, String> map = CliArgsParser.toMap(new String[] {"port=1", "logPath=a=b.log", " port=2 ", ""});

    assertEquals(Map.of("port", "2", "logPath", "a=b.log"), map);
  }

  @Test
  void rejectsMissingSeparatorOrValue() {
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"port"}));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"port="}));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"=1"}));
  }

  @Test
  void rejectsBadKeysAndControlCharacters() {
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"1port=2"}));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"host=a\u0007b"}));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"host= \t"}));
  }

  @Test
  void nullArgsYieldEmptyMap() {
    assertEquals(Map.of(), CliArgsParser.toMap(null));
  }
}
