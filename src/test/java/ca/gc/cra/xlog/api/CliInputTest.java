package ca.gc.cra.xlog.api;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

class CliInputTest {

  @Test
  void sortsArgumentsByKind() {
    CliInput input = CliInput.parse(new String[] {"extra", "--port=1", "host=h", "--dry-run", "-V", " "});

    assertEquals(List.of("extra"), input.positionals());
    assertArrayEquals(new String[] {"port=1", "host=h"}, input.keyValueArgs());
    assertTrue(input.hasFlag("--DRY-RUN"));
    assertTrue(input.verbose());
    assertFalse(input.help());
  }

  @Test
  void helpAliases() {
    assertTrue(CliInput.parse(new String[] {"-h"}).help());
    assertTrue(CliInput.parse(new String[] {"help"}).help());
    assertTrue(CliInput.parse(new String[] {"--HELP"}).help());
  }

  @Test
  void unknownFlagsExcludeKnownAndGlobal() {
    CliInput input = CliInput.parse(new String[] {"--stop", "--verbose", "--help", "--bogus"});

    assertEquals(Set.of("--bogus"), input.unknownFlags(Set.of("--stop")));
  }
}
