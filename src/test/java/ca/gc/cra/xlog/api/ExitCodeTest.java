package ca.gc.cra.xlog.api;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.io.IOException;
import java.io.UncheckedIOException;
import org.junit.jupiter.api.Test;

class ExitCodeTest {

  @Test
  void codesAreStable() {
    assertEquals(0, ExitCode.SUCCESS.code());
    assertEquals(2, ExitCode.INVALID_ARGS.code());
    assertEquals(130, ExitCode.INTERRUPTED.code());
  }

  @Test
  void failuresMapToCodes() {
    assertEquals(ExitCode.IO_ERROR, ExitCode.forFailure(new IOException("x")));
    assertEquals(ExitCode.INTERRUPTED, ExitCode.forFailure(new InterruptedException()));
    assertEquals(ExitCode.CONFIG_ERROR, ExitCode.forFailure(new IllegalArgumentException("x")));
    assertEquals(ExitCode.RUNTIME_FAILURE, ExitCode.forFailure(new UncheckedIOException(new IOException())));
  }
}
