package ca.gc.cra.xlog.application.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class XlogContextTest {

  @Test
  void firstStopReasonWins() throws InterruptedException {
    XlogContext context = new XlogContext();
    assertFalse(context.awaitStop(Duration.ofMillis(1)));

    context.requestStop("!STOP!");
    context.requestStop("shutdown signal");

    assertTrue(context.stopRequested());
    assertTrue(context.awaitStop(Duration.ZERO));
    assertEquals(Optional.of("!STOP!"), context.stopReason());
  }

  @Test
  void writerFailureRaisesStop() {
    XlogContext context = new XlogContext();
    IllegalStateException failure = new IllegalStateException("disk gone");

    context.failWriter(failure);

    assertTrue(context.stopRequested());
    assertEquals(Optional.of(failure), context.writerFailure());
    assertEquals(Optional.of("writer failure: disk gone"), context.stopReason());
  }

  @Test
  void connectionCounters() {
    XlogContext context = new XlogContext();

    assertEquals(1, context.connectionOpened());
    assertEquals(2, context.connectionOpened());
    assertEquals(1, context.connectionClosed());
    assertEquals(1, context.openConnections());
    assertEquals(2L, context.totalConnections());
  }
}
