package ca.gc.cra.xlog.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.xlog.application.pipeline.IngestServer;
import ca.gc.cra.xlog.application.pipeline.ShutdownReport;
import ca.gc.cra.xlog.domain.record.FormattedRecord;
import ca.gc.cra.xlog.infrastructure.net.XlogClient;
import ca.gc.cra.xlog.testutil.ManualClock;
import ca.gc.cra.xlog.testutil.RecordingConsole;
import ca.gc.cra.xlog.testutil.RecordingMetrics;
import java.net.InetSocketAddress;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CompositionRootTest {
  private static final Duration TIMEOUT = Duration.ofSeconds(10);

  @TempDir Path dir;

  @Test
  void serverPersistsBetweenBeginsAndEndsMarkers() throws Exception {
    ServeConfig config = ServeConfig.fromMap(Map.of(
        "host", "127.0.0.1",
        "port", "0",
        "logPath", dir.resolve("~me~-~ymd~.log").toString(),
        "instanceName", "itest",
        "pollMillis", "20"));
    RecordingMetrics metrics = new RecordingMetrics();
    ManualClock clock = new ManualClock(1_704_067_200d);

    try (CompositionRoot root =
        new CompositionRoot(config, metrics, clock, new RecordingConsole(), ZoneOffset.UTC)) {
      IngestServer server = root.ingestServer();
      CompletableFuture<ShutdownReport> run = CompletableFuture.supplyAsync(() -> {
        try {
          return server.run();
        } catch (Exception ex) {
          throw new IllegalStateException(ex);
        }
      });
      InetSocketAddress bound = server.awaitListening(TIMEOUT);

      try (XlogClient client =
          XlogClient.connect(new InetSocketAddress("127.0.0.1", bound.getPort()), TIMEOUT)) {
        assertEquals("OK", client.send("{\"_msg\":\"hello\",\"_id\":12}"));
        assertEquals("OK", client.send("!STOP!"));
      }

      ShutdownReport report = run.get(TIMEOUT.toSeconds(), TimeUnit.SECONDS);
      assertTrue(report.clean());
      assertTrue(server.awaitTermination(TIMEOUT));
    }

    List<String> lines = Files.readAllLines(dir.resolve("itest-240101.log"));
    assertEquals(3, lines.size());
    FormattedRecord begins = FormattedRecord.decode(lines.get(0));
    FormattedRecord hello = FormattedRecord.decode(lines.get(1));
    FormattedRecord ends = FormattedRecord.decode(lines.get(2));
    assertTrue(begins.json().contains("itest begins @ 2024-01-01T00:00:00"));
    assertEquals("0012", hello.id());
    assertTrue(hello.digestMatches());
    assertTrue(ends.json().contains("itest ends @ 2024-01-01T00:00:00"));
    assertEquals(1, metrics.counter("ingest.lines.accepted"));
    assertEquals(3, metrics.counter("writer.records.persisted"));
  }

  @Test
  void everyStopRequestIsAcknowledged() throws Exception {
    for (int run = 0; run < 40; run++) {
      Path runDir = dir.resolve("run" + run);
      ServeConfig config = ServeConfig.fromMap(Map.of(
          "host", "127.0.0.1",
          "port", "0",
          "logPath", runDir.resolve("~me~.log").toString(),
          "pollMillis", "20"));

      try (CompositionRoot root =
          new CompositionRoot(config, new RecordingMetrics(), new ManualClock(1_704_067_200d),
              new RecordingConsole(), ZoneOffset.UTC)) {
        IngestServer server = root.ingestServer();
        CompletableFuture<ShutdownReport> running = CompletableFuture.supplyAsync(() -> {
          try {
            return server.run();
          } catch (Exception ex) {
            throw new IllegalStateException(ex);
          }
        });
        InetSocketAddress bound = server.awaitListening(TIMEOUT);

        try (XlogClient client =
            XlogClient.connect(new InetSocketAddress("127.0.0.1", bound.getPort()), TIMEOUT)) {
          assertEquals("OK", client.send("!STOP!"), "stop reply in run " + run);
        }
        assertTrue(running.get(TIMEOUT.toSeconds(), TimeUnit.SECONDS).clean());
      }
    }
  }

  @Test
  void renderOnlyServerDoesNotCreateFiles() throws Exception {
    ServeConfig config = ServeConfig.fromMap(Map.of(
        "host", "127.0.0.1",
        "port", "0",
        "logPath", "none",
        "render", "true",
        "pollMillis", "20"));

    try (CompositionRoot root =
        new CompositionRoot(config, new RecordingMetrics(), new ManualClock(1_704_067_200d),
            new RecordingConsole(), ZoneOffset.UTC)) {
      IngestServer server = root.ingestServer();
      CompletableFuture<ShutdownReport> run = CompletableFuture.supplyAsync(() -> {
        try {
          return server.run();
        } catch (Exception ex) {
          throw new IllegalStateException(ex);
        }
      });
      server.awaitListening(TIMEOUT);
      server.requestStop("test");

      assertTrue(run.get(TIMEOUT.toSeconds(), TimeUnit.SECONDS).clean());
    }
    try (var files = Files.list(dir)) {
      assertEquals(0, files.count());
    }
  }
}
