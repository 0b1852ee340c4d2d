package ca.gc.cra.xlog.application.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.xlog.application.clock.ClockState;
import ca.gc.cra.xlog.application.json.JsonSupport;
import ca.gc.cra.xlog.application.normalize.RecordNormalizer;
import ca.gc.cra.xlog.application.port.ConsolePort;
import ca.gc.cra.xlog.application.port.LogFilePort;
import ca.gc.cra.xlog.application.port.RecordViewer;
import ca.gc.cra.xlog.domain.path.LogPathTemplate;
import ca.gc.cra.xlog.domain.record.FormattedRecord;
import ca.gc.cra.xlog.domain.record.ViewedRecord;
import ca.gc.cra.xlog.infrastructure.persistence.FlatFileLogSink;
import ca.gc.cra.xlog.testutil.Eventually;
import ca.gc.cra.xlog.testutil.ManualClock;
import ca.gc.cra.xlog.testutil.RecordingConsole;
import ca.gc.cra.xlog.testutil.RecordingMetrics;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class PersistenceWriterTest {
  private static final Duration POLL = Duration.ofMillis(20);
  private static final Duration WAIT = Duration.ofSeconds(5);
  // 2024-01-01T23:59:58Z
  private static final double LATE_EVENING = 1_704_153_598d;
  // 2024-01-01T12:00:00Z
  private static final double MIDDAY = 1_704_110_400d;

  @TempDir Path dir;

  private ManualClock clock;
  private ClockState clockState;
  private RecordNormalizer normalizer;
  private XlogContext context;
  private RecordingMetrics metrics;
  private RecordingConsole console;
  private FlatFileLogSink sink;
  private PersistenceWriter writer;

  @BeforeEach
  void setUp() {
    clock = new ManualClock(LATE_EVENING);
    clockState = new ClockState(clock, ZoneOffset.UTC);
    normalizer = new RecordNormalizer(clockState, new JsonSupport());
    context = new XlogContext();
    metrics = new RecordingMetrics();
    console = new RecordingConsole();
    sink = new FlatFileLogSink();
  }

  @AfterEach
  void tearDown() throws Exception {
    if (writer != null) {
      writer.requestStop();
      writer.awaitStopped(WAIT);
    }
    sink.close();
  }

  private PersistenceWriter writer(LogPathTemplate template, LogFilePort logFile, RecordViewer viewer) {
    writer = new PersistenceWriter(
        context, clockState, template, logFile, viewer, new JsonSupport(), metrics, console, POLL);
    return writer;
  }

  private LogPathTemplate dailyTemplate() {
    return LogPathTemplate.of(dir.resolve("~me~-~ymd~.log").toString(), "xlog");
  }

  private FormattedRecord record(String message) {
    return normalizer.normalize("10.0.0.1\t{\"_msg\":\"" + message + "\"}").record();
  }

  @Test
  void persistsRecordsAndPrintsProgressWithoutViewer() throws IOException {
    writer(dailyTemplate(), sink, null).start();

    context.queue().add(record("one"));
    Eventually.await("first record", WAIT, () -> metrics.counter("writer.records.persisted") == 1);

    Path file = dir.resolve("xlog-240101.log");
    List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
    assertEquals(1, lines.size());
    assertTrue(FormattedRecord.decode(lines.get(0)).digestMatches());
    assertEquals(0, console.dots());

    clock.advance(1);
    context.queue().add(record("two"));
    Eventually.await("second record", WAIT, () -> metrics.counter("writer.records.persisted") == 2);

    assertEquals(1, console.dots());
    assertEquals(List.of(1L), metrics.observations("writer.flush.batch"));
  }

  @Test
  void rotatesAcrossDayBoundary() throws IOException {
    writer(dailyTemplate(), sink, null).start();

    context.queue().add(record("before midnight"));
    Eventually.await("first record", WAIT, () -> metrics.counter("writer.records.persisted") == 1);
    clock.advance(5);
    context.queue().add(record("after midnight"));
    Eventually.await("second record", WAIT, () -> metrics.counter("writer.records.persisted") == 2);

    assertEquals(1, metrics.counter("writer.rotations"));
    assertEquals(1, Files.readAllLines(dir.resolve("xlog-240101.log")).size());
    List<String> after = Files.readAllLines(dir.resolve("xlog-240102.log"));
    assertEquals(1, after.size());
    assertTrue(after.get(0).contains("after midnight"));
  }

  @Test
  void recordsWithinOneSecondShareABatch() throws IOException {
    clock.set(MIDDAY);
    writer(dailyTemplate(), sink, null).start();

    context.queue().add(record("a"));
    Eventually.await("first record", WAIT, () -> metrics.counter("writer.records.persisted") == 1);
    context.queue().add(record("b"));
    context.queue().add(record("c"));
    Eventually.await("batch", WAIT, () -> metrics.counter("writer.records.persisted") == 3);
    clock.advance(2);
    context.queue().add(record("d"));
    Eventually.await("first flush", WAIT, () -> metrics.observations("writer.flush.batch").size() == 1);
    clock.advance(2);
    context.queue().add(record("e"));
    Eventually.await("second flush", WAIT, () -> metrics.observations("writer.flush.batch").size() == 2);

    assertEquals(List.of(3L, 1L), metrics.observations("writer.flush.batch"));
    assertEquals(2, console.dots());
    assertEquals(5, Files.readAllLines(dir.resolve("xlog-240101.log")).size());
  }

  @Test
  void viewerFailureDoesNotStopPersistence() throws IOException {
    RecordViewer failing = viewed -> {
      throw new IllegalStateException("render broke");
    };
    writer(dailyTemplate(), sink, failing).start();

    context.queue().add(record("one"));
    context.queue().add(record("two"));
    Eventually.await("two records", WAIT, () -> metrics.counter("writer.records.persisted") == 2);
    Eventually.await("two failures", WAIT, () -> console.failures().size() == 2);

    assertEquals(2, metrics.counter("writer.viewer.error"));
    String failure = console.failures().get(0);
    assertTrue(failure.startsWith("!! 1\t"));
    assertTrue(failure.endsWith(" !! render broke !!"));
    assertEquals(0, console.dots());
    assertFalse(context.stopRequested());
  }

  @Test
  void renderOnlyModeDeliversToViewer() {
    List<ViewedRecord> seen = new CopyOnWriteArrayList<>();
    writer(LogPathTemplate.disabled(), sink, seen::add).start();

    context.queue().add(record("shown"));
    Eventually.await("viewer", WAIT, () -> seen.size() == 1);

    assertEquals("shown", seen.get(0).message());
    assertEquals(Optional.empty(), sink.currentPath());
    assertEquals(0, metrics.counter("writer.records.persisted"));
  }

  @Test
  void noPathAndNoViewerFailsTheWriter() throws InterruptedException {
    writer(LogPathTemplate.disabled(), sink, null).start();

    context.queue().add(record("lost"));

    assertTrue(writer.awaitStopped(WAIT));
    assertTrue(context.stopRequested());
    assertInstanceOf(IllegalStateException.class, context.writerFailure().orElseThrow());
  }

  @Test
  void ioFailureWithViewerReopensOnNextRecord() {
    FailingOnceSink failing = new FailingOnceSink(sink);
    List<ViewedRecord> seen = new CopyOnWriteArrayList<>();
    writer(dailyTemplate(), failing, seen::add).start();

    context.queue().add(record("first"));
    Eventually.await("viewer sees first", WAIT, () -> seen.size() == 1);
    context.queue().add(record("second"));
    Eventually.await("second persisted", WAIT, () -> metrics.counter("writer.records.persisted") == 1);

    assertEquals(1, metrics.counter("writer.persist.error"));
    assertEquals(2, seen.size());
    assertFalse(context.stopRequested());
  }

  @Test
  void ioFailureWithoutViewerIsFatal() throws InterruptedException {
    writer(dailyTemplate(), new FailingOnceSink(sink), null).start();

    context.queue().add(record("first"));

    assertTrue(writer.awaitStopped(WAIT));
    assertTrue(context.writerFailure().isPresent());
    assertEquals(1, metrics.counter("writer.persist.error"));
  }

  @Test
  void startTwiceIsRejected() {
    writer(dailyTemplate(), sink, null).start();

    assertThrows(IllegalStateException.class, writer::start);
  }

  @Test
  void rejectsNonPositivePoll() {
    assertThrows(IllegalArgumentException.class, () -> new PersistenceWriter(
        context, clockState, dailyTemplate(), sink, null, new JsonSupport(), metrics,
        ConsolePort.NO_OP, Duration.ZERO));
  }

  /** Delegating sink whose first append fails. */
  private static final class FailingOnceSink implements LogFilePort {
    private final LogFilePort delegate;
    private boolean failed;

    FailingOnceSink(LogFilePort delegate) {
      this.delegate = delegate;
    }

    @Override
    public void open(Path path) throws IOException {
      delegate.open(path);
    }

    @Override
    public void append(String line) throws IOException {
      if (!failed) {
        failed = true;
        throw new IOException("disk full");
      }
      delegate.append(line);
    }

    @Override
    public void sync() throws IOException {
      delegate.sync();
    }

    @Override
    public Optional<Path> currentPath() {
      return delegate.currentPath();
    }

    @Override
    public void close() throws IOException {
      delegate.close();
    }
  }
}
