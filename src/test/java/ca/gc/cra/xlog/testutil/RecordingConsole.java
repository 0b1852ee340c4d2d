package ca.gc.cra.xlog.testutil;

import ca.gc.cra.xlog.application.port.ConsolePort;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/** Captures progress dots and viewer failure lines. */
public final class RecordingConsole implements ConsolePort {
  private final AtomicInteger dots = new AtomicInteger();
  private final List<String> failures = new CopyOnWriteArrayList<>();

  @Override
  public void progress() {
    dots.incrementAndGet();
  }

  @Override
  public void viewerFailure(String line) {
    failures.add(line);
  }

  public int dots() {
    return dots.get();
  }

  public List<String> failures() {
    return failures;
  }
}
