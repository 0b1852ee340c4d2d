package ca.gc.cra.xlog.infrastructure.viewer;

import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;

import ca.gc.cra.xlog.application.port.RecordViewer;
import ca.gc.cra.xlog.domain.record.ViewedRecord;
import org.junit.jupiter.api.Test;

class ViewerFactoryTest {

  @Test
  void loggingIsBuiltIn() {
    assertInstanceOf(LoggingRecordViewer.class, ViewerFactory.create("Logging"));
  }

  @Test
  void loadsViewerByClassName() {
    assertInstanceOf(CountingViewer.class, ViewerFactory.create(CountingViewer.class.getName()));
  }

  @Test
  void rejectsUnknownOrIncompatibleViewers() {
    assertThrows(IllegalArgumentException.class, () -> ViewerFactory.create("no.such.Viewer"));
    assertThrows(IllegalArgumentException.class, () -> ViewerFactory.create(String.class.getName()));
    assertThrows(IllegalArgumentException.class, () -> ViewerFactory.create(" "));
  }

  public static final class CountingViewer implements RecordViewer {
    int seen;

    public CountingViewer() {}

    @Override
    public void view(ViewedRecord record) {
      seen++;
    }
  }
}
