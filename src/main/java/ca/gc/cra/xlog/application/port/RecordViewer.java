package ca.gc.cra.xlog.application.port;

import ca.gc.cra.xlog.domain.record.ViewedRecord;

/**
 * <strong>What:</strong> Port rendering persisted records to an operator console.
 * <p><strong>Role:</strong> Invoked by the persistence writer, after the record has been written, when
 * rendering is enabled.</p>
 * <p><strong>Thread-safety:</strong> Called from the single writer thread only.</p>
 * <p><strong>Failure model:</strong> Any exception thrown is reported and ignored by the writer; a failing viewer
 * never stops persistence.</p>
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface RecordViewer {
  /**
   * Renders one record.
   *
   * @param record decoded record with its event mapping
   * @throws Exception when rendering fails
   */
  void view(ViewedRecord record) throws Exception;
}
