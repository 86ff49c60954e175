package ca.gc.cra.geotag.application.port;

import ca.gc.cra.geotag.domain.item.ResultField;
import java.io.IOException;
import java.util.Map;

/**
 * Port receiving one result row per item that reaches the writer stage.
 *
 * <p>Invoked only from the writer stage thread, in arrival order.</p>
 *
 * @since 0.1.0
 */
public interface ResultSink extends AutoCloseable {

  /**
   * Appends a row.
   *
   * @param row column values; missing columns are written empty
   * @throws IOException if the row cannot be written
   */
  void record(Map<ResultField, String> row) throws IOException;

  /**
   * Flushes and releases the sink.
   *
   * @throws IOException if the final flush fails
   */
  @Override
  void close() throws IOException;

  /** Sink that discards all rows. */
  ResultSink NONE = new ResultSink() {
    @Override public void record(Map<ResultField, String> row) {}

    @Override public void close() {}
  };
}
