package ca.gc.cra.geotag.application.port;

import java.io.IOException;
import java.util.Map;

/**
 * Port supplying prior-run tabular data keyed by photo identity.
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface AugmentSource {

  /**
   * Loads every row.
   *
   * @return rows keyed by identity
   * @throws IOException if the source cannot be read or a cell holds a malformed number
   */
  Map<String, AugmentRow> load() throws IOException;
}
