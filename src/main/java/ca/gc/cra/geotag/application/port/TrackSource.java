package ca.gc.cra.geotag.application.port;

import ca.gc.cra.geotag.domain.geo.TimestampedPoint;
import java.io.IOException;
import java.util.List;

/**
 * Port supplying raw GPS samples; order and duplicates are normalized by {@code Track.build}.
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface TrackSource {

  /**
   * Reads every sample.
   *
   * @return samples in source order; may be empty
   * @throws IOException if the source cannot be read or parsed
   */
  List<TimestampedPoint> read() throws IOException;
}
