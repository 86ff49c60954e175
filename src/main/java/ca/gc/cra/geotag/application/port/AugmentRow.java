package ca.gc.cra.geotag.application.port;

import java.util.Objects;

/**
 * One row of prior-run tabular data. Absent columns are {@code null}.
 *
 * <p>Coordinate cells stay as the text read from the source; they are parsed per item so a malformed cell only
 * affects the photo it belongs to.</p>
 *
 * @param identity photo identity the row belongs to
 * @param latitude latitude text or {@code null}
 * @param longitude longitude text or {@code null}
 * @param elevation elevation text or {@code null}
 * @param city city or {@code null}
 * @param provinceState province/state or {@code null}
 * @param countryName country name or {@code null}
 * @since 0.1.0
 */
public record AugmentRow(
    String identity,
    String latitude,
    String longitude,
    String elevation,
    String city,
    String provinceState,
    String countryName) {

  public AugmentRow {
    Objects.requireNonNull(identity, "identity");
  }
}
