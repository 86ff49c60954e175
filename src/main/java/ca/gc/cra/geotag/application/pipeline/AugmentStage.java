package ca.gc.cra.geotag.application.pipeline;

import ca.gc.cra.geotag.application.port.AugmentRow;
import ca.gc.cra.geotag.domain.geo.Position;
import ca.gc.cra.geotag.domain.item.GpsTags;
import ca.gc.cra.geotag.domain.item.ItemProcessingException;
import ca.gc.cra.geotag.domain.item.ResultField;
import ca.gc.cra.geotag.domain.item.TagValue;
import ca.gc.cra.geotag.domain.item.Tags;
import ca.gc.cra.geotag.domain.item.WorkItem;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Merges prior-run tabular data into an item before the other stages see it.
 *
 * <p>Only cells present in the row are applied; absent cells leave existing metadata untouched. A lone Latitude or
 * Longitude is combined with the position the photo already carries, and a lone Elevation updates only the
 * altitude. A malformed or out-of-range cell fails that photo alone.</p>
 *
 * @since 0.1.0
 */
public final class AugmentStage implements StageHandler {
  private static final Logger log = LoggerFactory.getLogger(AugmentStage.class);

  private final Map<String, AugmentRow> rows;

  /**
   * Creates the stage.
   *
   * @param rows rows keyed by item identity; copied
   */
  public AugmentStage(Map<String, AugmentRow> rows) {
    this.rows = Map.copyOf(Objects.requireNonNull(rows, "rows"));
  }

  @Override
  public String name() {
    return "augment";
  }

  @Override
  public Optional<WorkItem> process(WorkItem item) {
    AugmentRow row = rows.get(item.identity());
    if (row == null) {
      return Optional.of(item);
    }
    Double latitude = number(item, ResultField.LATITUDE, row.latitude());
    Double longitude = number(item, ResultField.LONGITUDE, row.longitude());
    Double elevation = number(item, ResultField.ELEVATION, row.elevation());
    if (latitude != null || longitude != null) {
      applyPosition(item, latitude, longitude, elevation);
    } else if (elevation != null) {
      applyElevation(item, elevation);
    }
    applyText(item, Tags.CITY, ResultField.CITY, row.city());
    applyText(item, Tags.PROVINCE_STATE, ResultField.PROVINCE_STATE, row.provinceState());
    applyText(item, Tags.COUNTRY_NAME, ResultField.COUNTRY_NAME, row.countryName());
    log.debug("Augmented {} from tabular input", item.identity());
    return Optional.of(item);
  }

  private static void applyPosition(WorkItem item, Double latitude, Double longitude, Double elevation) {
    Optional<Position> existing = item.position();
    if (existing.isEmpty() && (latitude == null || longitude == null)) {
      throw new ItemProcessingException(item.identity(),
          "augment row has only one of Latitude and Longitude and the photo has no position to complete it");
    }
    Position position;
    try {
      position = new Position(
          latitude != null ? latitude : existing.get().latitude(),
          longitude != null ? longitude : existing.get().longitude(),
          elevation != null ? elevation : existing.map(Position::elevation).orElse(null));
    } catch (IllegalArgumentException ex) {
      throw new ItemProcessingException(item.identity(), "augment row has invalid coordinates", ex);
    }
    GpsTags.write(item, position);
    item.position(position);
  }

  private static void applyElevation(WorkItem item, double elevation) {
    GpsTags.writeAltitude(item, elevation);
    Optional<Position> existing = item.position();
    if (existing.isPresent()) {
      Position current = existing.get();
      item.position(new Position(current.latitude(), current.longitude(), elevation));
    } else {
      item.result(ResultField.ELEVATION, Double.toString(elevation));
    }
  }

  private static Double number(WorkItem item, ResultField field, String text) {
    if (text == null || text.isBlank()) {
      return null;
    }
    double value;
    try {
      value = Double.parseDouble(text.trim());
    } catch (NumberFormatException ex) {
      throw new ItemProcessingException(
          item.identity(), "augment " + field.header() + " '" + text + "' is not a number", ex);
    }
    if (!Double.isFinite(value)) {
      throw new ItemProcessingException(item.identity(), "augment " + field.header() + " must be finite");
    }
    return value;
  }

  private static void applyText(WorkItem item, String tag, ResultField field, String value) {
    if (value == null || value.isBlank()) {
      return;
    }
    item.set(tag, TagValue.text(value));
    item.result(field, value);
  }
}
