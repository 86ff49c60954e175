package ca.gc.cra.geotag.application.pipeline;

import ca.gc.cra.geotag.application.geocode.LocationResolver;
import ca.gc.cra.geotag.domain.geo.Position;
import ca.gc.cra.geotag.domain.item.ResultField;
import ca.gc.cra.geotag.domain.item.TagValue;
import ca.gc.cra.geotag.domain.item.Tags;
import ca.gc.cra.geotag.domain.item.WorkItem;
import ca.gc.cra.geotag.domain.place.PlaceInfo;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves place names for positioned items and writes them into the item's location tags.
 *
 * <p>Items without a position pass through. Items that already name a city keep their names unless overwrite is
 * forced.</p>
 *
 * @since 0.1.0
 */
public final class GeocodeStage implements StageHandler {
  private static final Logger log = LoggerFactory.getLogger(GeocodeStage.class);

  private final LocationResolver resolver;
  private final boolean overwrite;

  /**
   * Creates the stage.
   *
   * @param resolver caching, throttled resolver owned by this stage
   * @param overwrite whether to replace existing place tags
   */
  public GeocodeStage(LocationResolver resolver, boolean overwrite) {
    this.resolver = Objects.requireNonNull(resolver, "resolver");
    this.overwrite = overwrite;
  }

  @Override
  public String name() {
    return "geocode";
  }

  @Override
  public Optional<WorkItem> process(WorkItem item) throws Exception {
    Optional<Position> position = item.position();
    if (position.isEmpty()) {
      return Optional.of(item);
    }
    if (item.contains(Tags.CITY) && !overwrite) {
      item.text(Tags.CITY).ifPresent(v -> item.result(ResultField.CITY, v));
      item.text(Tags.PROVINCE_STATE).ifPresent(v -> item.result(ResultField.PROVINCE_STATE, v));
      item.text(Tags.COUNTRY_NAME).ifPresent(v -> item.result(ResultField.COUNTRY_NAME, v));
      return Optional.of(item);
    }
    PlaceInfo place = resolver.resolve(position.get());
    apply(item, Tags.CITY, ResultField.CITY, place.city());
    apply(item, Tags.PROVINCE_STATE, ResultField.PROVINCE_STATE, place.provinceState());
    apply(item, Tags.COUNTRY_NAME, ResultField.COUNTRY_NAME, place.countryName());
    if (!place.countryCode().isEmpty()) {
      item.set(Tags.COUNTRY_CODE, TagValue.text(place.countryCode()));
    }
    log.debug("Geocoded {} to {}, {}, {}", item.identity(), place.city(), place.provinceState(), place.countryName());
    return Optional.of(item);
  }

  private static void apply(WorkItem item, String tag, ResultField field, String value) {
    if (value.isEmpty()) {
      return;
    }
    item.set(tag, TagValue.text(value));
    item.result(field, value);
  }
}
