package ca.gc.cra.geotag.application.pipeline;

import ca.gc.cra.geotag.application.port.MetricsPort;
import ca.gc.cra.geotag.domain.correlate.CorrelationResult;
import ca.gc.cra.geotag.domain.correlate.CorrelationSettings;
import ca.gc.cra.geotag.domain.correlate.Correlator;
import ca.gc.cra.geotag.domain.geo.Track;
import ca.gc.cra.geotag.domain.item.GpsTags;
import ca.gc.cra.geotag.domain.item.PhotoTime;
import ca.gc.cra.geotag.domain.item.WorkItem;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Assigns a track position to each photo by capture time.
 * <p><strong>Skip rule:</strong> items that already carry a position pass through unchanged unless overwrite is
 * forced.</p>
 * <p><strong>Outcomes:</strong> a match writes GPS tags and marks the item dirty; a non-match is normal and leaves the
 * position unset; a missing or malformed capture time is a per-item fault.</p>
 *
 * @since 0.1.0
 */
public final class CorrelateStage implements StageHandler {
  private static final Logger log = LoggerFactory.getLogger(CorrelateStage.class);

  private final Track track;
  private final CorrelationSettings settings;
  private final ZoneId cameraZone;
  private final Duration cameraOffset;
  private final boolean overwrite;
  private final MetricsPort metrics;

  /**
   * Creates the stage.
   *
   * @param track non-empty track
   * @param settings correlation policy and thresholds
   * @param cameraZone zone the camera clock was set to
   * @param cameraOffset how far the camera clock runs ahead of true time
   * @param overwrite whether to re-correlate items that already carry a position
   * @param metrics metrics sink
   */
  public CorrelateStage(
      Track track,
      CorrelationSettings settings,
      ZoneId cameraZone,
      Duration cameraOffset,
      boolean overwrite,
      MetricsPort metrics) {
    this.track = Objects.requireNonNull(track, "track").requireNonEmpty();
    this.settings = Objects.requireNonNull(settings, "settings");
    this.cameraZone = Objects.requireNonNull(cameraZone, "cameraZone");
    this.cameraOffset = Objects.requireNonNull(cameraOffset, "cameraOffset");
    this.overwrite = overwrite;
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  @Override
  public String name() {
    return "correlate";
  }

  @Override
  public Optional<WorkItem> process(WorkItem item) {
    if (item.position().isPresent() && !overwrite) {
      log.debug("Skipping {}; already has a position", item.identity());
      metrics.increment("correlate.skipped");
      return Optional.of(item);
    }
    Instant captured = PhotoTime.utcInstant(item, cameraZone, cameraOffset);
    CorrelationResult result = Correlator.locate(captured, track, settings);
    if (result instanceof CorrelationResult.Resolved resolved) {
      item.position(resolved.position());
      GpsTags.write(item, resolved.position());
      metrics.increment("correlate.matched");
      log.debug(
          "Matched {} at {} to {},{} (delta {}s, bracket {} m)",
          item.identity(),
          captured,
          resolved.position().latitude(),
          resolved.position().longitude(),
          resolved.delta().toSeconds(),
          Math.round(resolved.distanceMeters()));
    } else {
      metrics.increment("correlate.nomatch");
      log.info("No track match for {} at {}", item.identity(), captured);
    }
    return Optional.of(item);
  }
}
