package ca.gc.cra.geotag.application.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.geotag.application.port.MetricsPort;
import ca.gc.cra.geotag.domain.correlate.CorrelationPolicy;
import ca.gc.cra.geotag.domain.correlate.CorrelationSettings;
import ca.gc.cra.geotag.domain.correlate.SatisfyMode;
import ca.gc.cra.geotag.domain.geo.EmptyTrackException;
import ca.gc.cra.geotag.domain.geo.Position;
import ca.gc.cra.geotag.domain.geo.TimestampedPoint;
import ca.gc.cra.geotag.domain.geo.Track;
import ca.gc.cra.geotag.domain.item.ItemProcessingException;
import ca.gc.cra.geotag.domain.item.TagValue;
import ca.gc.cra.geotag.domain.item.Tags;
import ca.gc.cra.geotag.domain.item.WorkItem;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class CorrelateStageTest {
  private static final Instant T0 = Instant.parse("2024-06-01T16:00:00Z");

  private final Track track = Track.build(List.of(
      TimestampedPoint.of(T0, 45.0d, -75.0d, null),
      TimestampedPoint.of(T0.plusSeconds(120), 45.002d, -75.0d, null)));

  @Test
  void matchesCaptureTimeInCameraZone() {
    RecordingMetrics metrics = new RecordingMetrics();
    CorrelateStage stage = new CorrelateStage(
        track, CorrelationSettings.defaults(), ZoneId.of("America/Toronto"), Duration.ZERO, false, metrics);
    // 12:01 EDT is 16:01Z, halfway along the track
    WorkItem item = photo("2024:06:01 12:01:00");

    stage.process(item);

    Position position = item.position().orElseThrow();
    assertEquals(45.001d, position.latitude(), 1e-9);
    assertTrue(item.contains(Tags.GPS_LATITUDE));
    assertTrue(item.isDirty());
    assertEquals(1L, metrics.counter("correlate.matched"));
  }

  @Test
  void cameraOffsetShiftsLookup() {
    CorrelateStage stage = new CorrelateStage(
        track, CorrelationSettings.defaults(), ZoneOffset.UTC, Duration.ofSeconds(60), false, MetricsPort.NO_OP);
    // camera clock one minute fast; 16:02 on the camera is 16:01Z
    WorkItem item = photo("2024:06:01 16:02:00");

    stage.process(item);

    assertEquals(45.001d, item.position().orElseThrow().latitude(), 1e-9);
  }

  @Test
  void existingPositionIsKeptWithoutOverwrite() {
    RecordingMetrics metrics = new RecordingMetrics();
    CorrelateStage stage = new CorrelateStage(
        track, CorrelationSettings.defaults(), ZoneOffset.UTC, Duration.ZERO, false, metrics);
    WorkItem item = photo("2024:06:01 16:01:00");
    item.position(Position.of(10d, 10d));

    stage.process(item);

    assertEquals(Position.of(10d, 10d), item.position().orElseThrow());
    assertFalse(item.isDirty());
    assertEquals(1L, metrics.counter("correlate.skipped"));
  }

  @Test
  void existingPositionIsReplacedWithOverwrite() {
    CorrelateStage stage = new CorrelateStage(
        track, CorrelationSettings.defaults(), ZoneOffset.UTC, Duration.ZERO, true, MetricsPort.NO_OP);
    WorkItem item = photo("2024:06:01 16:01:00");
    item.position(Position.of(10d, 10d));

    stage.process(item);

    assertEquals(45.001d, item.position().orElseThrow().latitude(), 1e-9);
  }

  @Test
  void noMatchLeavesItemUntouched() {
    RecordingMetrics metrics = new RecordingMetrics();
    CorrelationSettings strict = new CorrelationSettings(
        CorrelationPolicy.AVERAGE,
        Duration.ofSeconds(10),
        10d,
        SatisfyMode.ANY);
    CorrelateStage stage = new CorrelateStage(track, strict, ZoneOffset.UTC, Duration.ZERO, false, metrics);
    WorkItem item = photo("2024:06:01 16:01:00");

    stage.process(item);

    assertTrue(item.position().isEmpty());
    assertFalse(item.isDirty());
    assertEquals(1L, metrics.counter("correlate.nomatch"));
  }

  @Test
  void missingCaptureTimeFailsItem() {
    CorrelateStage stage = new CorrelateStage(
        track, CorrelationSettings.defaults(), ZoneOffset.UTC, Duration.ZERO, false, MetricsPort.NO_OP);

    assertThrows(ItemProcessingException.class, () -> stage.process(new WorkItem("a.jpg")));
  }

  @Test
  void emptyTrackIsRejectedAtConstruction() {
    assertThrows(
        EmptyTrackException.class,
        () -> new CorrelateStage(
            Track.empty(), CorrelationSettings.defaults(), ZoneOffset.UTC, Duration.ZERO, false, MetricsPort.NO_OP));
  }

  private static WorkItem photo(String exifTime) {
    return new WorkItem("a.jpg", Map.of(Tags.DATE_TIME_ORIGINAL, TagValue.text(exifTime)));
  }

  private static final class RecordingMetrics implements MetricsPort {
    private final Map<String, Long> counters = new HashMap<>();

    @Override
    public void increment(String key) {
      counters.merge(key, 1L, Long::sum);
    }

    @Override
    public void observe(String key, long value) {}

    long counter(String key) {
      return counters.getOrDefault(key, 0L);
    }
  }
}
