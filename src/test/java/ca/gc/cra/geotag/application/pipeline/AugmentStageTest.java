package ca.gc.cra.geotag.application.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.geotag.application.port.AugmentRow;
import ca.gc.cra.geotag.domain.geo.Position;
import ca.gc.cra.geotag.domain.item.GpsTags;
import ca.gc.cra.geotag.domain.item.ItemProcessingException;
import ca.gc.cra.geotag.domain.item.Rational;
import ca.gc.cra.geotag.domain.item.ResultField;
import ca.gc.cra.geotag.domain.item.TagValue;
import ca.gc.cra.geotag.domain.item.Tags;
import ca.gc.cra.geotag.domain.item.WorkItem;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class AugmentStageTest {

  @Test
  void itemWithoutRowPassesUnchanged() {
    AugmentStage stage = new AugmentStage(Map.of());
    WorkItem item = new WorkItem("a.jpg");

    assertSame(item, stage.process(item).orElseThrow());
    assertFalse(item.isDirty());
  }

  @Test
  void rowWritesCoordinatesAndPlaceText() {
    AugmentStage stage = new AugmentStage(Map.of("a.jpg",
        new AugmentRow("a.jpg", "45.5", "-75.5", "80", "Ottawa", "Ontario", "Canada")));
    WorkItem item = new WorkItem("a.jpg");

    stage.process(item);

    assertEquals(new Position(45.5d, -75.5d, 80d), item.position().orElseThrow());
    assertEquals("W", item.text(Tags.GPS_LONGITUDE_REF).orElseThrow());
    assertEquals("Ottawa", item.text(Tags.CITY).orElseThrow());
    assertEquals("Canada", item.result().get(ResultField.COUNTRY_NAME));
    assertTrue(item.isDirty());
  }

  @Test
  void blankTextCellsAreIgnored() {
    AugmentStage stage = new AugmentStage(Map.of("a.jpg",
        new AugmentRow("a.jpg", null, null, null, "", " ", "France")));
    WorkItem item = new WorkItem("a.jpg");

    stage.process(item);

    assertTrue(item.position().isEmpty());
    assertFalse(item.contains(Tags.CITY));
    assertFalse(item.contains(Tags.PROVINCE_STATE));
    assertEquals("France", item.text(Tags.COUNTRY_NAME).orElseThrow());
  }

  @Test
  void lonelyLatitudeWithoutExistingPositionFailsThatItem() {
    AugmentStage stage = stageFor(new AugmentRow("a.jpg", "45", null, null, null, null, null));

    assertThrows(ItemProcessingException.class, () -> stage.process(new WorkItem("a.jpg")));
  }

  @Test
  void lonelyLatitudeCompletesExistingPosition() {
    AugmentStage stage = stageFor(new AugmentRow("a.jpg", "46.25", null, null, null, null, null));
    WorkItem item = new WorkItem("a.jpg");
    item.position(new Position(45d, -75d, 90d));

    stage.process(item);

    assertEquals(new Position(46.25d, -75d, 90d), item.position().orElseThrow());
    assertEquals(new Position(46.25d, -75d, 90d), GpsTags.read(item).orElseThrow());
    assertEquals("46.25", item.result().get(ResultField.LATITUDE));
  }

  @Test
  void lonelyLongitudeCompletesExistingPosition() {
    AugmentStage stage = stageFor(new AugmentRow("a.jpg", null, "-74.5", null, null, null, null));
    WorkItem item = new WorkItem("a.jpg");
    item.position(Position.of(45d, -75d));

    stage.process(item);

    assertEquals(Position.of(45d, -74.5d), item.position().orElseThrow());
    assertTrue(item.isDirty());
  }

  @Test
  void elevationOnlyRowUpdatesAltitude() {
    AugmentStage stage = stageFor(new AugmentRow("a.jpg", null, null, "123", null, null, null));
    WorkItem item = new WorkItem("a.jpg");

    stage.process(item);

    assertTrue(item.isDirty());
    assertEquals(TagValue.rationals(List.of(new Rational(12_300, 100))), item.get(Tags.GPS_ALTITUDE).orElseThrow());
    assertEquals(TagValue.integer(0L), item.get(Tags.GPS_ALTITUDE_REF).orElseThrow());
    assertEquals("123.0", item.result().get(ResultField.ELEVATION));
    assertTrue(item.position().isEmpty());
  }

  @Test
  void elevationOnlyRowKeepsExistingCoordinates() {
    AugmentStage stage = stageFor(new AugmentRow("a.jpg", null, null, "-3.5", null, null, null));
    WorkItem item = new WorkItem("a.jpg");
    item.position(Position.of(45d, -75d));

    stage.process(item);

    assertEquals(new Position(45d, -75d, -3.5d), item.position().orElseThrow());
    assertFalse(item.contains(Tags.GPS_LATITUDE));
    assertEquals(TagValue.integer(1L), item.get(Tags.GPS_ALTITUDE_REF).orElseThrow());
  }

  @Test
  void malformedNumberFailsOnlyThatItem() {
    AugmentStage stage = new AugmentStage(Map.of(
        "a.jpg", new AugmentRow("a.jpg", "45.0", "-75.0", null, null, null, null),
        "b.jpg", new AugmentRow("b.jpg", "north", "-75.0", null, null, null, null)));

    ItemProcessingException ex =
        assertThrows(ItemProcessingException.class, () -> stage.process(new WorkItem("b.jpg")));
    assertTrue(ex.getMessage().contains("Latitude 'north' is not a number"), ex.getMessage());
    WorkItem good = new WorkItem("a.jpg");
    stage.process(good);
    assertEquals(Position.of(45d, -75d), good.position().orElseThrow());
  }

  @Test
  void nonFiniteElevationIsRejected() {
    AugmentStage stage = stageFor(new AugmentRow("a.jpg", null, null, "NaN", null, null, null));

    assertThrows(ItemProcessingException.class, () -> stage.process(new WorkItem("a.jpg")));
  }

  @Test
  void outOfRangeCoordinateIsRejected() {
    AugmentStage stage = stageFor(new AugmentRow("a.jpg", "45", "200", null, null, null, null));

    assertThrows(ItemProcessingException.class, () -> stage.process(new WorkItem("a.jpg")));
  }

  private static AugmentStage stageFor(AugmentRow row) {
    return new AugmentStage(Map.of(row.identity(), row));
  }
}
