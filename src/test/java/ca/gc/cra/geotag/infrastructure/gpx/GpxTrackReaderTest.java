package ca.gc.cra.geotag.infrastructure.gpx;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.geotag.domain.geo.TimestampedPoint;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class GpxTrackReaderTest {

  @TempDir
  Path dir;

  @Test
  void readsTrackPointsWithElevationAndTime() throws Exception {
    Path gpx = write("""
        <?xml version="1.0" encoding="UTF-8"?>
        <gpx version="1.1" creator="test" xmlns="http://www.topografix.com/GPX/1/1">
          <trk><name>Morning walk</name><trkseg>
            <trkpt lat="45.4215" lon="-75.6972"><ele>70.5</ele><time>2024-06-01T12:00:00Z</time></trkpt>
            <trkpt lat="45.4220" lon="-75.6980"><time>2024-06-01T12:01:00.500Z</time></trkpt>
          </trkseg></trk>
        </gpx>
        """);

    List<TimestampedPoint> points = new GpxTrackReader(gpx).read();

    assertEquals(2, points.size());
    TimestampedPoint first = points.get(0);
    assertEquals(Instant.parse("2024-06-01T12:00:00Z"), first.time());
    assertEquals(45.4215d, first.position().latitude(), 1e-9);
    assertEquals(70.5d, first.position().elevation(), 1e-9);
    assertNull(points.get(1).position().elevation());
    assertEquals(Instant.parse("2024-06-01T12:01:00.500Z"), points.get(1).time());
  }

  @Test
  void prefixedElementsAreRecognised() throws Exception {
    Path gpx = write("""
        <g:gpx xmlns:g="http://www.topografix.com/GPX/1/0">
          <g:trk><g:trkseg>
            <g:trkpt lat="1" lon="2"><g:time>2024-06-01T12:00:00+02:00</g:time></g:trkpt>
          </g:trkseg></g:trk>
        </g:gpx>
        """);

    List<TimestampedPoint> points = new GpxTrackReader(gpx).read();

    assertEquals(1, points.size());
    assertEquals(Instant.parse("2024-06-01T10:00:00Z"), points.get(0).time());
  }

  @Test
  void pointsWithoutTimeAreSkipped() throws Exception {
    Path gpx = write("""
        <gpx><trk><trkseg>
          <trkpt lat="1" lon="2"/>
          <trkpt lat="3" lon="4"><time>2024-06-01T12:00:00Z</time></trkpt>
        </trkseg></trk></gpx>
        """);

    List<TimestampedPoint> points = new GpxTrackReader(gpx).read();

    assertEquals(1, points.size());
    assertEquals(3d, points.get(0).position().latitude(), 1e-9);
  }

  @Test
  void waypointsAndRoutesAreIgnored() throws Exception {
    Path gpx = write("""
        <gpx>
          <wpt lat="9" lon="9"><time>2024-06-01T11:00:00Z</time></wpt>
          <trk><trkseg><trkpt lat="1" lon="2"><time>2024-06-01T12:00:00Z</time></trkpt></trkseg></trk>
        </gpx>
        """);

    assertEquals(1, new GpxTrackReader(gpx).read().size());
  }

  @Test
  void malformedXmlIsIoError() throws Exception {
    Path gpx = write("<gpx><trk><trkseg><trkpt lat=\"1\" lon=\"2\">");

    IOException ex = assertThrows(IOException.class, () -> new GpxTrackReader(gpx).read());
    assertTrue(ex.getMessage().startsWith("Malformed GPX file"));
  }

  @Test
  void badCoordinateIsIoError() throws Exception {
    Path gpx = write("""
        <gpx><trk><trkseg>
          <trkpt lat="north" lon="2"><time>2024-06-01T12:00:00Z</time></trkpt>
        </trkseg></trk></gpx>
        """);

    assertThrows(IOException.class, () -> new GpxTrackReader(gpx).read());
  }

  @Test
  void outOfRangeCoordinateIsIoError() throws Exception {
    Path gpx = write("""
        <gpx><trk><trkseg>
          <trkpt lat="95" lon="2"><time>2024-06-01T12:00:00Z</time></trkpt>
        </trkseg></trk></gpx>
        """);

    assertThrows(IOException.class, () -> new GpxTrackReader(gpx).read());
  }

  @Test
  void missingFileIsIoError() {
    assertThrows(IOException.class, () -> new GpxTrackReader(dir.resolve("absent.gpx")).read());
  }

  @Test
  void timeWithoutOffsetIsTreatedAsUtc() throws Exception {
    assertEquals(Instant.parse("2024-06-01T12:00:00Z"), GpxTrackReader.parseTime(" 2024-06-01T12:00:00 "));
    assertThrows(IOException.class, () -> GpxTrackReader.parseTime("noon"));
  }

  private Path write(String content) throws IOException {
    Path file = dir.resolve("track.gpx");
    Files.writeString(file, content, StandardCharsets.UTF_8);
    return file;
  }
}
