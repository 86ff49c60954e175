package ca.gc.cra.geotag.infrastructure.gpx;

import ca.gc.cra.geotag.application.port.TrackSource;
import ca.gc.cra.geotag.domain.geo.Position;
import ca.gc.cra.geotag.domain.geo.TimestampedPoint;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import javax.xml.stream.XMLInputFactory;
import javax.xml.stream.XMLStreamConstants;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link TrackSource} reading {@code trkpt} samples from a GPX 1.0 or 1.1 file.
 * <p><strong>Role:</strong> Infrastructure adapter used by the composition root when {@code gpx} is configured.</p>
 * <p><strong>Behavior:</strong> Namespaces are ignored, so both schema versions parse. A sample without a
 * {@code <time>} child cannot be correlated and is skipped; times without an offset are read as UTC.
 * Malformed coordinates, elevations or times fail the whole read.</p>
 * <p><strong>Thread-safety:</strong> Stateless apart from the immutable path; safe to share.</p>
 *
 * @since 0.1.0
 */
public final class GpxTrackReader implements TrackSource {
  private static final Logger log = LoggerFactory.getLogger(GpxTrackReader.class);

  private final Path file;
  private final XMLInputFactory factory;

  /**
   * Creates a reader for the given GPX file.
   *
   * @param file GPX file path
   */
  public GpxTrackReader(Path file) {
    this.file = Objects.requireNonNull(file, "file");
    this.factory = XMLInputFactory.newFactory();
    factory.setProperty(XMLInputFactory.IS_NAMESPACE_AWARE, false);
    factory.setProperty(XMLInputFactory.SUPPORT_DTD, false);
    factory.setProperty(XMLInputFactory.IS_SUPPORTING_EXTERNAL_ENTITIES, false);
  }

  @Override
  public List<TimestampedPoint> read() throws IOException {
    try (InputStream in = Files.newInputStream(file)) {
      XMLStreamReader reader = factory.createXMLStreamReader(in);
      try {
        List<TimestampedPoint> points = parse(reader);
        log.info("Read {} track points from {}", points.size(), file);
        return points;
      } finally {
        reader.close();
      }
    } catch (XMLStreamException ex) {
      throw new IOException("Malformed GPX file " + file + ": " + ex.getMessage(), ex);
    }
  }

  private List<TimestampedPoint> parse(XMLStreamReader reader) throws XMLStreamException, IOException {
    List<TimestampedPoint> points = new ArrayList<>();
    int skipped = 0;
    PointBuilder current = null;
    while (reader.hasNext()) {
      int event = reader.next();
      if (event == XMLStreamConstants.START_ELEMENT) {
        String name = localName(reader.getLocalName());
        if ("trkpt".equals(name)) {
          current = new PointBuilder(
              parseDouble("lat", reader.getAttributeValue(null, "lat")),
              parseDouble("lon", reader.getAttributeValue(null, "lon")));
        } else if (current != null && "ele".equals(name)) {
          current.elevation = parseDouble("ele", reader.getElementText());
        } else if (current != null && "time".equals(name)) {
          current.time = parseTime(reader.getElementText());
        }
      } else if (event == XMLStreamConstants.END_ELEMENT && current != null
          && "trkpt".equals(localName(reader.getLocalName()))) {
        if (current.time == null) {
          skipped++;
        } else {
          points.add(current.build());
        }
        current = null;
      }
    }
    if (skipped > 0) {
      log.warn("Skipped {} track points without a timestamp in {}", skipped, file);
    }
    return points;
  }

  private static String localName(String name) {
    int colon = name.indexOf(':');
    return colon < 0 ? name : name.substring(colon + 1);
  }

  private double parseDouble(String field, String raw) throws IOException {
    if (raw == null || raw.isBlank()) {
      throw new IOException("GPX trkpt missing " + field + " in " + file);
    }
    try {
      return Double.parseDouble(raw.trim());
    } catch (NumberFormatException ex) {
      throw new IOException("GPX trkpt has invalid " + field + " '" + raw.trim() + "' in " + file, ex);
    }
  }

  static Instant parseTime(String raw) throws IOException {
    String text = raw == null ? "" : raw.trim();
    try {
      TemporalAccessor parsed =
          DateTimeFormatter.ISO_DATE_TIME.parseBest(text, OffsetDateTime::from, LocalDateTime::from);
      if (parsed instanceof OffsetDateTime offset) {
        return offset.toInstant();
      }
      return ((LocalDateTime) parsed).toInstant(ZoneOffset.UTC);
    } catch (DateTimeParseException ex) {
      throw new IOException("GPX trkpt has invalid time '" + text + "'", ex);
    }
  }

  private static final class PointBuilder {
    private final double latitude;
    private final double longitude;
    private Double elevation;
    private Instant time;

    private PointBuilder(double latitude, double longitude) {
      this.latitude = latitude;
      this.longitude = longitude;
    }

    private TimestampedPoint build() throws IOException {
      try {
        return new TimestampedPoint(time, new Position(latitude, longitude, elevation));
      } catch (IllegalArgumentException ex) {
        throw new IOException("GPX trkpt out of range: " + ex.getMessage(), ex);
      }
    }
  }
}
