package ca.gc.cra.geotag.domain.item;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Objects;
import java.util.Optional;

/**
 * Converts the camera-local capture time of a photo to UTC.
 *
 * @since 0.1.0
 */
public final class PhotoTime {
  /** Text layout cameras use for {@link Tags#DATE_TIME_ORIGINAL}. */
  public static final DateTimeFormatter EXIF_FORMAT = DateTimeFormatter.ofPattern("yyyy:MM:dd HH:mm:ss");

  private PhotoTime() {}

  /**
   * Reads the capture time of {@code item}.
   *
   * @param item photo item
   * @return camera-local date-time
   * @throws ItemProcessingException if the tag is missing or malformed
   */
  public static LocalDateTime localCaptureTime(WorkItem item) {
    TagValue value = item.get(Tags.DATE_TIME_ORIGINAL)
        .orElseThrow(() -> new ItemProcessingException(item.identity(), "missing " + Tags.DATE_TIME_ORIGINAL));
    if (value instanceof TagValue.Timestamp ts) {
      return ts.value();
    }
    if (value instanceof TagValue.Text text) {
      try {
        return LocalDateTime.parse(text.value().trim(), EXIF_FORMAT);
      } catch (DateTimeParseException ex) {
        throw new ItemProcessingException(
            item.identity(), "malformed " + Tags.DATE_TIME_ORIGINAL + ": " + text.value(), ex);
      }
    }
    throw new ItemProcessingException(item.identity(), Tags.DATE_TIME_ORIGINAL + " has unexpected type");
  }

  /**
   * Reads the capture time when present and well formed.
   *
   * @param item photo item
   * @return camera-local date-time, or empty when the tag is missing or unparseable
   */
  public static Optional<LocalDateTime> findLocalCaptureTime(WorkItem item) {
    Optional<TagValue> value = item.get(Tags.DATE_TIME_ORIGINAL);
    if (value.isEmpty()) {
      return Optional.empty();
    }
    if (value.get() instanceof TagValue.Timestamp ts) {
      return Optional.of(ts.value());
    }
    if (value.get() instanceof TagValue.Text text) {
      try {
        return Optional.of(LocalDateTime.parse(text.value().trim(), EXIF_FORMAT));
      } catch (DateTimeParseException ex) {
        return Optional.empty();
      }
    }
    return Optional.empty();
  }

  /**
   * Returns the UTC capture instant.
   *
   * @param item photo item
   * @param zone zone the camera clock was set to
   * @param cameraOffset how far the camera clock runs ahead of true time; subtracted
   * @return corrected UTC instant
   * @throws ItemProcessingException if the tag is missing or malformed
   */
  public static Instant utcInstant(WorkItem item, ZoneId zone, Duration cameraOffset) {
    Objects.requireNonNull(zone, "zone");
    Objects.requireNonNull(cameraOffset, "cameraOffset");
    return localCaptureTime(item).atZone(zone).toInstant().minus(cameraOffset);
  }
}
