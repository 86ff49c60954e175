package ca.gc.cra.geotag.domain.item;

import ca.gc.cra.geotag.domain.geo.Position;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Mutable per-photo record carried through the pipeline.
 * <p><strong>Role:</strong> Unit of work handed from stage to stage through bounded queues.</p>
 * <p><strong>Thread-safety:</strong> Not thread-safe. Exactly one stage owns an item at a time; ownership moves
 * with the queue hand-off, which provides the necessary happens-before edge.</p>
 *
 * @since 0.1.0
 */
public final class WorkItem {
  private final String identity;
  private final Map<String, TagValue> metadata;
  private final Map<ResultField, String> result = new EnumMap<>(ResultField.class);
  private Position position;
  private boolean dirty;

  /**
   * Creates an item with no metadata.
   *
   * @param identity opaque photo key, typically the file name
   */
  public WorkItem(String identity) {
    this(identity, Map.of());
  }

  /**
   * Creates an item seeded with metadata loaded from a store. Seeding does not mark the item dirty.
   *
   * @param identity opaque photo key
   * @param metadata initial tag values; copied
   */
  public WorkItem(String identity, Map<String, TagValue> metadata) {
    this.identity = Objects.requireNonNull(identity, "identity");
    this.metadata = new LinkedHashMap<>(Objects.requireNonNull(metadata, "metadata"));
    this.result.put(ResultField.FILE, identity);
  }

  public String identity() {
    return identity;
  }

  public boolean contains(String tag) {
    return metadata.containsKey(tag);
  }

  /**
   * Reads a tag value.
   *
   * @param tag opaque tag name
   * @return the value when present
   */
  public Optional<TagValue> get(String tag) {
    return Optional.ofNullable(metadata.get(tag));
  }

  /**
   * Writes a tag value and marks the item dirty.
   *
   * @param tag opaque tag name
   * @param value new value; never {@code null}
   */
  public void set(String tag, TagValue value) {
    Objects.requireNonNull(tag, "tag");
    Objects.requireNonNull(value, "value");
    metadata.put(tag, value);
    dirty = true;
  }

  /**
   * Removes a tag, marking the item dirty when it was present.
   *
   * @param tag opaque tag name
   */
  public void remove(String tag) {
    if (metadata.remove(Objects.requireNonNull(tag, "tag")) != null) {
      dirty = true;
    }
  }

  /**
   * Reads a text tag.
   *
   * @param tag opaque tag name
   * @return text when the tag holds the {@link TagValue.Text} variant
   */
  public Optional<String> text(String tag) {
    return get(tag).filter(TagValue.Text.class::isInstance).map(v -> ((TagValue.Text) v).value());
  }

  /**
   * Returns a read-only view of all tags.
   *
   * @return unmodifiable view in insertion order
   */
  public Map<String, TagValue> metadata() {
    return Collections.unmodifiableMap(metadata);
  }

  public boolean isDirty() {
    return dirty;
  }

  /** Clears the dirty flag after a successful commit. */
  public void markClean() {
    dirty = false;
  }

  public Optional<Position> position() {
    return Optional.ofNullable(position);
  }

  /**
   * Records the resolved position and mirrors it into the result record.
   *
   * @param position resolved position; never {@code null}
   */
  public void position(Position position) {
    this.position = Objects.requireNonNull(position, "position");
    result.put(ResultField.LATITUDE, Double.toString(position.latitude()));
    result.put(ResultField.LONGITUDE, Double.toString(position.longitude()));
    if (position.hasElevation()) {
      result.put(ResultField.ELEVATION, Double.toString(position.elevation()));
    } else {
      result.remove(ResultField.ELEVATION);
    }
  }

  /**
   * Sets one result column; {@code null} clears it.
   *
   * @param field column
   * @param value text value or {@code null}
   */
  public void result(ResultField field, String value) {
    Objects.requireNonNull(field, "field");
    if (value == null) {
      result.remove(field);
    } else {
      result.put(field, value);
    }
  }

  /**
   * Returns the result record.
   *
   * @return unmodifiable copy keyed by column
   */
  public Map<ResultField, String> result() {
    return Collections.unmodifiableMap(new EnumMap<>(result));
  }

  @Override
  public String toString() {
    return "WorkItem[" + identity + (dirty ? ", dirty" : "") + "]";
  }
}
