package ca.gc.cra.geotag.application.port;

import ca.gc.cra.geotag.domain.item.TagValue;
import ca.gc.cra.geotag.domain.item.WorkItem;
import java.io.IOException;
import java.util.Map;
import java.util.SortedSet;

/**
 * <strong>What:</strong> Port to the per-photo metadata store.
 * <p><strong>Role:</strong> The driver enumerates and loads photos through it; the writer stage commits
 * modified items back.</p>
 * <p><strong>Contract:</strong> Tag names are opaque strings. {@code get}/{@code set}/{@code contains} act on the
 * in-flight {@link WorkItem}; {@link #commit(WorkItem)} persists only when the item is dirty.</p>
 * <p><strong>Thread-safety:</strong> {@link #identities()} and {@link #load(String)} run on the driver thread while
 * {@link #commit(WorkItem)} runs on the writer thread; implementations must tolerate that split.</p>
 *
 * @since 0.1.0
 */
public interface MetadataStore {

  /**
   * Lists photo identities known to the store.
   *
   * @return identities in ascending order
   * @throws IOException if the store cannot be enumerated
   */
  SortedSet<String> identities() throws IOException;

  /**
   * Reads the stored tags for one photo.
   *
   * @param identity photo identity
   * @return tag values; empty when the photo has no stored metadata
   * @throws IOException if stored metadata exists but cannot be read
   */
  Map<String, TagValue> load(String identity) throws IOException;

  default boolean contains(WorkItem item, String tag) {
    return item.contains(tag);
  }

  default TagValue get(WorkItem item, String tag) {
    return item.get(tag).orElse(null);
  }

  default void set(WorkItem item, String tag, TagValue value) {
    item.set(tag, value);
  }

  /**
   * Persists the item's tags when it is dirty.
   *
   * @param item item to persist
   * @return {@code true} when the item was clean or persisted successfully; {@code false} when the store rejected it
   * @throws IOException if the write fails
   */
  boolean commit(WorkItem item) throws IOException;
}
