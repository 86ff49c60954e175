package ca.gc.cra.geotag.infrastructure.metadata;

import ca.gc.cra.geotag.application.port.MetadataStore;
import ca.gc.cra.geotag.domain.item.TagValue;
import ca.gc.cra.geotag.domain.item.WorkItem;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Heap-backed {@link MetadataStore} used by {@code plan} dry runs and tests.
 * <p>Identities can be marked read-only, in which case {@link #commit(WorkItem)} reports rejection.</p>
 *
 * @since 0.1.0
 */
public final class InMemoryMetadataStore implements MetadataStore {
  private final Map<String, Map<String, TagValue>> photos = new ConcurrentHashMap<>();
  private final Set<String> readOnly = ConcurrentHashMap.newKeySet();
  private final AtomicInteger commits = new AtomicInteger();

  public InMemoryMetadataStore() {}

  /**
   * Creates a store seeded with photos.
   *
   * @param initial identity to tag map; copied
   */
  public InMemoryMetadataStore(Map<String, Map<String, TagValue>> initial) {
    initial.forEach(this::put);
  }

  /**
   * Adds or replaces one photo.
   *
   * @param identity photo identity
   * @param tags tag values; copied
   */
  public void put(String identity, Map<String, TagValue> tags) {
    photos.put(Objects.requireNonNull(identity, "identity"), Map.copyOf(tags));
  }

  /**
   * Makes later commits for {@code identity} fail with a {@code false} result.
   *
   * @param identity photo identity
   */
  public void markReadOnly(String identity) {
    readOnly.add(identity);
  }

  @Override
  public SortedSet<String> identities() {
    return new TreeSet<>(photos.keySet());
  }

  @Override
  public Map<String, TagValue> load(String identity) {
    return photos.getOrDefault(identity, Map.of());
  }

  @Override
  public boolean commit(WorkItem item) {
    if (!item.isDirty()) {
      return true;
    }
    if (readOnly.contains(item.identity())) {
      return false;
    }
    photos.put(item.identity(), Map.copyOf(item.metadata()));
    commits.incrementAndGet();
    item.markClean();
    return true;
  }

  /**
   * Returns the stored tags for a photo.
   *
   * @param identity photo identity
   * @return stored tags; empty when unknown
   */
  public Map<String, TagValue> snapshot(String identity) {
    return load(identity);
  }

  public int commitCount() {
    return commits.get();
  }
}
