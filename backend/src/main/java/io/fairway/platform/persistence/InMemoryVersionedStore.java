package io.fairway.platform.persistence;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Predicate;

/**
 * Versioned record store backing the in-memory repositories. Writes are atomic per key through
 * {@link ConcurrentHashMap#compute}; records with different keys never contend.
 */
public class InMemoryVersionedStore<K, T extends Versioned<T>> {

  private final String entityType;
  private final Map<K, T> records = new ConcurrentHashMap<>();

  public InMemoryVersionedStore(String entityType) {
    this.entityType = entityType;
  }

  /**
   * Inserts or updates {@code entity}. A new record starts at version 1; an update must carry the
   * version it was read at. On success the caller's instance receives the new version.
   */
  public T save(K key, T entity) {
    T stored =
        records.compute(
            key,
            (k, existing) -> {
              long current = existing != null ? existing.getVersion() : 0L;
              if (current != entity.getVersion()) {
                throw new StaleVersionException(entityType, k, entity.getVersion(), current);
              }
              T snapshot = entity.copy();
              snapshot.assignVersion(current + 1);
              return snapshot;
            });
    entity.assignVersion(stored.getVersion());
    return entity;
  }

  public Optional<T> find(K key) {
    return Optional.ofNullable(records.get(key)).map(Versioned::copy);
  }

  public List<T> findAll(Predicate<T> predicate) {
    return records.values().stream().filter(predicate).map(Versioned::copy).toList();
  }

  public Collection<K> keys() {
    return List.copyOf(records.keySet());
  }

  public int size() {
    return records.size();
  }
}
