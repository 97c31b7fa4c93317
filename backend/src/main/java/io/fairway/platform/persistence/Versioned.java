package io.fairway.platform.persistence;

/**
 * A record stored with optimistic concurrency control. The store hands out copies; a write whose
 * version no longer matches the stored one is rejected with {@link StaleVersionException}.
 */
public interface Versioned<T extends Versioned<T>> {

  long getVersion();

  /** Called by the store only. */
  void assignVersion(long version);

  /** Deep enough copy that mutating the result never changes stored state. */
  T copy();
}
