package io.fairway.platform.subscription;

import io.fairway.platform.persistence.InMemoryVersionedStore;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import org.springframework.stereotype.Repository;

@Repository
public class InMemorySubscriptionRepository implements SubscriptionRepository {

  private record FamilyKey(String tenantId, UUID customerId, String family) {}

  private static final Comparator<Subscription> OLDEST_FIRST =
      Comparator.comparing(Subscription::getCreatedAt).thenComparing(Subscription::getId);

  private final InMemoryVersionedStore<UUID, Subscription> store =
      new InMemoryVersionedStore<>("Subscription");

  /** Live subscription per (tenant, customer, family). Entries leave the index on cancel. */
  private final Map<FamilyKey, UUID> liveIndex = new ConcurrentHashMap<>();

  @Override
  public boolean insertLive(Subscription subscription) {
    var key = keyOf(subscription);
    if (liveIndex.putIfAbsent(key, subscription.getId()) != null) {
      return false;
    }
    store.save(subscription.getId(), subscription);
    return true;
  }

  @Override
  public Subscription save(Subscription subscription) {
    var saved = store.save(subscription.getId(), subscription);
    if (!saved.getStatus().isLive()) {
      liveIndex.remove(keyOf(saved), saved.getId());
    }
    return saved;
  }

  @Override
  public Optional<Subscription> findById(UUID id) {
    return store.find(id);
  }

  @Override
  public List<Subscription> findByTenantId(String tenantId) {
    return sorted(store.findAll(s -> s.getTenantId().equals(tenantId)));
  }

  @Override
  public List<Subscription> findByCustomerId(UUID customerId) {
    return sorted(store.findAll(s -> s.getCustomerId().equals(customerId)));
  }

  @Override
  public List<Subscription> findDueForRenewal(Instant at) {
    return sorted(store.findAll(s -> s.isDueForRenewal(at)));
  }

  @Override
  public List<Subscription> findExpiredPauses(Instant at) {
    return sorted(
        store.findAll(
            s ->
                s.getStatus() == SubscriptionStatus.PAUSED
                    && s.getPausedUntil() != null
                    && !s.getPausedUntil().isAfter(at)));
  }

  @Override
  public List<Subscription> findAll() {
    return sorted(store.findAll(s -> true));
  }

  private static FamilyKey keyOf(Subscription s) {
    return new FamilyKey(s.getTenantId(), s.getCustomerId(), s.getTierFamily());
  }

  private static List<Subscription> sorted(List<Subscription> subscriptions) {
    return subscriptions.stream().sorted(OLDEST_FIRST).toList();
  }
}
