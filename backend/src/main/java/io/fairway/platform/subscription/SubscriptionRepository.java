package io.fairway.platform.subscription;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface SubscriptionRepository {

  /**
   * Stores a new subscription unless the customer already holds a live (ACTIVE or PAUSED) one in
   * the same tier family. Returns false, storing nothing, in that case.
   */
  boolean insertLive(Subscription subscription);

  Subscription save(Subscription subscription);

  Optional<Subscription> findById(UUID id);

  List<Subscription> findByTenantId(String tenantId);

  List<Subscription> findByCustomerId(UUID customerId);

  /** ACTIVE subscriptions whose renewal is due at {@code at}, across all tenants. */
  List<Subscription> findDueForRenewal(Instant at);

  /** PAUSED subscriptions whose pause has run out at {@code at}. */
  List<Subscription> findExpiredPauses(Instant at);

  List<Subscription> findAll();
}
