package io.fairway.platform.subscription;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import io.fairway.platform.tenant.Tenant;
import io.fairway.platform.tenant.TenantRepository;
import io.fairway.platform.usage.QuotaLimitResolver;
import io.fairway.platform.usage.QuotaType;
import io.fairway.platform.usage.UsageAllowance;
import java.time.Duration;
import java.util.Comparator;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.UUID;
import org.springframework.stereotype.Component;

/**
 * Quota ceilings from the tenant's metered plan. The plan is the most recently created ACTIVE or
 * PAUSED subscription of the tenant whose tier carries a usage allowance; it is also the only
 * subscription that tenant usage overage is billed on. Tenants without one fall
 * back to their own resource limits for calls and storage; their bandwidth is unmetered.
 *
 * <p>The metered tier per tenant is cached briefly; subscription changes evict it.
 */
@Component
public class TierQuotaLimitResolver implements QuotaLimitResolver {

  private final SubscriptionRepository subscriptionRepository;
  private final TierCatalog tierCatalog;
  private final TenantRepository tenantRepository;

  private final Cache<String, Optional<Tier>> meteredTiers =
      Caffeine.newBuilder().maximumSize(10_000).expireAfterWrite(Duration.ofSeconds(30)).build();

  public TierQuotaLimitResolver(
      SubscriptionRepository subscriptionRepository,
      TierCatalog tierCatalog,
      TenantRepository tenantRepository) {
    this.subscriptionRepository = subscriptionRepository;
    this.tierCatalog = tierCatalog;
    this.tenantRepository = tenantRepository;
  }

  @Override
  public long limit(String tenantId, QuotaType quotaType) {
    var allowance = allowance(tenantId);
    if (allowance.isPresent()) {
      return allowance.get().included(quotaType);
    }
    var tenant = findTenant(tenantId);
    if (tenant.isEmpty()) {
      return 0L;
    }
    var limits = tenant.get().getLimits();
    return switch (quotaType) {
      case API_CALLS -> limits.maxApiCallsPerMonth();
      case STORAGE -> limits.maxStorageBytes();
      case BANDWIDTH -> Long.MAX_VALUE;
    };
  }

  @Override
  public Optional<UsageAllowance> allowance(String tenantId) {
    return meteredTier(tenantId).map(Tier::allowance);
  }

  @Override
  public OptionalInt rateLimit(String tenantId) {
    return meteredTier(tenantId)
        .map(Tier::rateLimitPerMinute)
        .map(OptionalInt::of)
        .orElse(OptionalInt.empty());
  }

  public void evict(String tenantId) {
    meteredTiers.invalidate(tenantId);
  }

  /** The subscription carrying the tenant's metered plan, read past the cache. */
  public Optional<Subscription> meteredSubscription(String tenantId) {
    return subscriptionRepository.findByTenantId(tenantId).stream()
        .filter(s -> s.getStatus().isLive())
        .filter(s -> tierCatalog.find(s.getTierId()).filter(Tier::isMetered).isPresent())
        .max(
            Comparator.comparing(Subscription::getCreatedAt)
                .thenComparing(s -> s.getId().toString()));
  }

  private Optional<Tier> meteredTier(String tenantId) {
    Optional<Tier> cached = meteredTiers.getIfPresent(tenantId);
    if (cached != null) {
      return cached;
    }
    Optional<Tier> tier =
        meteredSubscription(tenantId).flatMap(s -> tierCatalog.find(s.getTierId()));
    meteredTiers.put(tenantId, tier);
    return tier;
  }

  private Optional<Tenant> findTenant(String tenantId) {
    try {
      return tenantRepository.findById(UUID.fromString(tenantId));
    } catch (IllegalArgumentException e) {
      return Optional.empty();
    }
  }
}
