package io.fairway.platform.usage;

import java.util.Optional;
import java.util.OptionalInt;

/**
 * Source of per-tenant quota ceilings. Implemented outside this package so the meter does not
 * depend on how plans are sold.
 */
public interface QuotaLimitResolver {

  /** Ceiling for {@code quotaType}; never negative. */
  long limit(String tenantId, QuotaType quotaType);

  /** Allowance and overage rates of the tenant's metered plan, if it has one. */
  Optional<UsageAllowance> allowance(String tenantId);

  /** Requests per rate-limit window granted by the tenant's plan, if it sets one. */
  OptionalInt rateLimit(String tenantId);
}
