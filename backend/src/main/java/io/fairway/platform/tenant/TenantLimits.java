package io.fairway.platform.tenant;

import java.util.ArrayList;
import java.util.List;

/**
 * Resource ceilings of a tenant. A child tenant's limits never exceed its parent's.
 *
 * @param maxUsers seats
 * @param maxStorageBytes stored data
 * @param maxApiCallsPerMonth metered API calls per calendar month
 * @param maxCustomDomains white-label domains
 * @param maxChildTenants child locations (chains only)
 */
public record TenantLimits(
    int maxUsers,
    long maxStorageBytes,
    long maxApiCallsPerMonth,
    int maxCustomDomains,
    int maxChildTenants) {

  private static final long GIB = 1024L * 1024L * 1024L;

  public static final TenantLimits INDIVIDUAL = new TenantLimits(1, GIB, 5_000, 0, 0);
  public static final TenantLimits GOLF_COURSE = new TenantLimits(25, 50 * GIB, 100_000, 1, 0);
  public static final TenantLimits ENTERPRISE_CHAIN =
      new TenantLimits(1_000, 500 * GIB, 1_000_000, 10, 50);

  public TenantLimits {
    if (maxUsers < 0
        || maxStorageBytes < 0
        || maxApiCallsPerMonth < 0
        || maxCustomDomains < 0
        || maxChildTenants < 0) {
      throw new IllegalArgumentException("Tenant limits must be non-negative");
    }
  }

  /** Default limits for a new child location of a tenant with these limits. */
  public TenantLimits childDefault() {
    return new TenantLimits(
        maxUsers / 5, maxStorageBytes / 10, maxApiCallsPerMonth / 10, 0, 0);
  }

  /** Returns the names of the limits that exceed {@code ceiling}; empty when they all fit. */
  public List<String> exceeding(TenantLimits ceiling) {
    var exceeded = new ArrayList<String>();
    if (maxUsers > ceiling.maxUsers) {
      exceeded.add("maxUsers");
    }
    if (maxStorageBytes > ceiling.maxStorageBytes) {
      exceeded.add("maxStorageBytes");
    }
    if (maxApiCallsPerMonth > ceiling.maxApiCallsPerMonth) {
      exceeded.add("maxApiCallsPerMonth");
    }
    if (maxCustomDomains > ceiling.maxCustomDomains) {
      exceeded.add("maxCustomDomains");
    }
    if (maxChildTenants > ceiling.maxChildTenants) {
      exceeded.add("maxChildTenants");
    }
    return exceeded;
  }

  public boolean fitsWithin(TenantLimits ceiling) {
    return exceeding(ceiling).isEmpty();
  }
}
