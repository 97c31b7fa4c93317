package io.fairway.platform.multitenancy;

import io.fairway.platform.exception.MissingTenantContextException;
import io.fairway.platform.security.ResolvedIdentity;
import java.util.function.Supplier;

/**
 * Request-scoped identity holder. Bound by {@link TenantFilter}, read by controllers and services,
 * always cleared when the request (or {@link #callAs} block) exits.
 */
public final class TenantContext {

  private static final ThreadLocal<ResolvedIdentity> CURRENT = new ThreadLocal<>();

  private TenantContext() {}

  public static void bind(ResolvedIdentity identity) {
    CURRENT.set(identity);
  }

  public static void clear() {
    CURRENT.remove();
  }

  /** Returns the current identity. Throws if not bound by the filter chain. */
  public static ResolvedIdentity requireIdentity() {
    var identity = CURRENT.get();
    if (identity == null || identity.tenantId() == null) {
      throw new MissingTenantContextException();
    }
    return identity;
  }

  public static String requireTenantId() {
    return requireIdentity().tenantId();
  }

  /** Returns the current tenant id, or null if not bound. */
  public static String getTenantIdOrNull() {
    var identity = CURRENT.get();
    return identity != null ? identity.tenantId() : null;
  }

  public static ResolvedIdentity getIdentityOrNull() {
    return CURRENT.get();
  }

  /**
   * Runs {@code work} with {@code identity} bound, restoring whatever was bound before. Used by
   * scheduled jobs and worker threads, which never inherit the request thread's binding.
   */
  public static <T> T callAs(ResolvedIdentity identity, Supplier<T> work) {
    var previous = CURRENT.get();
    CURRENT.set(identity);
    try {
      return work.get();
    } finally {
      if (previous != null) {
        CURRENT.set(previous);
      } else {
        CURRENT.remove();
      }
    }
  }

  public static void runAs(ResolvedIdentity identity, Runnable work) {
    callAs(
        identity,
        () -> {
          work.run();
          return null;
        });
  }
}
