package io.fairway.platform.security;

import java.util.Set;

/**
 * Internal identity produced by the {@link IdentityAdapter} from an already-verified external
 * assertion.
 *
 * @param userId stable user id from the identity provider
 * @param tenantId tenant the user authenticated into
 * @param roles role claims, lower case (see {@link Roles})
 */
public record ResolvedIdentity(String userId, String tenantId, Set<String> roles) {

  public ResolvedIdentity {
    roles = roles == null ? Set.of() : Set.copyOf(roles);
  }

  public boolean hasRole(String role) {
    return roles.contains(role);
  }

  /** Identity used by scheduled jobs acting on behalf of a tenant. */
  public static ResolvedIdentity system(String tenantId) {
    return new ResolvedIdentity("system", tenantId, Set.of(Roles.SYSTEM));
  }
}
