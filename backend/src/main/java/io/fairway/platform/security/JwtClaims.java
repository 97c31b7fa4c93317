package io.fairway.platform.security;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Set;
import org.springframework.security.oauth2.jwt.Jwt;

/**
 * Extracts the tenant and role claims issued by the identity provider.
 *
 * <p>Token format: {@code { "sub": "user_1", "tenant_id": "<uuid>", "roles": ["owner"] }}. A single
 * role may also be issued as a plain string.
 */
public final class JwtClaims {

  public static final String TENANT_CLAIM = "tenant_id";
  public static final String ROLES_CLAIM = "roles";

  /** Extracts the tenant id ({@code tenant_id}), or null when the token carries none. */
  public static String extractTenantId(Jwt jwt) {
    Object claim = jwt.getClaim(TENANT_CLAIM);
    if (claim instanceof String str && !str.isBlank()) {
      return str;
    }
    return null;
  }

  /** Extracts the lower-cased role names ({@code roles}). */
  public static Set<String> extractRoles(Jwt jwt) {
    Object claim = jwt.getClaim(ROLES_CLAIM);
    var roles = new LinkedHashSet<String>();
    if (claim instanceof Collection<?> values) {
      for (Object value : values) {
        if (value instanceof String str && !str.isBlank()) {
          roles.add(str.toLowerCase());
        }
      }
    } else if (claim instanceof String str && !str.isBlank()) {
      roles.add(str.toLowerCase());
    }
    return roles;
  }

  private JwtClaims() {}
}
