package io.fairway.platform.security;

import java.util.Locale;

/**
 * Centralized role constants. Tenant roles arrive as the {@code roles} claim resolved by the
 * {@link IdentityAdapter}; Spring authorities are the {@code ROLE_} prefixed versions used by
 * {@code @PreAuthorize}.
 */
public final class Roles {

  // Tenant roles
  public static final String OWNER = "owner";
  public static final String ADMIN = "admin";
  public static final String BILLING = "billing";
  public static final String MEMBER = "member";

  /** Holds PARENT_CHAIN-scoped permissions over direct child tenants. */
  public static final String CHAIN_ADMIN = "chain-admin";

  /** Platform operator; manages tenants across the whole installation. */
  public static final String PLATFORM_ADMIN = "platform-admin";

  public static final String SYSTEM = "system";

  // Spring Security granted authorities
  public static final String AUTHORITY_OWNER = "ROLE_OWNER";
  public static final String AUTHORITY_ADMIN = "ROLE_ADMIN";
  public static final String AUTHORITY_BILLING = "ROLE_BILLING";
  public static final String AUTHORITY_MEMBER = "ROLE_MEMBER";
  public static final String AUTHORITY_CHAIN_ADMIN = "ROLE_CHAIN_ADMIN";
  public static final String AUTHORITY_PLATFORM_ADMIN = "ROLE_PLATFORM_ADMIN";

  private Roles() {}

  /** Spring authority of a tenant role: {@code chain-admin} becomes {@code ROLE_CHAIN_ADMIN}. */
  public static String authorityOf(String role) {
    return "ROLE_" + role.toUpperCase(Locale.ROOT).replace('-', '_');
  }
}
