package io.fairway.platform.security;

/** How far a permission reaches. */
public enum PermissionScope {
  /** Only resources owned by the acting user. */
  SELF,
  /** Any resource of the user's own tenant. */
  TENANT,
  /** Resources of the direct child tenants of the user's tenant. */
  PARENT_CHAIN
}
