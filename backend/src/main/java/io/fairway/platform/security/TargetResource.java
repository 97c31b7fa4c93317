package io.fairway.platform.security;

/**
 * A resource a request wants to touch, as resolved from storage.
 *
 * @param type kind of resource
 * @param id resource id, for logging and audit
 * @param owningTenantId tenant the resource belongs to
 * @param ownerUserId user the resource belongs to, when it belongs to one; consulted for
 *     {@link PermissionScope#SELF} permissions
 */
public record TargetResource(
    ResourceType type, String id, String owningTenantId, String ownerUserId) {

  public static TargetResource of(ResourceType type, Object id, Object owningTenantId) {
    return ownedBy(type, id, owningTenantId, null);
  }

  public static TargetResource ownedBy(
      ResourceType type, Object id, Object owningTenantId, String ownerUserId) {
    return new TargetResource(
        type,
        String.valueOf(id),
        owningTenantId != null ? owningTenantId.toString() : null,
        ownerUserId);
  }

  public String describe() {
    return type.label() + " " + id;
  }
}
