package io.fairway.platform.security;

import io.fairway.platform.audit.AuditEventBuilder;
import io.fairway.platform.audit.AuditService;
import io.fairway.platform.exception.CrossTenantViolationException;
import io.fairway.platform.exception.ForbiddenException;
import io.fairway.platform.multitenancy.TenantContext;
import io.fairway.platform.tenant.TenantRegistry;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Enforces tenant boundaries and the role permission catalogue. A request may touch a resource
 * only when the resource belongs to the requester's own tenant, or when the requester holds a
 * {@link PermissionScope#PARENT_CHAIN} permission for it and the owning tenant is a direct child of
 * the requester's tenant.
 *
 * <p>Inside the own tenant the requester's effective roles (token roles plus assigned roles) must
 * grant the action with {@link PermissionScope#TENANT} scope, or with {@link PermissionScope#SELF}
 * scope on a resource owned by the requesting user; otherwise {@link ForbiddenException} is
 * thrown.
 *
 * <p>Every cross-tenant denial is logged with both tenant ids and written to the audit trail before
 * {@link CrossTenantViolationException} is thrown. Denials are never reported as not-found.
 */
@Component
public class IsolationGuard {

  private static final Logger log = LoggerFactory.getLogger(IsolationGuard.class);

  private final TenantRegistry tenantRegistry;
  private final PermissionCatalog permissionCatalog;
  private final RoleAssignmentRepository roleAssignmentRepository;
  private final AuditService auditService;

  public IsolationGuard(
      TenantRegistry tenantRegistry,
      PermissionCatalog permissionCatalog,
      RoleAssignmentRepository roleAssignmentRepository,
      AuditService auditService) {
    this.tenantRegistry = tenantRegistry;
    this.permissionCatalog = permissionCatalog;
    this.roleAssignmentRepository = roleAssignmentRepository;
    this.auditService = auditService;
  }

  /** Validates {@code target} against the identity bound to the current request. */
  public void validateBoundary(TargetResource target, Action action) {
    validateBoundary(TenantContext.requireIdentity(), target, action);
  }

  public void validateBoundary(ResolvedIdentity requester, TargetResource target, Action action) {
    if (requester.tenantId() != null && requester.tenantId().equals(target.owningTenantId())) {
      authorizeWithinTenant(requester, target, action);
      return;
    }
    if (target.owningTenantId() != null
        && permissionCatalog.permits(
            effectiveRoles(requester), target.type(), action, PermissionScope.PARENT_CHAIN)
        && tenantRegistry.isDirectChild(requester.tenantId(), target.owningTenantId())) {
      log.debug(
          "Chain access granted: tenant={} reaches child={} for {} {}",
          requester.tenantId(),
          target.owningTenantId(),
          action,
          target.describe());
      return;
    }
    deny(requester, target, action);
  }

  /**
   * Non-throwing read check used to filter collections. Inside the own tenant a SELF-scoped
   * permission is enough, since the caller narrows the collection to the user's own items.
   */
  public boolean canAccess(ResolvedIdentity requester, String owningTenantId, ResourceType type) {
    if (requester.tenantId() != null && requester.tenantId().equals(owningTenantId)) {
      var roles = effectiveRoles(requester);
      return permissionCatalog.permits(roles, type, Action.READ, PermissionScope.TENANT)
          || permissionCatalog.permits(roles, type, Action.READ, PermissionScope.SELF);
    }
    return permissionCatalog.permits(
            effectiveRoles(requester), type, Action.READ, PermissionScope.PARENT_CHAIN)
        && tenantRegistry.isDirectChild(requester.tenantId(), owningTenantId);
  }

  /** Roles carried by the identity plus those assigned to the user inside their tenant. */
  public Set<String> effectiveRoles(ResolvedIdentity identity) {
    var roles = new HashSet<>(identity.roles());
    if (identity.userId() != null && identity.tenantId() != null) {
      roles.addAll(roleAssignmentRepository.findRoles(identity.userId(), identity.tenantId()));
    }
    return roles;
  }

  private void authorizeWithinTenant(
      ResolvedIdentity requester, TargetResource target, Action action) {
    var roles = effectiveRoles(requester);
    if (permissionCatalog.permits(roles, target.type(), action, PermissionScope.TENANT)) {
      return;
    }
    boolean ownResource =
        target.ownerUserId() != null && target.ownerUserId().equals(requester.userId());
    if (ownResource
        && permissionCatalog.permits(roles, target.type(), action, PermissionScope.SELF)) {
      return;
    }
    log.info(
        "Permission denied: tenant={}, user={}, roles={}, action={}, resource={}",
        requester.tenantId(),
        requester.userId(),
        roles,
        action,
        target.describe());
    auditService.log(
        AuditEventBuilder.builder()
            .eventType("security.permission_denied")
            .entityType(target.type().label())
            .entityId(target.id())
            .tenantId(requester.tenantId())
            .actorId(requester.userId())
            .details(Map.of("action", action.name(), "roles", String.join(",", roles)))
            .build());
    throw new ForbiddenException(
        "Insufficient permissions",
        "Your roles do not allow " + action.name().toLowerCase() + " on " + target.describe());
  }

  private void deny(ResolvedIdentity requester, TargetResource target, Action action) {
    log.warn(
        "Cross-tenant access denied: requestingTenant={}, owningTenant={}, user={}, action={},"
            + " resource={}",
        requester.tenantId(),
        target.owningTenantId(),
        requester.userId(),
        action,
        target.describe());

    var details = new LinkedHashMap<String, Object>();
    details.put("requestingTenantId", String.valueOf(requester.tenantId()));
    details.put("owningTenantId", String.valueOf(target.owningTenantId()));
    details.put("resourceType", target.type().label());
    details.put("action", action.name());
    auditService.log(
        AuditEventBuilder.builder()
            .eventType("security.cross_tenant_violation")
            .entityType(target.type().label())
            .entityId(target.id())
            .tenantId(requester.tenantId())
            .actorId(requester.userId())
            .details(details)
            .build());

    throw new CrossTenantViolationException(
        requester.tenantId(), target.owningTenantId(), target.describe());
  }
}
