package io.fairway.platform.security;

import io.fairway.platform.audit.AuditEventBuilder;
import io.fairway.platform.audit.AuditService;
import io.fairway.platform.exception.InvalidRequestException;
import io.fairway.platform.exception.ResourceConflictException;
import io.fairway.platform.exception.ResourceNotFoundException;
import io.fairway.platform.tenant.Tenant;
import io.fairway.platform.tenant.TenantRegistry;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/** Grants and revokes tenant roles held in addition to those carried by the identity token. */
@Service
public class RoleAssignmentService {

  private static final Logger log = LoggerFactory.getLogger(RoleAssignmentService.class);

  private static final Set<String> ASSIGNABLE =
      Set.of(Roles.OWNER, Roles.ADMIN, Roles.BILLING, Roles.MEMBER, Roles.CHAIN_ADMIN);

  private final RoleAssignmentRepository roleAssignmentRepository;
  private final TenantRegistry tenantRegistry;
  private final AuditService auditService;
  private final Clock clock;

  public RoleAssignmentService(
      RoleAssignmentRepository roleAssignmentRepository,
      TenantRegistry tenantRegistry,
      AuditService auditService,
      Clock clock) {
    this.roleAssignmentRepository = roleAssignmentRepository;
    this.tenantRegistry = tenantRegistry;
    this.auditService = auditService;
    this.clock = clock;
  }

  public RoleAssignment assign(UUID tenantId, String userId, String role) {
    var tenant = tenantRegistry.resolveTenant(tenantId);
    if (!ASSIGNABLE.contains(role)) {
      throw new InvalidRequestException("Unknown role", "Role '" + role + "' cannot be assigned");
    }
    if (Roles.CHAIN_ADMIN.equals(role) && !tenant.getType().canHaveChildren()) {
      throw new InvalidRequestException(
          "Invalid role", tenant.getSlug() + " has no child locations to administer");
    }
    var assignment = new RoleAssignment(userId, tenantId.toString(), role, clock.instant());
    if (!roleAssignmentRepository.assign(assignment)) {
      throw new ResourceConflictException(
          "Role already assigned", userId + " already holds " + role + " in " + tenant.getSlug());
    }
    audit(tenant, "role.assigned", userId, role);
    log.info("Assigned role {} to user {} in tenant {}", role, userId, tenantId);
    return assignment;
  }

  public void revoke(UUID tenantId, String userId, String role) {
    var tenant = tenantRegistry.resolveTenant(tenantId);
    if (!roleAssignmentRepository.revoke(userId, tenantId.toString(), role)) {
      throw ResourceNotFoundException.withDetail(
          "Role assignment not found", userId + " does not hold " + role + " in " + tenantId);
    }
    audit(tenant, "role.revoked", userId, role);
    log.info("Revoked role {} from user {} in tenant {}", role, userId, tenantId);
  }

  public List<RoleAssignment> list(UUID tenantId) {
    tenantRegistry.resolveTenant(tenantId);
    return roleAssignmentRepository.findByTenantId(tenantId.toString());
  }

  private void audit(Tenant tenant, String eventType, String userId, String role) {
    auditService.log(
        AuditEventBuilder.builder()
            .eventType(eventType)
            .entityType("role_assignment")
            .entityId(userId)
            .tenantId(tenant.getId().toString())
            .details(Map.of("user_id", userId, "role", role))
            .build());
  }
}
