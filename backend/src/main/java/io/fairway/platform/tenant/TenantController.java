package io.fairway.platform.tenant;

import io.fairway.platform.security.Action;
import io.fairway.platform.security.IsolationGuard;
import io.fairway.platform.security.ResourceType;
import io.fairway.platform.security.RoleAssignment;
import io.fairway.platform.security.RoleAssignmentService;
import io.fairway.platform.security.Roles;
import io.fairway.platform.security.TargetResource;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.net.URI;
import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Tenant administration. Onboarding and lifecycle changes are platform operations; a tenant's own
 * owners and admins may read and update it and manage its role assignments.
 */
@RestController
@RequestMapping("/api/admin/tenants")
public class TenantController {

  private final TenantRegistry tenantRegistry;
  private final RoleAssignmentService roleAssignmentService;
  private final IsolationGuard isolationGuard;

  public TenantController(
      TenantRegistry tenantRegistry,
      RoleAssignmentService roleAssignmentService,
      IsolationGuard isolationGuard) {
    this.tenantRegistry = tenantRegistry;
    this.roleAssignmentService = roleAssignmentService;
    this.isolationGuard = isolationGuard;
  }

  @PostMapping
  @PreAuthorize("hasRole('PLATFORM_ADMIN')")
  public ResponseEntity<TenantResponse> create(@Valid @RequestBody CreateTenantRequest request) {
    var tenant = tenantRegistry.createTenant(request);
    return ResponseEntity.created(URI.create("/api/admin/tenants/" + tenant.getId()))
        .body(TenantResponse.from(tenant));
  }

  @GetMapping
  @PreAuthorize("hasRole('PLATFORM_ADMIN')")
  public ResponseEntity<List<TenantResponse>> list() {
    return ResponseEntity.ok(
        tenantRegistry.findAll().stream().map(TenantResponse::from).toList());
  }

  @GetMapping("/slug/{slug}")
  @PreAuthorize("hasRole('PLATFORM_ADMIN')")
  public ResponseEntity<TenantResponse> getBySlug(@PathVariable String slug) {
    return ResponseEntity.ok(TenantResponse.from(tenantRegistry.findBySlug(slug)));
  }

  @GetMapping("/{id}")
  @PreAuthorize(
      "hasAnyRole('PLATFORM_ADMIN', 'OWNER', 'ADMIN', 'BILLING', 'MEMBER', 'CHAIN_ADMIN')")
  public ResponseEntity<TenantResponse> get(@PathVariable UUID id, Authentication authentication) {
    guard(authentication, id, Action.READ);
    return ResponseEntity.ok(TenantResponse.from(tenantRegistry.resolveTenant(id)));
  }

  @GetMapping("/{id}/children")
  @PreAuthorize("hasAnyRole('PLATFORM_ADMIN', 'OWNER', 'ADMIN', 'CHAIN_ADMIN')")
  public ResponseEntity<List<TenantResponse>> children(
      @PathVariable UUID id, Authentication authentication) {
    guard(authentication, id, Action.READ);
    return ResponseEntity.ok(
        tenantRegistry.children(id).stream().map(TenantResponse::from).toList());
  }

  @PutMapping("/{id}")
  @PreAuthorize("hasAnyRole('PLATFORM_ADMIN', 'OWNER', 'ADMIN')")
  public ResponseEntity<TenantResponse> update(
      @PathVariable UUID id,
      @Valid @RequestBody UpdateTenantRequest request,
      Authentication authentication) {
    guard(authentication, id, Action.WRITE);
    return ResponseEntity.ok(TenantResponse.from(tenantRegistry.updateTenant(id, request)));
  }

  @PostMapping("/{id}/activate")
  @PreAuthorize("hasRole('PLATFORM_ADMIN')")
  public ResponseEntity<TenantResponse> activate(@PathVariable UUID id) {
    return ResponseEntity.ok(TenantResponse.from(tenantRegistry.activate(id)));
  }

  @PostMapping("/{id}/suspend")
  @PreAuthorize("hasRole('PLATFORM_ADMIN')")
  public ResponseEntity<TenantResponse> suspend(
      @PathVariable UUID id, @Valid @RequestBody SuspendRequest request) {
    return ResponseEntity.ok(TenantResponse.from(tenantRegistry.suspend(id, request.reason())));
  }

  @PostMapping("/{id}/reinstate")
  @PreAuthorize("hasRole('PLATFORM_ADMIN')")
  public ResponseEntity<TenantResponse> reinstate(@PathVariable UUID id) {
    return ResponseEntity.ok(TenantResponse.from(tenantRegistry.reinstate(id)));
  }

  @PostMapping("/{id}/archive")
  @PreAuthorize("hasRole('PLATFORM_ADMIN')")
  public ResponseEntity<TenantResponse> archive(@PathVariable UUID id) {
    return ResponseEntity.ok(TenantResponse.from(tenantRegistry.archive(id)));
  }

  @GetMapping("/{id}/role-assignments")
  @PreAuthorize("hasAnyRole('PLATFORM_ADMIN', 'OWNER', 'ADMIN')")
  public ResponseEntity<List<RoleAssignment>> roleAssignments(
      @PathVariable UUID id, Authentication authentication) {
    guard(authentication, id, Action.READ);
    return ResponseEntity.ok(roleAssignmentService.list(id));
  }

  @PostMapping("/{id}/role-assignments")
  @PreAuthorize("hasAnyRole('PLATFORM_ADMIN', 'OWNER', 'ADMIN')")
  public ResponseEntity<RoleAssignment> assignRole(
      @PathVariable UUID id,
      @Valid @RequestBody RoleAssignmentRequest request,
      Authentication authentication) {
    guard(authentication, id, Action.WRITE);
    var assignment = roleAssignmentService.assign(id, request.userId(), request.role());
    return ResponseEntity.created(
            URI.create("/api/admin/tenants/" + id + "/role-assignments/" + request.userId()))
        .body(assignment);
  }

  @DeleteMapping("/{id}/role-assignments/{userId}/{role}")
  @PreAuthorize("hasAnyRole('PLATFORM_ADMIN', 'OWNER', 'ADMIN')")
  public ResponseEntity<Void> revokeRole(
      @PathVariable UUID id,
      @PathVariable String userId,
      @PathVariable String role,
      Authentication authentication) {
    guard(authentication, id, Action.WRITE);
    roleAssignmentService.revoke(id, userId, role);
    return ResponseEntity.noContent().build();
  }

  /** Platform admins act across tenants; everyone else goes through the isolation guard. */
  private void guard(Authentication authentication, UUID tenantId, Action action) {
    boolean platformAdmin =
        authentication.getAuthorities().stream()
            .map(GrantedAuthority::getAuthority)
            .anyMatch(Roles.AUTHORITY_PLATFORM_ADMIN::equals);
    if (!platformAdmin) {
      isolationGuard.validateBoundary(
          TargetResource.of(ResourceType.TENANT, tenantId, tenantId), action);
    }
  }

  public record SuspendRequest(@NotNull SuspensionReason reason) {}

  public record RoleAssignmentRequest(@NotBlank String userId, @NotBlank String role) {}

  public record TenantResponse(
      UUID id,
      String slug,
      String displayName,
      TenantType type,
      UUID parentId,
      BrandingConfig branding,
      Set<String> featureFlags,
      TenantLimits limits,
      TenantStatus status,
      SuspensionReason suspensionReason,
      Instant createdAt,
      Instant updatedAt) {

    public static TenantResponse from(Tenant tenant) {
      return new TenantResponse(
          tenant.getId(),
          tenant.getSlug(),
          tenant.getDisplayName(),
          tenant.getType(),
          tenant.getParentId(),
          tenant.getBranding(),
          tenant.getFeatureFlags(),
          tenant.getLimits(),
          tenant.getStatus(),
          tenant.getSuspensionReason(),
          tenant.getCreatedAt(),
          tenant.getUpdatedAt());
    }
  }
}
