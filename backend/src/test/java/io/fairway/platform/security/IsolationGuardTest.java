package io.fairway.platform.security;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.fairway.platform.audit.AuditEventFilter;
import io.fairway.platform.audit.InMemoryAuditService;
import io.fairway.platform.exception.CrossTenantViolationException;
import io.fairway.platform.exception.ForbiddenException;
import io.fairway.platform.exception.MissingTenantContextException;
import io.fairway.platform.multitenancy.TenantContext;
import io.fairway.platform.tenant.CreateTenantRequest;
import io.fairway.platform.tenant.InMemoryTenantRepository;
import io.fairway.platform.tenant.TenantRegistry;
import io.fairway.platform.tenant.TenantType;
import io.fairway.platform.testutil.MutableClock;
import java.time.Instant;
import java.util.Set;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class IsolationGuardTest {

  private InMemoryAuditService auditService;
  private InMemoryRoleAssignmentRepository roleAssignments;
  private IsolationGuard guard;

  private String chainId;
  private String locationId;
  private String otherCourseId;

  @BeforeEach
  void setUp() {
    var clock = new MutableClock(Instant.parse("2025-01-01T00:00:00Z"));
    auditService = new InMemoryAuditService(clock);
    roleAssignments = new InMemoryRoleAssignmentRepository();
    var registry = new TenantRegistry(new InMemoryTenantRepository(), auditService, clock);
    guard = new IsolationGuard(registry, new PermissionCatalog(), roleAssignments, auditService);

    var chain = registry.createTenant(request("links-group", TenantType.ENTERPRISE_CHAIN, null));
    chainId = chain.getId().toString();
    locationId =
        registry
            .createTenant(request("links-north", TenantType.GOLF_COURSE, chain.getId()))
            .getId()
            .toString();
    otherCourseId =
        registry
            .createTenant(request("golf-club-43", TenantType.GOLF_COURSE, null))
            .getId()
            .toString();
  }

  private static CreateTenantRequest request(String slug, TenantType type, UUID parentId) {
    return new CreateTenantRequest(slug, slug, type, parentId, null, null, null);
  }

  private static TargetResource revenueOf(String tenantId) {
    return TargetResource.of(ResourceType.REVENUE, tenantId, tenantId);
  }

  @Test
  void sameTenant_isAllowed() {
    var owner = new ResolvedIdentity("u1", otherCourseId, Set.of(Roles.OWNER));

    assertThatCode(() -> guard.validateBoundary(owner, revenueOf(otherCourseId), Action.WRITE))
        .doesNotThrowAnyException();
  }

  @Test
  void otherTenant_isDeniedAndAudited() {
    var owner = new ResolvedIdentity("u1", locationId, Set.of(Roles.OWNER));

    assertThatThrownBy(() -> guard.validateBoundary(owner, revenueOf(otherCourseId), Action.READ))
        .isInstanceOfSatisfying(
            CrossTenantViolationException.class,
            e -> {
              assertThat(e.getRequestingTenantId()).isEqualTo(locationId);
              assertThat(e.getOwningTenantId()).isEqualTo(otherCourseId);
            });

    var audited =
        auditService.findEvents(
            locationId, AuditEventFilter.byEventType("security.cross_tenant_violation"));
    assertThat(audited).hasSize(1);
    assertThat(audited.get(0).details()).containsEntry("owningTenantId", otherCourseId);
  }

  @Test
  void chainAdmin_readsDirectChildrenOnly() {
    var chainAdmin = new ResolvedIdentity("u2", chainId, Set.of(Roles.CHAIN_ADMIN));

    assertThatCode(() -> guard.validateBoundary(chainAdmin, revenueOf(locationId), Action.READ))
        .doesNotThrowAnyException();
    assertThatThrownBy(
            () -> guard.validateBoundary(chainAdmin, revenueOf(locationId), Action.WRITE))
        .isInstanceOf(CrossTenantViolationException.class);
    assertThatThrownBy(
            () -> guard.validateBoundary(chainAdmin, revenueOf(otherCourseId), Action.READ))
        .isInstanceOf(CrossTenantViolationException.class);
  }

  @Test
  void chainOwnerWithoutChainRole_cannotReachChildren() {
    var owner = new ResolvedIdentity("u3", chainId, Set.of(Roles.OWNER));

    assertThatThrownBy(() -> guard.validateBoundary(owner, revenueOf(locationId), Action.READ))
        .isInstanceOf(CrossTenantViolationException.class);
  }

  @Test
  void assignedChainRole_grantsChildAccess() {
    roleAssignments.assign(new RoleAssignment("u3", chainId, Roles.CHAIN_ADMIN, Instant.now()));
    var owner = new ResolvedIdentity("u3", chainId, Set.of(Roles.OWNER));

    assertThat(guard.effectiveRoles(owner)).contains(Roles.OWNER, Roles.CHAIN_ADMIN);
    assertThat(guard.canAccess(owner, locationId, ResourceType.ANALYTICS)).isTrue();
    assertThat(guard.canAccess(owner, otherCourseId, ResourceType.ANALYTICS)).isFalse();
  }

  @Test
  void member_readsOnlyTheirOwnSubscription() {
    var member = new ResolvedIdentity("u5", otherCourseId, Set.of(Roles.MEMBER));
    var own = TargetResource.ownedBy(ResourceType.SUBSCRIPTION, "sub-1", otherCourseId, "u5");
    var someoneElses =
        TargetResource.ownedBy(ResourceType.SUBSCRIPTION, "sub-2", otherCourseId, "u6");

    assertThatCode(() -> guard.validateBoundary(member, own, Action.READ))
        .doesNotThrowAnyException();
    assertThatThrownBy(() -> guard.validateBoundary(member, someoneElses, Action.READ))
        .isInstanceOf(ForbiddenException.class);
    assertThatThrownBy(() -> guard.validateBoundary(member, own, Action.WRITE))
        .isInstanceOf(ForbiddenException.class);
  }

  @Test
  void memberWritingRevenue_isDeniedAndAudited() {
    var member = new ResolvedIdentity("u5", otherCourseId, Set.of(Roles.MEMBER));

    assertThatThrownBy(
            () -> guard.validateBoundary(member, revenueOf(otherCourseId), Action.WRITE))
        .isInstanceOf(ForbiddenException.class);

    var audited =
        auditService.findEvents(
            otherCourseId, AuditEventFilter.byEventType("security.permission_denied"));
    assertThat(audited).hasSize(1);
    assertThat(audited.get(0).details()).containsEntry("action", "WRITE");
  }

  @Test
  void assignedBillingRole_grantsRevenueWritesInTheOwnTenant() {
    var member = new ResolvedIdentity("u7", otherCourseId, Set.of(Roles.MEMBER));
    roleAssignments.assign(new RoleAssignment("u7", otherCourseId, Roles.BILLING, Instant.now()));

    assertThatCode(() -> guard.validateBoundary(member, revenueOf(otherCourseId), Action.WRITE))
        .doesNotThrowAnyException();
    assertThat(guard.canAccess(member, otherCourseId, ResourceType.ANALYTICS)).isTrue();
  }

  @Test
  void childTenant_cannotReachItsParent() {
    var childAdmin = new ResolvedIdentity("u4", locationId, Set.of(Roles.CHAIN_ADMIN));

    assertThatThrownBy(() -> guard.validateBoundary(childAdmin, revenueOf(chainId), Action.READ))
        .isInstanceOf(CrossTenantViolationException.class);
  }

  @Test
  void boundContext_isUsedWhenNoIdentityIsPassed() {
    var identity = new ResolvedIdentity("u1", otherCourseId, Set.of(Roles.BILLING));

    TenantContext.runAs(
        identity,
        () -> guard.validateBoundary(revenueOf(otherCourseId), Action.READ));
    assertThatThrownBy(() -> guard.validateBoundary(revenueOf(otherCourseId), Action.READ))
        .isInstanceOf(MissingTenantContextException.class);
  }
}
