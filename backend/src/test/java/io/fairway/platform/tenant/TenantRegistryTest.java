package io.fairway.platform.tenant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.fairway.platform.audit.AuditEventFilter;
import io.fairway.platform.audit.InMemoryAuditService;
import io.fairway.platform.exception.InvalidRequestException;
import io.fairway.platform.exception.InvalidStateTransitionException;
import io.fairway.platform.exception.PlanLimitExceededException;
import io.fairway.platform.exception.ResourceConflictException;
import io.fairway.platform.exception.ResourceNotFoundException;
import io.fairway.platform.testutil.MutableClock;
import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class TenantRegistryTest {

  private InMemoryAuditService auditService;
  private TenantRegistry registry;

  @BeforeEach
  void setUp() {
    var clock = new MutableClock(Instant.parse("2025-01-01T00:00:00Z"));
    auditService = new InMemoryAuditService(clock);
    registry = new TenantRegistry(new InMemoryTenantRepository(), auditService, clock);
  }

  private Tenant create(String slug, TenantType type, UUID parentId) {
    return registry.createTenant(
        new CreateTenantRequest(slug, slug, type, parentId, null, null, null));
  }

  @Test
  void createTenant_startsProvisioningWithTypeDefaults() {
    var tenant = create("golf-club-42", TenantType.GOLF_COURSE, null);

    assertThat(tenant.getStatus()).isEqualTo(TenantStatus.PROVISIONING);
    assertThat(tenant.getLimits()).isEqualTo(TenantLimits.GOLF_COURSE);
    assertThat(tenant.getBranding()).isEqualTo(BrandingConfig.DEFAULT);
    assertThat(registry.findBySlug("golf-club-42").getId()).isEqualTo(tenant.getId());
    assertThat(
            auditService.findEvents(
                tenant.getId().toString(), AuditEventFilter.byEventType("tenant.created")))
        .hasSize(1);
  }

  @Test
  void createTenant_rejectsDuplicateAndMalformedSlugs() {
    create("golf-club-42", TenantType.GOLF_COURSE, null);

    assertThatThrownBy(() -> create("golf-club-42", TenantType.GOLF_COURSE, null))
        .isInstanceOf(ResourceConflictException.class);
    assertThatThrownBy(() -> create("Golf_Club", TenantType.GOLF_COURSE, null))
        .isInstanceOf(InvalidRequestException.class);
  }

  @Test
  void chainLocations_inheritChildDefaultLimits() {
    var chain = create("links-group", TenantType.ENTERPRISE_CHAIN, null);
    var location = create("links-north", TenantType.GOLF_COURSE, chain.getId());

    assertThat(location.getParentId()).isEqualTo(chain.getId());
    assertThat(location.getLimits()).isEqualTo(TenantLimits.ENTERPRISE_CHAIN.childDefault());
    assertThat(registry.children(chain.getId())).extracting(Tenant::getSlug)
        .containsExactly("links-north");
    assertThat(registry.isDirectChild(chain.getId().toString(), location.getId().toString()))
        .isTrue();
    assertThat(registry.isDirectChild(location.getId().toString(), chain.getId().toString()))
        .isFalse();
  }

  @Test
  void onlyTopLevelChainsOwnChildren() {
    var course = create("golf-club-42", TenantType.GOLF_COURSE, null);
    var chain = create("links-group", TenantType.ENTERPRISE_CHAIN, null);
    var location = create("links-north", TenantType.GOLF_COURSE, chain.getId());

    assertThatThrownBy(() -> create("pro-shop", TenantType.INDIVIDUAL, course.getId()))
        .isInstanceOf(InvalidRequestException.class);
    assertThatThrownBy(() -> create("links-north-b", TenantType.GOLF_COURSE, location.getId()))
        .isInstanceOf(InvalidRequestException.class);
  }

  @Test
  void childLimitsMayNotExceedTheParent() {
    var chain =
        registry.createTenant(
            new CreateTenantRequest(
                "small-chain",
                "Small chain",
                TenantType.ENTERPRISE_CHAIN,
                null,
                null,
                null,
                new TenantLimits(10, 1_000, 1_000, 0, 1)));

    assertThatThrownBy(
            () ->
                registry.createTenant(
                    new CreateTenantRequest(
                        "big-course",
                        "Big course",
                        TenantType.GOLF_COURSE,
                        chain.getId(),
                        null,
                        null,
                        new TenantLimits(100, 1_000, 1_000, 0, 0))))
        .isInstanceOf(PlanLimitExceededException.class);

    create("first-course", TenantType.GOLF_COURSE, chain.getId());
    assertThatThrownBy(() -> create("second-course", TenantType.GOLF_COURSE, chain.getId()))
        .isInstanceOf(PlanLimitExceededException.class);
  }

  @Test
  void customDomains_areBoundedByLimits() {
    var branding = new BrandingConfig("#000000", "#FFFFFF", null, List.of("a.com", "b.com"));

    assertThatThrownBy(
            () ->
                registry.createTenant(
                    new CreateTenantRequest(
                        "golf-club-42",
                        "Golf Club 42",
                        TenantType.GOLF_COURSE,
                        null,
                        branding,
                        Set.of(),
                        null)))
        .isInstanceOf(PlanLimitExceededException.class);
  }

  @Test
  void lifecycle_suspendReinstateArchive() {
    var tenant = create("golf-club-42", TenantType.GOLF_COURSE, null);

    registry.activate(tenant.getId());
    var suspended = registry.suspend(tenant.getId(), SuspensionReason.NON_PAYMENT);
    assertThat(suspended.getStatus()).isEqualTo(TenantStatus.SUSPENDED);
    assertThat(registry.resolveTenant(tenant.getId()).getStatus())
        .isEqualTo(TenantStatus.SUSPENDED);

    var reinstated = registry.reinstate(tenant.getId());
    assertThat(reinstated.getStatus()).isEqualTo(TenantStatus.ACTIVE);
    assertThat(reinstated.getSuspensionReason()).isNull();

    registry.archive(tenant.getId());
    assertThatThrownBy(() -> registry.activate(tenant.getId()))
        .isInstanceOf(InvalidStateTransitionException.class);
  }

  @Test
  void archive_requiresChildrenToBeArchivedFirst() {
    var chain = create("links-group", TenantType.ENTERPRISE_CHAIN, null);
    var location = create("links-north", TenantType.GOLF_COURSE, chain.getId());

    assertThatThrownBy(() -> registry.archive(chain.getId()))
        .isInstanceOf(InvalidRequestException.class);

    registry.archive(location.getId());
    assertThat(registry.archive(chain.getId()).getStatus()).isEqualTo(TenantStatus.ARCHIVED);
  }

  @Test
  void slug_isFrozenOnceActive() {
    var tenant = create("golf-club-42", TenantType.GOLF_COURSE, null);
    var rename = new UpdateTenantRequest("golf-club-43", "Renamed", null, null, null);

    assertThat(registry.updateTenant(tenant.getId(), rename).getSlug()).isEqualTo("golf-club-43");

    registry.activate(tenant.getId());
    var again = new UpdateTenantRequest("golf-club-44", null, null, null, null);
    assertThatThrownBy(() -> registry.updateTenant(tenant.getId(), again))
        .isInstanceOf(InvalidStateTransitionException.class);
  }

  @Test
  void resolveTenant_unknownOrMalformedIdIsNotFound() {
    assertThatThrownBy(() -> registry.resolveTenant(UUID.randomUUID()))
        .isInstanceOf(ResourceNotFoundException.class);
    assertThatThrownBy(() -> registry.resolveTenant("not-a-uuid"))
        .isInstanceOf(ResourceNotFoundException.class);
  }

  @Test
  void resolvedSnapshots_doNotLeakMutations() {
    var tenant = create("golf-club-42", TenantType.GOLF_COURSE, null);

    registry.resolveTenant(tenant.getId()).rename("Mutated", Instant.now());

    assertThat(registry.resolveTenant(tenant.getId()).getDisplayName()).isEqualTo("golf-club-42");
  }
}
