package io.fairway.platform.tenant;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import io.fairway.platform.audit.AuditEventBuilder;
import io.fairway.platform.audit.AuditService;
import io.fairway.platform.exception.InvalidRequestException;
import io.fairway.platform.exception.PlanLimitExceededException;
import io.fairway.platform.exception.ResourceConflictException;
import io.fairway.platform.exception.ResourceNotFoundException;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Owns tenant identity, branding, feature flags, limits and parent/child chains. Resolution is
 * served from a Caffeine cache that is evicted on every mutation.
 */
@Service
public class TenantRegistry {

  private static final Logger log = LoggerFactory.getLogger(TenantRegistry.class);

  public static final String SLUG_PATTERN = "^[a-z0-9]+(?:-[a-z0-9]+)*$";
  private static final Pattern SLUG = Pattern.compile(SLUG_PATTERN);

  private final TenantRepository tenantRepository;
  private final AuditService auditService;
  private final Clock clock;
  private final Cache<UUID, Tenant> tenantCache =
      Caffeine.newBuilder().maximumSize(10_000).expireAfterWrite(Duration.ofMinutes(10)).build();

  public TenantRegistry(TenantRepository tenantRepository, AuditService auditService, Clock clock) {
    this.tenantRepository = tenantRepository;
    this.auditService = auditService;
    this.clock = clock;
  }

  public Tenant createTenant(CreateTenantRequest request) {
    validateSlug(request.slug());

    Tenant parent = null;
    if (request.parentId() != null) {
      parent = resolveTenant(request.parentId());
      validateParent(parent);
    }

    TenantLimits limits = request.limits();
    if (limits == null) {
      limits = parent != null ? parent.getLimits().childDefault() : request.type().defaultLimits();
    }
    if (parent != null) {
      requireWithin(limits, parent.getLimits(), "parent " + parent.getSlug());
    }
    if (!request.type().canHaveChildren() && limits.maxChildTenants() > 0) {
      throw new InvalidRequestException(
          "Invalid tenant limits", request.type() + " tenants cannot own child tenants");
    }

    var tenant =
        new Tenant(
            request.slug(),
            request.displayName(),
            request.type(),
            request.parentId(),
            request.branding(),
            request.featureFlags(),
            limits,
            clock.instant());
    requireCustomDomainsWithin(tenant.getBranding(), limits);

    if (!tenantRepository.insert(tenant)) {
      throw new ResourceConflictException(
          "Duplicate tenant slug", "Slug '" + request.slug() + "' is already taken");
    }

    audit(tenant, "tenant.created", Map.of("slug", tenant.getSlug(), "type", tenant.getType()));
    log.info(
        "Created tenant {} (slug={}, type={}, parent={})",
        tenant.getId(),
        tenant.getSlug(),
        tenant.getType(),
        tenant.getParentId());
    return tenant;
  }

  /** Returns the tenant or throws {@link ResourceNotFoundException}. */
  public Tenant resolveTenant(UUID id) {
    Tenant cached = tenantCache.getIfPresent(id);
    if (cached != null) {
      return cached.copy();
    }
    var tenant =
        tenantRepository
            .findById(id)
            .orElseThrow(() -> new ResourceNotFoundException("Tenant", id));
    tenantCache.put(id, tenant.copy());
    return tenant;
  }

  /** Resolves a tenant from the string form of its id, as carried by identities and events. */
  public Tenant resolveTenant(String id) {
    return resolveTenant(parseId(id));
  }

  public Tenant findBySlug(String slug) {
    return tenantRepository
        .findBySlug(slug)
        .orElseThrow(
            () ->
                ResourceNotFoundException.withDetail(
                    "Tenant not found", "No tenant with slug " + slug));
  }

  public List<Tenant> children(UUID parentId) {
    resolveTenant(parentId);
    return tenantRepository.findByParentId(parentId);
  }

  public List<Tenant> findAll() {
    return tenantRepository.findAll();
  }

  /** True when {@code childId} names a tenant whose parent is {@code parentId}. */
  public boolean isDirectChild(String parentId, String childId) {
    if (parentId == null || childId == null || parentId.equals(childId)) {
      return false;
    }
    var child = tenantRepository.findById(parseId(childId));
    return child.isPresent()
        && child.get().getParentId() != null
        && child.get().getParentId().toString().equals(parentId);
  }

  public Tenant updateTenant(UUID id, UpdateTenantRequest request) {
    var tenant = resolveTenant(id);
    var now = clock.instant();

    if (request.slug() != null && !request.slug().equals(tenant.getSlug())) {
      validateSlug(request.slug());
      if (tenantRepository.findBySlug(request.slug()).isPresent()) {
        throw new ResourceConflictException(
            "Duplicate tenant slug", "Slug '" + request.slug() + "' is already taken");
      }
      tenant.changeSlug(request.slug(), now);
    }
    if (request.displayName() != null) {
      tenant.rename(request.displayName(), now);
    }
    if (request.limits() != null) {
      validateLimitChange(tenant, request.limits());
      tenant.updateLimits(request.limits(), now);
    }
    if (request.branding() != null) {
      tenant.updateBranding(request.branding(), now);
    }
    if (request.featureFlags() != null) {
      tenant.updateFeatureFlags(request.featureFlags(), now);
    }
    requireCustomDomainsWithin(tenant.getBranding(), tenant.getLimits());

    var saved = persist(tenant);
    audit(saved, "tenant.updated", Map.of("slug", saved.getSlug()));
    return saved;
  }

  public Tenant activate(UUID id) {
    var tenant = resolveTenant(id);
    tenant.activate(clock.instant());
    var saved = persist(tenant);
    audit(saved, "tenant.activated", Map.of());
    log.info("Activated tenant {} ({})", saved.getId(), saved.getSlug());
    return saved;
  }

  public Tenant suspend(UUID id, SuspensionReason reason) {
    if (reason == null) {
      throw new InvalidRequestException("Missing suspension reason", "A reason is required");
    }
    var tenant = resolveTenant(id);
    tenant.suspend(reason, clock.instant());
    var saved = persist(tenant);
    audit(saved, "tenant.suspended", Map.of("reason", reason));
    log.warn("Suspended tenant {} ({}), reason={}", saved.getId(), saved.getSlug(), reason);
    return saved;
  }

  public Tenant reinstate(UUID id) {
    var tenant = resolveTenant(id);
    tenant.activate(clock.instant());
    var saved = persist(tenant);
    audit(saved, "tenant.reinstated", Map.of());
    log.info("Reinstated tenant {} ({})", saved.getId(), saved.getSlug());
    return saved;
  }

  public Tenant archive(UUID id) {
    var tenant = resolveTenant(id);
    boolean liveChildren =
        tenantRepository.findByParentId(id).stream()
            .anyMatch(child -> child.getStatus() != TenantStatus.ARCHIVED);
    if (liveChildren) {
      throw new InvalidRequestException(
          "Tenant has live children",
          "Archive all child tenants of " + tenant.getSlug() + " first");
    }
    tenant.archive(clock.instant());
    var saved = persist(tenant);
    audit(saved, "tenant.archived", Map.of());
    log.info("Archived tenant {} ({})", saved.getId(), saved.getSlug());
    return saved;
  }

  /** Evicts the cached snapshot for a tenant. */
  public void evict(UUID id) {
    tenantCache.invalidate(id);
  }

  private Tenant persist(Tenant tenant) {
    try {
      return tenantRepository.save(tenant);
    } finally {
      tenantCache.invalidate(tenant.getId());
    }
  }

  private void validateSlug(String slug) {
    if (slug == null || slug.length() < 3 || slug.length() > 63 || !SLUG.matcher(slug).matches()) {
      throw new InvalidRequestException(
          "Invalid tenant slug",
          "Slug must be 3-63 lowercase letters, digits or single hyphens: " + slug);
    }
  }

  private void validateParent(Tenant parent) {
    if (!parent.getType().canHaveChildren() || parent.getParentId() != null) {
      throw new InvalidRequestException(
          "Invalid parent tenant", parent.getSlug() + " cannot own child locations");
    }
    if (parent.getStatus() == TenantStatus.ARCHIVED) {
      throw new InvalidRequestException(
          "Invalid parent tenant", parent.getSlug() + " is archived");
    }
    int existing = tenantRepository.findByParentId(parent.getId()).size();
    if (existing >= parent.getLimits().maxChildTenants()) {
      throw new PlanLimitExceededException(
          parent.getSlug()
              + " already has "
              + existing
              + " child tenants (limit "
              + parent.getLimits().maxChildTenants()
              + ")");
    }
  }

  private void validateLimitChange(Tenant tenant, TenantLimits limits) {
    if (tenant.getParentId() != null) {
      var parent = resolveTenant(tenant.getParentId());
      requireWithin(limits, parent.getLimits(), "parent " + parent.getSlug());
    }
    for (Tenant child : tenantRepository.findByParentId(tenant.getId())) {
      var exceeding = child.getLimits().exceeding(limits);
      if (!exceeding.isEmpty()) {
        throw new PlanLimitExceededException(
            "Child tenant " + child.getSlug() + " would exceed the new limits on " + exceeding);
      }
    }
    int children = tenantRepository.findByParentId(tenant.getId()).size();
    if (limits.maxChildTenants() < children) {
      throw new PlanLimitExceededException(
          tenant.getSlug() + " already has " + children + " child tenants");
    }
  }

  private static void requireWithin(TenantLimits limits, TenantLimits ceiling, String owner) {
    var exceeding = limits.exceeding(ceiling);
    if (!exceeding.isEmpty()) {
      throw new PlanLimitExceededException(
          "Child limits exceed those of " + owner + " on " + exceeding);
    }
  }

  private static void requireCustomDomainsWithin(BrandingConfig branding, TenantLimits limits) {
    if (branding.customDomains().size() > limits.maxCustomDomains()) {
      throw new PlanLimitExceededException(
          branding.customDomains().size()
              + " custom domains requested, limit is "
              + limits.maxCustomDomains());
    }
  }

  private static UUID parseId(String id) {
    try {
      return UUID.fromString(id);
    } catch (IllegalArgumentException e) {
      throw new ResourceNotFoundException("Tenant", id);
    }
  }

  private void audit(Tenant tenant, String eventType, Map<String, Object> details) {
    auditService.log(
        AuditEventBuilder.builder()
            .eventType(eventType)
            .entityType("tenant")
            .entityId(tenant.getId())
            .tenantId(tenant.getId().toString())
            .details(details)
            .build());
  }
}
