package io.fairway.platform.tenant;

import io.fairway.platform.exception.InvalidStateTransitionException;
import io.fairway.platform.persistence.Versioned;
import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.UUID;

public class Tenant implements Versioned<Tenant> {

  private UUID id;
  private String slug;
  private String displayName;
  private TenantType type;
  private UUID parentId;
  private BrandingConfig branding;
  private Set<String> featureFlags;
  private TenantLimits limits;
  private TenantStatus status;
  private SuspensionReason suspensionReason;
  private boolean everActive;
  private Instant createdAt;
  private Instant updatedAt;
  private long version;

  private Tenant() {}

  public Tenant(
      String slug,
      String displayName,
      TenantType type,
      UUID parentId,
      BrandingConfig branding,
      Set<String> featureFlags,
      TenantLimits limits,
      Instant now) {
    this.id = UUID.randomUUID();
    this.slug = slug;
    this.displayName = displayName;
    this.type = type;
    this.parentId = parentId;
    this.branding = branding != null ? branding : BrandingConfig.DEFAULT;
    this.featureFlags =
        featureFlags != null ? new LinkedHashSet<>(featureFlags) : new LinkedHashSet<>();
    this.limits = limits;
    this.status = TenantStatus.PROVISIONING;
    this.createdAt = now;
    this.updatedAt = now;
  }

  public void activate(Instant now) {
    transitionTo(TenantStatus.ACTIVE, "activate");
    this.suspensionReason = null;
    this.everActive = true;
    this.updatedAt = now;
  }

  public void suspend(SuspensionReason reason, Instant now) {
    transitionTo(TenantStatus.SUSPENDED, "suspend");
    this.suspensionReason = reason;
    this.updatedAt = now;
  }

  public void archive(Instant now) {
    transitionTo(TenantStatus.ARCHIVED, "archive");
    this.updatedAt = now;
  }

  /** Slugs are immutable once the tenant has been active. */
  public void changeSlug(String slug, Instant now) {
    if (everActive || status != TenantStatus.PROVISIONING) {
      throw new InvalidStateTransitionException("tenant", status, "change slug of");
    }
    this.slug = slug;
    this.updatedAt = now;
  }

  public void rename(String displayName, Instant now) {
    this.displayName = displayName;
    this.updatedAt = now;
  }

  public void updateBranding(BrandingConfig branding, Instant now) {
    this.branding = branding;
    this.updatedAt = now;
  }

  public void updateFeatureFlags(Set<String> featureFlags, Instant now) {
    this.featureFlags = new LinkedHashSet<>(featureFlags);
    this.updatedAt = now;
  }

  public void updateLimits(TenantLimits limits, Instant now) {
    this.limits = limits;
    this.updatedAt = now;
  }

  public boolean isOperational() {
    return status == TenantStatus.ACTIVE;
  }

  public boolean hasFeature(String flag) {
    return featureFlags.contains(flag);
  }

  private void transitionTo(TenantStatus target, String action) {
    if (!status.canTransitionTo(target)) {
      throw new InvalidStateTransitionException("tenant", status, action);
    }
    this.status = target;
  }

  public UUID getId() {
    return id;
  }

  public String getSlug() {
    return slug;
  }

  public String getDisplayName() {
    return displayName;
  }

  public TenantType getType() {
    return type;
  }

  public UUID getParentId() {
    return parentId;
  }

  public BrandingConfig getBranding() {
    return branding;
  }

  public Set<String> getFeatureFlags() {
    return Set.copyOf(featureFlags);
  }

  public TenantLimits getLimits() {
    return limits;
  }

  public TenantStatus getStatus() {
    return status;
  }

  public SuspensionReason getSuspensionReason() {
    return suspensionReason;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }

  @Override
  public long getVersion() {
    return version;
  }

  @Override
  public void assignVersion(long version) {
    this.version = version;
  }

  @Override
  public Tenant copy() {
    var copy = new Tenant();
    copy.id = id;
    copy.slug = slug;
    copy.displayName = displayName;
    copy.type = type;
    copy.parentId = parentId;
    copy.branding = branding;
    copy.featureFlags = new LinkedHashSet<>(featureFlags);
    copy.limits = limits;
    copy.status = status;
    copy.suspensionReason = suspensionReason;
    copy.everActive = everActive;
    copy.createdAt = createdAt;
    copy.updatedAt = updatedAt;
    copy.version = version;
    return copy;
  }
}
