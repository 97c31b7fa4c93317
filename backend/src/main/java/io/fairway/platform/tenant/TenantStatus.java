package io.fairway.platform.tenant;

/**
 * Tenant lifecycle status.
 *
 * <ul>
 *   <li>PROVISIONING → ACTIVE (onboarding complete)
 *   <li>PROVISIONING → ARCHIVED (abandoned onboarding)
 *   <li>ACTIVE → SUSPENDED → ACTIVE (suspension and reinstatement)
 *   <li>ACTIVE, SUSPENDED → ARCHIVED
 *   <li>ARCHIVED is terminal
 * </ul>
 */
public enum TenantStatus {
  PROVISIONING,
  ACTIVE,
  SUSPENDED,
  ARCHIVED;

  public boolean canTransitionTo(TenantStatus target) {
    return switch (this) {
      case PROVISIONING -> target == ACTIVE || target == ARCHIVED;
      case ACTIVE -> target == SUSPENDED || target == ARCHIVED;
      case SUSPENDED -> target == ACTIVE || target == ARCHIVED;
      case ARCHIVED -> false;
    };
  }
}
