package io.fairway.platform.tenant;

public enum TenantType {
  INDIVIDUAL,
  GOLF_COURSE,
  ENTERPRISE_CHAIN;

  public TenantLimits defaultLimits() {
    return switch (this) {
      case INDIVIDUAL -> TenantLimits.INDIVIDUAL;
      case GOLF_COURSE -> TenantLimits.GOLF_COURSE;
      case ENTERPRISE_CHAIN -> TenantLimits.ENTERPRISE_CHAIN;
    };
  }

  /** Only chains own child locations. */
  public boolean canHaveChildren() {
    return this == ENTERPRISE_CHAIN;
  }
}
