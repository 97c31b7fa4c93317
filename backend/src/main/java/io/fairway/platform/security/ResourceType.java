package io.fairway.platform.security;

public enum ResourceType {
  TENANT,
  CUSTOMER,
  SUBSCRIPTION,
  INVOICE,
  REVENUE,
  USAGE,
  ANALYTICS,
  EXPORT;

  public String label() {
    return name().toLowerCase();
  }
}
