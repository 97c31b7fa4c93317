package io.fairway.platform.tenant;

import java.util.List;

/** White-label branding of a tenant. */
public record BrandingConfig(
    String primaryColor, String secondaryColor, String logoUrl, List<String> customDomains) {

  public static final BrandingConfig DEFAULT =
      new BrandingConfig("#2E7D32", "#FFFFFF", null, List.of());

  public BrandingConfig {
    customDomains = customDomains == null ? List.of() : List.copyOf(customDomains);
  }
}
