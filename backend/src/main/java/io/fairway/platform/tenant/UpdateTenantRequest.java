package io.fairway.platform.tenant;

import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import java.util.Set;

/** Partial update; null fields are left unchanged. */
public record UpdateTenantRequest(
    @Size(min = 3, max = 63) @Pattern(regexp = TenantRegistry.SLUG_PATTERN) String slug,
    @Size(max = 255) String displayName,
    BrandingConfig branding,
    Set<String> featureFlags,
    TenantLimits limits) {}
