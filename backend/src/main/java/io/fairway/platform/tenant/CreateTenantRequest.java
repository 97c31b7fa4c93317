package io.fairway.platform.tenant;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import java.util.Set;
import java.util.UUID;

/**
 * Onboarding request. {@code limits} is optional: top-level tenants default to their type's preset
 * and child locations to {@link TenantLimits#childDefault()} of the parent.
 */
public record CreateTenantRequest(
    @NotBlank @Size(min = 3, max = 63) @Pattern(regexp = TenantRegistry.SLUG_PATTERN) String slug,
    @NotBlank @Size(max = 255) String displayName,
    @NotNull TenantType type,
    UUID parentId,
    BrandingConfig branding,
    Set<String> featureFlags,
    TenantLimits limits) {}
