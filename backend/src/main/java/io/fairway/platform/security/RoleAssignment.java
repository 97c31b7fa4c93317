package io.fairway.platform.security;

import java.time.Instant;

/** Grants {@code role} to {@code userId} inside {@code tenantId}. */
public record RoleAssignment(String userId, String tenantId, String role, Instant assignedAt) {}
