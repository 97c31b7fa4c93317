package io.fairway.platform.usage;

import java.time.Instant;

/** Calls and bytes of a tenant over {@code [from, to)}. */
public record UsageSummary(String tenantId, Instant from, Instant to, long calls, long bytes) {}
