package io.fairway.platform.usage;

/** A bucket and its counters, as returned by queries and exports. */
public record UsageRecord(UsageBucketKey key, UsageSnapshot usage) {}
