package io.fairway.platform.usage;

import java.time.Instant;
import java.util.List;

/**
 * Per-tenant API usage metering. Recording never blocks and never throws: a failure to record
 * degrades the call to unmetered.
 */
public interface UsageMeter {

  /**
   * Records one call against the current MINUTE and MONTH buckets.
   *
   * @param statusCode HTTP status of the response; 4xx and 5xx are counted as errors
   * @param latencyMillis time to serve the call
   * @param bytes payload bytes transferred
   */
  void recordCall(String tenantId, String endpoint, int statusCode, long latencyMillis, long bytes);

  /** Sets the tenant's stored-bytes gauge. */
  void recordStorage(String tenantId, long bytes);

  /** Calls and bytes of the current calendar month. */
  UsageSummary currentUsage(String tenantId);

  /** Calls and bytes of buckets starting in {@code [from, to)}, at the finest width available. */
  UsageSummary usageBetween(String tenantId, Instant from, Instant to);

  long storedBytes(String tenantId);

  QuotaCheck checkQuota(String tenantId, QuotaType quotaType);

  /** Checks and, when allowed, takes a slot in the tenant's window for {@code endpoint}. */
  RateLimitDecision checkRateLimit(String tenantId, String endpoint);

  List<UsageRecord> records(String tenantId, Granularity granularity, Instant from, Instant to);

  /**
   * Marks usage before {@code billedThrough} as billed. Billed DAY and MONTH buckets become
   * eligible for purging once they are also past retention. Never moves backwards.
   */
  void advanceBilledThrough(String tenantId, Instant billedThrough);

  /** Folds aged fine buckets into coarser ones and purges billed buckets past retention. */
  CompactionResult compact();

  /** Outcome of one compaction pass. */
  record CompactionResult(int minutesFolded, int hoursFolded, int bucketsPurged) {}
}
