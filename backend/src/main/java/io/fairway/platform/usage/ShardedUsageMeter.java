package io.fairway.platform.usage;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.LongAdder;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * {@link UsageMeter} backed by a concurrent map of lock-free bucket counters keyed by (tenant,
 * endpoint, granularity, bucket start). Writers only ever touch their own buckets; there is no
 * tenant-wide or global lock on the recording path.
 *
 * <p>Live calls land in MINUTE and MONTH buckets. Compaction folds MINUTE into HOUR and HOUR into
 * DAY, so at any time each call is counted in exactly one of the MINUTE, HOUR or DAY buckets, and
 * once in a MONTH bucket.
 */
@Service
public class ShardedUsageMeter implements UsageMeter {

  private static final Logger log = LoggerFactory.getLogger(ShardedUsageMeter.class);

  private final Map<UsageBucketKey, UsageCounters> buckets = new ConcurrentHashMap<>();
  private final Map<String, AtomicLong> storage = new ConcurrentHashMap<>();
  private final Map<String, Instant> billedThrough = new ConcurrentHashMap<>();
  private final LongAdder dropped = new LongAdder();
  private final ReentrantLock compactionLock = new ReentrantLock();

  private final SlidingWindowRateLimiter rateLimiter;
  private final QuotaLimitResolver quotaLimitResolver;
  private final UsageProperties properties;
  private final Clock clock;

  public ShardedUsageMeter(
      SlidingWindowRateLimiter rateLimiter,
      QuotaLimitResolver quotaLimitResolver,
      UsageProperties properties,
      Clock clock) {
    this.rateLimiter = rateLimiter;
    this.quotaLimitResolver = quotaLimitResolver;
    this.properties = properties;
    this.clock = clock;
  }

  @Override
  public void recordCall(
      String tenantId, String endpoint, int statusCode, long latencyMillis, long bytes) {
    try {
      if (tenantId == null || endpoint == null) {
        throw new IllegalArgumentException("tenant and endpoint are required");
      }
      Instant now = clock.instant();
      long safeBytes = Math.max(0, bytes);
      long safeLatency = Math.max(0, latencyMillis);
      counters(UsageBucketKey.of(tenantId, endpoint, Granularity.MINUTE, now))
          .record(statusCode, safeLatency, safeBytes);
      counters(UsageBucketKey.of(tenantId, endpoint, Granularity.MONTH, now))
          .record(statusCode, safeLatency, safeBytes);
    } catch (RuntimeException e) {
      dropped.increment();
      log.warn(
          "Usage record dropped for tenant={}, endpoint={}: {}",
          tenantId,
          endpoint,
          e.getMessage());
    }
  }

  @Override
  public void recordStorage(String tenantId, long bytes) {
    storage.computeIfAbsent(tenantId, k -> new AtomicLong()).set(Math.max(0, bytes));
  }

  @Override
  public UsageSummary currentUsage(String tenantId) {
    Instant monthStart = Granularity.MONTH.truncate(clock.instant());
    var total = sum(tenantId, Granularity.MONTH, monthStart, Granularity.MONTH.end(monthStart));
    return new UsageSummary(
        tenantId, monthStart, Granularity.MONTH.end(monthStart), total.calls(), total.bytes());
  }

  @Override
  public UsageSummary usageBetween(String tenantId, Instant from, Instant to) {
    var total =
        sum(tenantId, Granularity.MINUTE, from, to)
            .plus(sum(tenantId, Granularity.HOUR, from, to))
            .plus(sum(tenantId, Granularity.DAY, from, to));
    return new UsageSummary(tenantId, from, to, total.calls(), total.bytes());
  }

  @Override
  public long storedBytes(String tenantId) {
    var gauge = storage.get(tenantId);
    return gauge != null ? gauge.get() : 0L;
  }

  @Override
  public QuotaCheck checkQuota(String tenantId, QuotaType quotaType) {
    long used =
        switch (quotaType) {
          case API_CALLS -> currentUsage(tenantId).calls();
          case BANDWIDTH -> currentUsage(tenantId).bytes();
          case STORAGE -> storedBytes(tenantId);
        };
    return QuotaCheck.of(quotaType, used, quotaLimitResolver.limit(tenantId, quotaType));
  }

  @Override
  public RateLimitDecision checkRateLimit(String tenantId, String endpoint) {
    var config = properties.rateLimit();
    Integer override = config.tenantOverrides().get(tenantId);
    int limit =
        override != null
            ? override
            : quotaLimitResolver.rateLimit(tenantId).orElse(config.defaultLimit());
    return rateLimiter.tryAcquire(tenantId, endpoint, limit, config.window());
  }

  @Override
  public List<UsageRecord> records(
      String tenantId, Granularity granularity, Instant from, Instant to) {
    var records = new ArrayList<UsageRecord>();
    buckets.forEach(
        (key, counters) -> {
          if (matches(key, tenantId, granularity, from, to)) {
            records.add(new UsageRecord(key, counters.snapshot()));
          }
        });
    records.sort(
        Comparator.comparing((UsageRecord r) -> r.key().bucketStart())
            .thenComparing(r -> r.key().endpoint()));
    return records;
  }

  @Override
  public void advanceBilledThrough(String tenantId, Instant watermark) {
    billedThrough.merge(
        tenantId, watermark, (current, next) -> next.isAfter(current) ? next : current);
  }

  public Instant billedThrough(String tenantId) {
    return billedThrough.get(tenantId);
  }

  /** Calls that could not be recorded since startup. */
  public long droppedRecords() {
    return dropped.sum();
  }

  @Override
  public CompactionResult compact() {
    if (!compactionLock.tryLock()) {
      log.debug("Usage compaction already running, skipping");
      return new CompactionResult(0, 0, 0);
    }
    try {
      Instant now = clock.instant();
      var retention = properties.retention();
      int minutes = fold(Granularity.MINUTE, now.minus(retention.minute()));
      int hours = fold(Granularity.HOUR, now.minus(retention.hour()));
      int purged =
          purgeBilled(Granularity.DAY, now.minus(retention.day()))
              + purgeBilled(Granularity.MONTH, now.minus(retention.month()));
      if (minutes + hours + purged > 0) {
        log.info(
            "Usage compaction folded {} minute and {} hour buckets, purged {}",
            minutes,
            hours,
            purged);
      }
      return new CompactionResult(minutes, hours, purged);
    } finally {
      compactionLock.unlock();
    }
  }

  private int fold(Granularity source, Instant cutoff) {
    Granularity target = source.coarser();
    int folded = 0;
    for (UsageBucketKey key : List.copyOf(buckets.keySet())) {
      if (key.granularity() != source || source.end(key.bucketStart()).isAfter(cutoff)) {
        continue;
      }
      UsageCounters removed = buckets.remove(key);
      if (removed != null) {
        counters(key.rollUpTo(target)).add(removed.snapshot());
        folded++;
      }
    }
    return folded;
  }

  private int purgeBilled(Granularity granularity, Instant cutoff) {
    int purged = 0;
    for (UsageBucketKey key : List.copyOf(buckets.keySet())) {
      if (key.granularity() != granularity) {
        continue;
      }
      Instant end = granularity.end(key.bucketStart());
      Instant watermark = billedThrough.get(key.tenantId());
      if (watermark != null && !end.isAfter(watermark) && !end.isAfter(cutoff)) {
        if (buckets.remove(key) != null) {
          purged++;
        }
      }
    }
    return purged;
  }

  private UsageCounters counters(UsageBucketKey key) {
    return buckets.computeIfAbsent(key, k -> new UsageCounters());
  }

  private UsageSnapshot sum(String tenantId, Granularity granularity, Instant from, Instant to) {
    UsageSnapshot total = UsageSnapshot.EMPTY;
    for (var entry : buckets.entrySet()) {
      if (matches(entry.getKey(), tenantId, granularity, from, to)) {
        total = total.plus(entry.getValue().snapshot());
      }
    }
    return total;
  }

  private static boolean matches(
      UsageBucketKey key, String tenantId, Granularity granularity, Instant from, Instant to) {
    return key.tenantId().equals(tenantId)
        && key.granularity() == granularity
        && (from == null || !key.bucketStart().isBefore(from))
        && (to == null || key.bucketStart().isBefore(to));
  }
}
