package io.fairway.platform.usage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/** Periodically compacts usage buckets and evicts idle rate-limit windows. */
@Component
public class UsageRollupJob {

  private static final Logger log = LoggerFactory.getLogger(UsageRollupJob.class);

  private final UsageMeter usageMeter;
  private final SlidingWindowRateLimiter rateLimiter;
  private final UsageProperties properties;

  public UsageRollupJob(
      UsageMeter usageMeter, SlidingWindowRateLimiter rateLimiter, UsageProperties properties) {
    this.usageMeter = usageMeter;
    this.rateLimiter = rateLimiter;
    this.properties = properties;
  }

  @Scheduled(
      fixedDelayString = "${fairway.usage.compaction-interval-ms:300000}",
      initialDelayString = "${fairway.usage.compaction-interval-ms:300000}")
  public void compact() {
    try {
      var result = usageMeter.compact();
      log.debug(
          "Usage rollup finished: minutes={}, hours={}, purged={}",
          result.minutesFolded(),
          result.hoursFolded(),
          result.bucketsPurged());
      rateLimiter.evictIdle(properties.rateLimit().window());
    } catch (RuntimeException e) {
      log.error("Usage rollup failed", e);
    }
  }
}
