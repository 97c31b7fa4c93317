package io.fairway.platform.usage;

import java.time.Instant;

/** Identity of one usage bucket. */
public record UsageBucketKey(
    String tenantId, String endpoint, Granularity granularity, Instant bucketStart) {

  public static UsageBucketKey of(
      String tenantId, String endpoint, Granularity granularity, Instant at) {
    return new UsageBucketKey(tenantId, endpoint, granularity, granularity.truncate(at));
  }

  public UsageBucketKey rollUpTo(Granularity target) {
    return of(tenantId, endpoint, target, bucketStart);
  }
}
