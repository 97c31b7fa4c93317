package io.fairway.platform.usage;

import java.time.Duration;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Usage metering configuration.
 *
 * @param rateLimit sliding-window request ceilings
 * @param retention how long each bucket width is kept before it is compacted or purged
 */
@ConfigurationProperties(prefix = "fairway.usage")
public record UsageProperties(RateLimit rateLimit, Retention retention) {

  public UsageProperties {
    rateLimit = rateLimit != null ? rateLimit : new RateLimit(0, null, null);
    retention = retention != null ? retention : new Retention(null, null, null, null);
  }

  /**
   * @param defaultLimit requests per window when neither a tenant override nor the plan sets one
   * @param window length of the sliding window
   * @param tenantOverrides requests per window keyed by tenant id
   */
  public record RateLimit(int defaultLimit, Duration window, Map<String, Integer> tenantOverrides) {

    public RateLimit {
      defaultLimit = defaultLimit > 0 ? defaultLimit : 600;
      window = window != null ? window : Duration.ofMinutes(1);
      tenantOverrides = tenantOverrides != null ? Map.copyOf(tenantOverrides) : Map.of();
    }
  }

  /**
   * @param minute age after which MINUTE buckets fold into HOUR buckets
   * @param hour age after which HOUR buckets fold into DAY buckets
   * @param day minimum age before a billed DAY bucket may be purged
   * @param month minimum age before a billed MONTH bucket may be purged
   */
  public record Retention(Duration minute, Duration hour, Duration day, Duration month) {

    public Retention {
      minute = minute != null ? minute : Duration.ofHours(2);
      hour = hour != null ? hour : Duration.ofDays(2);
      day = day != null ? day : Duration.ofDays(400);
      month = month != null ? month : Duration.ofDays(800);
    }
  }
}
