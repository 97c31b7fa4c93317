package io.fairway.platform.billing;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Billing configuration.
 *
 * @param maxAttempts charge attempts per renewal before it escalates to manual intervention
 * @param concurrency charges one billing cycle keeps in flight
 * @param paymentTimeout how long a single charge may take before its outcome counts as unknown
 * @param retryBase delay before the first retry; each further retry doubles it
 * @param invoiceDueDays days between issuing an invoice and its due date
 */
@ConfigurationProperties(prefix = "fairway.billing")
public record BillingProperties(
    int maxAttempts,
    int concurrency,
    Duration paymentTimeout,
    Duration retryBase,
    int invoiceDueDays) {

  public BillingProperties {
    maxAttempts = maxAttempts > 0 ? maxAttempts : 3;
    concurrency = concurrency > 0 ? concurrency : 4;
    paymentTimeout = paymentTimeout != null ? paymentTimeout : Duration.ofSeconds(30);
    retryBase = retryBase != null ? retryBase : Duration.ofDays(1);
    invoiceDueDays = invoiceDueDays > 0 ? invoiceDueDays : 14;
  }
}
