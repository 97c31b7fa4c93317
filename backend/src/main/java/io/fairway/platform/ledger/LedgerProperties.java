package io.fairway.platform.ledger;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * @param reportingCurrency currency metrics are computed in; events in other currencies are left
 *     out of sums
 */
@ConfigurationProperties(prefix = "fairway.ledger")
public record LedgerProperties(String reportingCurrency) {

  public LedgerProperties {
    reportingCurrency = reportingCurrency != null ? reportingCurrency : "USD";
  }
}
