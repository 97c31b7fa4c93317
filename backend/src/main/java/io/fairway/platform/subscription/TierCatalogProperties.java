package io.fairway.platform.subscription;

import io.fairway.platform.ledger.RevenueStream;
import java.math.BigDecimal;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Tier catalog configuration. When no definitions are configured the built-in catalog of {@link
 * TierCatalog#defaultTiers()} is used.
 */
@ConfigurationProperties(prefix = "fairway.tiers")
public record TierCatalogProperties(List<TierDefinition> definitions) {

  public TierCatalogProperties {
    definitions = definitions != null ? List.copyOf(definitions) : List.of();
  }

  /**
   * One configured tier. Allowance fields left null make the tier unmetered.
   *
   * @param includedStorageGib stored GiB included
   * @param includedBandwidthGib transferred GiB per period included
   */
  public record TierDefinition(
      String id,
      String name,
      String family,
      RevenueStream stream,
      BigDecimal monthlyPrice,
      BigDecimal annualPrice,
      String currency,
      Long includedApiCalls,
      Long includedStorageGib,
      Long includedBandwidthGib,
      BigDecimal apiCallOverageRate,
      BigDecimal storageOverageRatePerGib,
      BigDecimal bandwidthOverageRatePerGib,
      Integer rateLimitPerMinute) {}
}
