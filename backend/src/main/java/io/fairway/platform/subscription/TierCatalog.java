package io.fairway.platform.subscription;

import io.fairway.platform.exception.InvalidRequestException;
import io.fairway.platform.ledger.RevenueStream;
import io.fairway.platform.subscription.TierCatalogProperties.TierDefinition;
import io.fairway.platform.usage.UsageAllowance;
import java.math.BigDecimal;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/** Immutable catalog of sellable tiers, keyed by tier id. */
@Component
public class TierCatalog {

  private static final Logger log = LoggerFactory.getLogger(TierCatalog.class);

  private static final long GIB = 1024L * 1024L * 1024L;

  private final Map<String, Tier> tiers;

  public TierCatalog(TierCatalogProperties properties) {
    var definitions =
        properties.definitions().isEmpty() ? defaultTiers() : properties.definitions();
    var byId = new LinkedHashMap<String, Tier>();
    for (TierDefinition definition : definitions) {
      var tier = toTier(definition);
      if (byId.putIfAbsent(tier.id(), tier) != null) {
        throw new IllegalStateException("Duplicate tier id in catalog: " + tier.id());
      }
    }
    this.tiers = Map.copyOf(byId);
    log.info("Tier catalog loaded with {} tiers", tiers.size());
  }

  public Tier require(String tierId) {
    return find(tierId)
        .orElseThrow(
            () -> new InvalidRequestException("Unknown tier", "No tier with id " + tierId));
  }

  public Optional<Tier> find(String tierId) {
    return Optional.ofNullable(tierId).map(tiers::get);
  }

  public List<Tier> all() {
    return tiers.values().stream()
        .sorted(Comparator.comparing(Tier::family).thenComparing(Tier::monthlyPrice))
        .toList();
  }

  private static Tier toTier(TierDefinition d) {
    if (d.id() == null || d.family() == null || d.monthlyPrice() == null) {
      throw new IllegalStateException("Tier definitions need an id, a family and a monthly price");
    }
    if (d.monthlyPrice().signum() < 0
        || (d.annualPrice() != null && d.annualPrice().signum() < 0)) {
      throw new IllegalStateException("Tier " + d.id() + " has a negative price");
    }
    String currency = d.currency() != null ? d.currency() : "USD";
    UsageAllowance allowance = null;
    if (d.includedApiCalls() != null) {
      allowance =
          new UsageAllowance(
              d.includedApiCalls(),
              gib(d.includedStorageGib()),
              gib(d.includedBandwidthGib()),
              orZero(d.apiCallOverageRate()),
              orZero(d.storageOverageRatePerGib()),
              orZero(d.bandwidthOverageRatePerGib()),
              currency);
    }
    BigDecimal annual =
        d.annualPrice() != null ? d.annualPrice() : d.monthlyPrice().multiply(BigDecimal.TEN);
    return new Tier(
        d.id(),
        d.name() != null ? d.name() : d.id(),
        d.family(),
        d.stream() != null ? d.stream() : RevenueStream.CONSUMER,
        d.monthlyPrice(),
        annual,
        currency,
        allowance,
        d.rateLimitPerMinute());
  }

  private static long gib(Long value) {
    return value == null ? 0L : value * GIB;
  }

  private static BigDecimal orZero(BigDecimal value) {
    return value == null ? BigDecimal.ZERO : value;
  }

  /** The product's standard plans: metered API tiers plus consumer, white-label and insights. */
  public static List<TierDefinition> defaultTiers() {
    return List.of(
        api("starter", "Starter", "29.00", "290.00", 10_000, 5, 10, "0.001", "2.00", "1.00", 100),
        api(
            "professional",
            "Professional",
            "99.00",
            "990.00",
            100_000,
            50,
            100,
            "0.0008",
            "1.50",
            "0.75",
            500),
        api(
            "enterprise",
            "Enterprise",
            "299.00",
            "2990.00",
            1_000_000,
            500,
            1_000,
            "0.0005",
            "1.00",
            "0.50",
            2_000),
        api(
            "custom",
            "Custom",
            "999.00",
            "9990.00",
            10_000_000,
            5_000,
            10_000,
            "0.0003",
            "0.75",
            "0.25",
            10_000),
        flat(
            "golfer-premium",
            "Golfer Premium",
            "consumer",
            RevenueStream.CONSUMER,
            "9.99",
            "99.99"),
        flat("golfer-pro", "Golfer Pro", "consumer", RevenueStream.CONSUMER, "19.99", "199.99"),
        flat(
            "white-label-course",
            "White Label Course",
            "white-label",
            RevenueStream.WHITE_LABEL,
            "500.00",
            "5000.00"),
        flat(
            "white-label-chain",
            "White Label Chain",
            "white-label",
            RevenueStream.WHITE_LABEL,
            "1200.00",
            "12000.00"),
        flat(
            "insights",
            "Course Insights",
            "analytics",
            RevenueStream.ANALYTICS,
            "199.00",
            "1990.00"));
  }

  private static TierDefinition api(
      String id,
      String name,
      String monthly,
      String annual,
      long calls,
      long storageGib,
      long bandwidthGib,
      String callRate,
      String storageRate,
      String bandwidthRate,
      int rateLimit) {
    return new TierDefinition(
        id,
        name,
        "api",
        RevenueStream.API,
        new BigDecimal(monthly),
        new BigDecimal(annual),
        "USD",
        calls,
        storageGib,
        bandwidthGib,
        new BigDecimal(callRate),
        new BigDecimal(storageRate),
        new BigDecimal(bandwidthRate),
        rateLimit);
  }

  private static TierDefinition flat(
      String id,
      String name,
      String family,
      RevenueStream stream,
      String monthly,
      String annual) {
    return new TierDefinition(
        id,
        name,
        family,
        stream,
        new BigDecimal(monthly),
        new BigDecimal(annual),
        "USD",
        null,
        null,
        null,
        null,
        null,
        null,
        null);
  }
}
