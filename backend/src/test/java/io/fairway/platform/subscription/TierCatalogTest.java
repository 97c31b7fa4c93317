package io.fairway.platform.subscription;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.fairway.platform.exception.InvalidRequestException;
import io.fairway.platform.ledger.RevenueStream;
import io.fairway.platform.subscription.TierCatalogProperties.TierDefinition;
import java.math.BigDecimal;
import java.util.List;
import org.junit.jupiter.api.Test;

class TierCatalogTest {

  @Test
  void defaultCatalog_containsEveryProductLine() {
    var catalog = new TierCatalog(new TierCatalogProperties(null));

    assertThat(catalog.require("starter").monthlyPrice()).isEqualByComparingTo("29.00");
    assertThat(catalog.require("custom").monthlyPrice()).isEqualByComparingTo("999.00");
    assertThat(catalog.require("golfer-premium").stream()).isEqualTo(RevenueStream.CONSUMER);
    assertThat(catalog.require("white-label-chain").family()).isEqualTo("white-label");
    assertThat(catalog.require("insights").stream()).isEqualTo(RevenueStream.ANALYTICS);
  }

  @Test
  void apiTiers_areMeteredAndFlatTiersAreNot() {
    var catalog = new TierCatalog(new TierCatalogProperties(null));

    var starter = catalog.require("starter");
    assertThat(starter.isMetered()).isTrue();
    assertThat(starter.allowance().includedApiCalls()).isEqualTo(10_000);
    assertThat(starter.rateLimitPerMinute()).isEqualTo(100);
    assertThat(catalog.require("golfer-pro").isMetered()).isFalse();
  }

  @Test
  void unknownTier_isAnInvalidRequest() {
    var catalog = new TierCatalog(new TierCatalogProperties(null));

    assertThatThrownBy(() -> catalog.require("platinum"))
        .isInstanceOf(InvalidRequestException.class);
    assertThat(catalog.find(null)).isEmpty();
  }

  @Test
  void configuredDefinitions_replaceTheDefaults() {
    var definition =
        new TierDefinition(
            "club",
            null,
            "membership",
            null,
            new BigDecimal("45.00"),
            null,
            null,
            null,
            null,
            null,
            null,
            null,
            null,
            null);

    var catalog = new TierCatalog(new TierCatalogProperties(List.of(definition)));

    var club = catalog.require("club");
    assertThat(catalog.all()).hasSize(1);
    assertThat(club.name()).isEqualTo("club");
    assertThat(club.annualPrice()).isEqualByComparingTo("450.00");
    assertThat(club.currency()).isEqualTo("USD");
    assertThat(club.stream()).isEqualTo(RevenueStream.CONSUMER);
    assertThat(club.isMetered()).isFalse();
  }

  @Test
  void duplicateTierIds_failFast() {
    var definition =
        new TierDefinition(
            "club", null, "membership", null, BigDecimal.TEN, null, null, null, null, null, null,
            null, null, null);

    assertThatThrownBy(
            () -> new TierCatalog(new TierCatalogProperties(List.of(definition, definition))))
        .isInstanceOf(IllegalStateException.class);
  }
}
