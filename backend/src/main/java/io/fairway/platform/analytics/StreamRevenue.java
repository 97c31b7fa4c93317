package io.fairway.platform.analytics;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import io.fairway.platform.ledger.RevenueStream;
import java.math.BigDecimal;

/**
 * Revenue of one business line over a range. Each stream reports the figures that matter for it,
 * so consumers switch on the concrete type instead of reading an untyped bag.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "stream")
@JsonSubTypes({
  @JsonSubTypes.Type(value = ConsumerRevenue.class, name = "consumer"),
  @JsonSubTypes.Type(value = WhiteLabelRevenue.class, name = "white-label"),
  @JsonSubTypes.Type(value = AnalyticsRevenue.class, name = "analytics"),
  @JsonSubTypes.Type(value = ApiRevenue.class, name = "api")
})
public sealed interface StreamRevenue
    permits ConsumerRevenue, WhiteLabelRevenue, AnalyticsRevenue, ApiRevenue {

  RevenueStream stream();

  /** Charges net of refunds. */
  BigDecimal net();

  /** Distinct customers with at least one event in the stream. */
  long customers();
}
