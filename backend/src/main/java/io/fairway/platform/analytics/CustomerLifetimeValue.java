package io.fairway.platform.analytics;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * @param historicalNet every charge of the customer net of refunds up to {@code asOf}
 * @param tenureMonths started months since the first charge, at least one
 * @param monthlyValue {@code historicalNet / tenureMonths}
 * @param projectedValue {@code monthlyValue * horizonMonths}
 * @param lifetimeValue {@code historicalNet + projectedValue}
 */
public record CustomerLifetimeValue(
    String customerId,
    Instant asOf,
    String currency,
    BigDecimal historicalNet,
    long tenureMonths,
    BigDecimal monthlyValue,
    int horizonMonths,
    BigDecimal projectedValue,
    BigDecimal lifetimeValue) {}
