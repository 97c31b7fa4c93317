package io.fairway.platform.ledger;

import java.math.BigDecimal;

/**
 * Period metrics, each a pure reduction over the events in {@code range}.
 *
 * @param grossRevenue sum of non-negative amounts
 * @param refunds sum of negative amounts, as a non-positive number
 * @param totalRevenue net of the two
 * @param recurringRevenue net of subscription and proration events
 * @param customerCount distinct customers with at least one event
 * @param arpu {@code totalRevenue / customerCount}, zero when there are no customers
 */
public record LedgerMetrics(
    String tenantId,
    DateRange range,
    String currency,
    BigDecimal grossRevenue,
    BigDecimal refunds,
    BigDecimal totalRevenue,
    BigDecimal recurringRevenue,
    long customerCount,
    BigDecimal arpu,
    long eventCount) {}
