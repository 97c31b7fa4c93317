package io.fairway.platform.analytics;

import io.fairway.platform.ledger.DateRange;
import java.math.BigDecimal;

/**
 * Average revenue per paying customer over a range.
 *
 * @param payingCustomers distinct customers with at least one positive charge in the range
 */
public record AverageRevenue(
    String tenantId,
    DateRange range,
    String currency,
    BigDecimal netRevenue,
    long payingCustomers,
    BigDecimal arpu) {}
