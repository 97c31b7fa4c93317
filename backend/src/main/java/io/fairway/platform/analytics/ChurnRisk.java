package io.fairway.platform.analytics;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

/**
 * Share of recurring customers whose expected renewal, plus the grace period, passed without a
 * renewal.
 *
 * @param score {@code atRisk / recurringCustomers}, four decimals, zero when there are none
 * @param atRiskCustomerIds sorted
 */
public record ChurnRisk(
    String tenantId,
    Instant asOf,
    long recurringCustomers,
    long atRisk,
    BigDecimal score,
    List<String> atRiskCustomerIds) {}
