package io.fairway.platform.usage;

import java.math.BigDecimal;

/**
 * Overage of one quota type.
 *
 * @param overageUnits billable units above the allowance (calls, or started GiB)
 * @param amount {@code overageUnits × rate}, rounded to minor units
 */
public record OverageCharge(
    QuotaType quotaType,
    long included,
    long actual,
    long overageUnits,
    BigDecimal rate,
    BigDecimal amount) {}
