package io.fairway.platform.analytics;

import io.fairway.platform.ledger.DateRange;
import java.math.BigDecimal;
import java.util.List;

/** Net revenue split by business line; {@code streams} always holds one entry per stream. */
public record RevenueBreakdown(
    String tenantId,
    DateRange range,
    String currency,
    BigDecimal total,
    List<StreamRevenue> streams) {}
