package io.fairway.platform.billing;

import io.fairway.platform.ledger.RevenueEventType;
import io.fairway.platform.ledger.RevenueStream;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;

/**
 * An administrative correction entered by hand. Null {@code id} and {@code occurredAt} default to a
 * generated id and the current time.
 */
public record ManualRevenueEvent(
    String id,
    RevenueEventType type,
    BigDecimal amount,
    String currency,
    Instant occurredAt,
    String customerId,
    String subscriptionId,
    RevenueStream stream,
    String reason,
    Map<String, String> metadata) {}
