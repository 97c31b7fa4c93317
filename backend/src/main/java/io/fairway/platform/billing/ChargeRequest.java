package io.fairway.platform.billing;

import io.fairway.platform.ledger.RevenueEventType;
import io.fairway.platform.ledger.RevenueStream;
import java.math.BigDecimal;
import java.util.Map;

/**
 * One logical charge. The event id is both the ledger id of the resulting revenue event and the
 * processor idempotency key, so submitting the same request twice charges once.
 */
public record ChargeRequest(
    String eventId,
    String tenantId,
    RevenueEventType type,
    BigDecimal amount,
    String currency,
    String paymentMethod,
    String customerId,
    String subscriptionId,
    RevenueStream stream,
    Map<String, String> metadata) {

  public ChargeRequest {
    metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
  }
}
