package io.fairway.platform.ledger;

import io.fairway.platform.currency.MinorUnits;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * An immutable financial fact. The id is chosen by the caller and is the idempotency key: the
 * ledger stores at most one event per id.
 *
 * <p>Amounts are normalized to the currency's minor units on construction, so two events that
 * differ only in trailing zeros are the same payload.
 */
public record RevenueEvent(
    String id,
    String tenantId,
    RevenueEventType type,
    BigDecimal amount,
    String currency,
    Instant occurredAt,
    String subscriptionId,
    String customerId,
    String invoiceId,
    Map<String, String> metadata,
    EventSource source) {

  public static final String PRICE_KEY = "price";
  public static final String BILLING_CYCLE_KEY = "billingCycle";
  public static final String TIER_KEY = "tier";
  public static final String REASON_KEY = "reason";
  public static final String REFUND_OF_KEY = "refundOf";
  public static final String PROCESSOR_REFERENCE_KEY = "processorReference";
  /** End of the subscription period a recurring charge pays for. */
  public static final String PERIOD_END_KEY = "periodEnd";

  public RevenueEvent {
    if (id == null || id.isBlank()) {
      throw new IllegalArgumentException("Revenue event id is required");
    }
    if (tenantId == null || tenantId.isBlank()) {
      throw new IllegalArgumentException("Revenue event " + id + " has no tenant");
    }
    if (type == null || amount == null || occurredAt == null || source == null) {
      throw new IllegalArgumentException(
          "Revenue event " + id + " requires type, amount, occurredAt and source");
    }
    currency = MinorUnits.normalize(currency);
    amount = MinorUnits.round(amount, currency);
    if (!type.allowsSignum(amount.signum())) {
      throw new IllegalArgumentException(
          type + " amount " + amount.toPlainString() + " has the wrong sign");
    }
    metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
  }

  public RevenueStream stream() {
    return RevenueStream.of(this);
  }

  public static Builder builder(String id, String tenantId, RevenueEventType type) {
    return new Builder(id, tenantId, type);
  }

  public static final class Builder {

    private final String id;
    private final String tenantId;
    private final RevenueEventType type;
    private BigDecimal amount;
    private String currency;
    private Instant occurredAt;
    private String subscriptionId;
    private String customerId;
    private String invoiceId;
    private final Map<String, String> metadata = new LinkedHashMap<>();
    private EventSource source = EventSource.INTERNAL;

    private Builder(String id, String tenantId, RevenueEventType type) {
      this.id = id;
      this.tenantId = tenantId;
      this.type = type;
    }

    public Builder amount(BigDecimal amount, String currency) {
      this.amount = amount;
      this.currency = currency;
      return this;
    }

    public Builder occurredAt(Instant occurredAt) {
      this.occurredAt = occurredAt;
      return this;
    }

    public Builder subscriptionId(Object subscriptionId) {
      this.subscriptionId = subscriptionId != null ? subscriptionId.toString() : null;
      return this;
    }

    public Builder customerId(Object customerId) {
      this.customerId = customerId != null ? customerId.toString() : null;
      return this;
    }

    public Builder invoiceId(Object invoiceId) {
      this.invoiceId = invoiceId != null ? invoiceId.toString() : null;
      return this;
    }

    public Builder stream(RevenueStream stream) {
      return metadata(RevenueStream.METADATA_KEY, stream.name());
    }

    public Builder metadata(String key, String value) {
      if (value != null) {
        metadata.put(key, value);
      }
      return this;
    }

    public Builder metadata(Map<String, String> values) {
      if (values != null) {
        values.forEach(this::metadata);
      }
      return this;
    }

    public Builder source(EventSource source) {
      this.source = source;
      return this;
    }

    public RevenueEvent build() {
      return new RevenueEvent(
          id,
          tenantId,
          type,
          amount,
          currency,
          occurredAt,
          subscriptionId,
          customerId,
          invoiceId,
          metadata,
          source);
    }
  }
}
