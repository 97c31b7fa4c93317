package io.fairway.platform.integration.payment;

import io.fairway.platform.currency.MinorUnits;
import java.math.BigDecimal;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Deterministic in-memory processor used when no real processor is configured. Tokens starting
 * with {@code tok_decline} are declined, tokens starting with {@code tok_error} fail with an
 * ambiguous error, anything else succeeds.
 *
 * <p>Settled outcomes are remembered per idempotency key, so a replayed key returns the original
 * result. Reusing a key for a different amount is an error, as with real processors.
 */
@Component
@ConditionalOnProperty(
    prefix = "fairway.payment",
    name = "provider",
    havingValue = "simulated",
    matchIfMissing = true)
public class SimulatedPaymentProcessor implements PaymentProcessor {

  private static final Logger log = LoggerFactory.getLogger(SimulatedPaymentProcessor.class);

  public static final String DECLINE_PREFIX = "tok_decline";
  public static final String ERROR_PREFIX = "tok_error";

  private record Settled(String fingerprint, ChargeResult result) {}

  private final Map<String, Settled> settled = new ConcurrentHashMap<>();
  private final Map<String, Integer> callsByKey = new ConcurrentHashMap<>();

  @Override
  public String providerId() {
    return "simulated";
  }

  @Override
  public ChargeResult charge(
      BigDecimal amount, String currency, String token, String idempotencyKey) {
    callsByKey.merge(idempotencyKey, 1, Integer::sum);
    String fingerprint = "charge:" + MinorUnits.round(amount, currency) + currency + ":" + token;
    return settle(idempotencyKey, fingerprint, () -> outcome(token));
  }

  @Override
  public ChargeResult refund(
      String processorReference, BigDecimal amount, String currency, String idempotencyKey) {
    callsByKey.merge(idempotencyKey, 1, Integer::sum);
    String fingerprint =
        "refund:" + MinorUnits.round(amount, currency) + currency + ":" + processorReference;
    return settle(
        idempotencyKey, fingerprint, () -> ChargeResult.succeeded("re_sim_" + UUID.randomUUID()));
  }

  /** How many times {@code idempotencyKey} reached the processor. */
  public int callCount(String idempotencyKey) {
    return callsByKey.getOrDefault(idempotencyKey, 0);
  }

  /** Number of distinct keys that settled successfully. */
  public long settledCharges() {
    return settled.values().stream().filter(s -> s.result().succeeded()).count();
  }

  private ChargeResult settle(
      String idempotencyKey, String fingerprint, Supplier<ChargeResult> work) {
    var previous = settled.get(idempotencyKey);
    if (previous != null) {
      if (!previous.fingerprint().equals(fingerprint)) {
        log.warn("Idempotency key {} reused with different parameters", idempotencyKey);
        return ChargeResult.error("Idempotency key reused with different parameters");
      }
      log.debug("Replaying settled result for idempotency key {}", idempotencyKey);
      return previous.result();
    }
    var result = work.get();
    if (result.status() == ChargeStatus.ERROR) {
      log.info("Simulated processor error for key {}", idempotencyKey);
      return result;
    }
    var winner = settled.putIfAbsent(idempotencyKey, new Settled(fingerprint, result));
    return winner != null ? winner.result() : result;
  }

  private static ChargeResult outcome(String token) {
    if (token == null || token.isBlank()) {
      return ChargeResult.declined(null, "No payment method on file");
    }
    if (token.startsWith(DECLINE_PREFIX)) {
      return ChargeResult.declined("ch_sim_" + UUID.randomUUID(), "Card declined");
    }
    if (token.startsWith(ERROR_PREFIX)) {
      return ChargeResult.error("Simulated processor failure");
    }
    return ChargeResult.succeeded("ch_sim_" + UUID.randomUUID());
  }
}
