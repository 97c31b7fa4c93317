package io.fairway.platform.billing;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Outcome of one automated billing cycle. Every subscription that was due appears in exactly one
 * list.
 *
 * @param processed renewed and paid
 * @param failed charge declined; retried on a later cycle or escalated
 * @param deferred outcome unknown (processor error or timeout, or an unexpected failure); retried
 *     with the same invoice and key
 * @param skipped not attempted, because the cycle was canceled or the subscription stopped being
 *     due
 * @param canceled whether cancellation was requested while the cycle ran
 */
public record BillingCycleResult(
    Instant startedAt,
    Instant completedAt,
    List<UUID> processed,
    List<UUID> failed,
    List<UUID> deferred,
    List<UUID> skipped,
    boolean canceled) {

  public int total() {
    return processed.size() + failed.size() + deferred.size() + skipped.size();
  }
}
