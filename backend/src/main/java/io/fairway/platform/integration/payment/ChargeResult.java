package io.fairway.platform.integration.payment;

/**
 * Result of a charge or refund.
 *
 * @param processorReference processor-side id of the payment, when one was created
 * @param message decline or error reason for logs; never shown to end users verbatim
 */
public record ChargeResult(ChargeStatus status, String processorReference, String message) {

  public static ChargeResult succeeded(String processorReference) {
    return new ChargeResult(ChargeStatus.SUCCEEDED, processorReference, null);
  }

  public static ChargeResult declined(String processorReference, String message) {
    return new ChargeResult(ChargeStatus.DECLINED, processorReference, message);
  }

  public static ChargeResult error(String message) {
    return new ChargeResult(ChargeStatus.ERROR, null, message);
  }

  public boolean succeeded() {
    return status == ChargeStatus.SUCCEEDED;
  }
}
