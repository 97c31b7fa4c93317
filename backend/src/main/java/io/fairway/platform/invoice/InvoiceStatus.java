package io.fairway.platform.invoice;

/**
 * Invoice lifecycle status. Enforces valid state transitions for the billing workflow.
 *
 * <p>Valid transitions:
 *
 * <ul>
 *   <li>DRAFT → SENT (issued to the customer)
 *   <li>SENT → PAID (payment captured)
 *   <li>SENT → OVERDUE (due date passed, or dunning exhausted)
 *   <li>OVERDUE → PAID (a later retry or manual payment succeeded)
 *   <li>DRAFT, SENT, OVERDUE → VOID (cancelled)
 *   <li>PAID and VOID are terminal states
 * </ul>
 *
 * <p>An invoice never moves back to DRAFT or SENT.
 */
public enum InvoiceStatus {
  /** Editable; lines may still be added. */
  DRAFT,

  /** Issued and awaiting payment. Lines are locked. */
  SENT,

  /** Payment received. Terminal. */
  PAID,

  /** Unpaid past its due date, or after the last automatic retry failed. */
  OVERDUE,

  /** Cancelled. Terminal. */
  VOID;

  public boolean canTransitionTo(InvoiceStatus target) {
    return switch (this) {
      case DRAFT -> target == SENT || target == VOID;
      case SENT -> target == PAID || target == OVERDUE || target == VOID;
      case OVERDUE -> target == PAID || target == VOID;
      case PAID, VOID -> false; // Terminal states
    };
  }

  /** Awaiting payment. */
  public boolean isPayable() {
    return this == SENT || this == OVERDUE;
  }
}
