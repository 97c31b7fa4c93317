package io.fairway.platform.subscription;

/**
 * Subscription lifecycle status.
 *
 * <ul>
 *   <li>ACTIVE → PAUSED → ACTIVE (pause and resume)
 *   <li>ACTIVE, PAUSED → CANCELED
 *   <li>CANCELED is terminal; canceled subscriptions are kept for history
 * </ul>
 */
public enum SubscriptionStatus {
  ACTIVE,
  PAUSED,
  CANCELED;

  public boolean canTransitionTo(SubscriptionStatus target) {
    return switch (this) {
      case ACTIVE -> target == PAUSED || target == CANCELED;
      case PAUSED -> target == ACTIVE || target == CANCELED;
      case CANCELED -> false;
    };
  }

  /** Counts against the one-live-subscription-per-family rule. */
  public boolean isLive() {
    return this != CANCELED;
  }
}
