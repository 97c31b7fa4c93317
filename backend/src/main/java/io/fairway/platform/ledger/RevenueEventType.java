package io.fairway.platform.ledger;

/** Kinds of financial fact the ledger records, with the sign each one allows. */
public enum RevenueEventType {
  SUBSCRIPTION_CREATED(Sign.NON_NEGATIVE, true),
  SUBSCRIPTION_RENEWED(Sign.NON_NEGATIVE, true),
  SETUP_FEE(Sign.NON_NEGATIVE, false),
  USAGE_CHARGE(Sign.NON_NEGATIVE, false),
  ADD_ON_PURCHASE(Sign.NON_NEGATIVE, false),
  REFUND(Sign.NON_POSITIVE, false),
  MIGRATION(Sign.ANY, false),
  /** Mid-cycle tier change; credits are negative. */
  PRORATION(Sign.ANY, true);

  enum Sign {
    NON_NEGATIVE,
    NON_POSITIVE,
    ANY
  }

  private final Sign sign;
  private final boolean recurring;

  RevenueEventType(Sign sign, boolean recurring) {
    this.sign = sign;
    this.recurring = recurring;
  }

  /** Counts toward recurring revenue. */
  public boolean isRecurring() {
    return recurring;
  }

  /** A charge that opens or extends a paid subscription period. */
  public boolean isPeriodCharge() {
    return this == SUBSCRIPTION_CREATED || this == SUBSCRIPTION_RENEWED;
  }

  public boolean allowsSignum(int signum) {
    return switch (sign) {
      case NON_NEGATIVE -> signum >= 0;
      case NON_POSITIVE -> signum <= 0;
      case ANY -> true;
    };
  }
}
