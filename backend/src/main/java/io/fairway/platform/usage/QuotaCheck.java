package io.fairway.platform.usage;

/** Result of a quota check. {@code withinLimit} holds while {@code used <= limit}. */
public record QuotaCheck(QuotaType quotaType, boolean withinLimit, long used, long limit) {

  public static QuotaCheck of(QuotaType quotaType, long used, long limit) {
    return new QuotaCheck(quotaType, used <= limit, used, limit);
  }

  public long remaining() {
    return Math.max(0, limit - used);
  }
}
