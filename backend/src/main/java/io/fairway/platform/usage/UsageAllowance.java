package io.fairway.platform.usage;

import java.math.BigDecimal;

/**
 * What a plan includes and what it charges beyond that.
 *
 * @param includedApiCalls calls per billing period
 * @param includedStorageBytes stored bytes
 * @param includedBandwidthBytes transferred bytes per billing period
 * @param apiCallRate price per call above the allowance
 * @param storageRatePerGib price per started GiB above the allowance
 * @param bandwidthRatePerGib price per started GiB above the allowance
 * @param currency ISO-4217 code the rates are in
 */
public record UsageAllowance(
    long includedApiCalls,
    long includedStorageBytes,
    long includedBandwidthBytes,
    BigDecimal apiCallRate,
    BigDecimal storageRatePerGib,
    BigDecimal bandwidthRatePerGib,
    String currency) {

  public long included(QuotaType quotaType) {
    return switch (quotaType) {
      case API_CALLS -> includedApiCalls;
      case STORAGE -> includedStorageBytes;
      case BANDWIDTH -> includedBandwidthBytes;
    };
  }
}
