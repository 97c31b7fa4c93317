package io.fairway.platform.integration.payment;

import static org.assertj.core.api.Assertions.assertThat;

import java.math.BigDecimal;
import org.junit.jupiter.api.Test;

class SimulatedPaymentProcessorTest {

  private final SimulatedPaymentProcessor processor = new SimulatedPaymentProcessor();

  @Test
  void charge_succeedsForRegularTokens() {
    var result = processor.charge(new BigDecimal("1500.00"), "USD", "tok_visa", "key-1");

    assertThat(result.status()).isEqualTo(ChargeStatus.SUCCEEDED);
    assertThat(result.processorReference()).startsWith("ch_sim_");
    assertThat(processor.settledCharges()).isEqualTo(1);
  }

  @Test
  void charge_declinesDeclineTokensAndMissingPaymentMethods() {
    assertThat(processor.charge(BigDecimal.TEN, "USD", "tok_decline_insufficient", "k1").status())
        .isEqualTo(ChargeStatus.DECLINED);
    assertThat(processor.charge(BigDecimal.TEN, "USD", " ", "k2").status())
        .isEqualTo(ChargeStatus.DECLINED);
    assertThat(processor.settledCharges()).isZero();
  }

  @Test
  void replayedKey_returnsTheOriginalResult() {
    var first = processor.charge(new BigDecimal("10.00"), "USD", "tok_visa", "renewal-1");
    var second = processor.charge(new BigDecimal("10"), "USD", "tok_visa", "renewal-1");

    assertThat(second).isEqualTo(first);
    assertThat(processor.callCount("renewal-1")).isEqualTo(2);
    assertThat(processor.settledCharges()).isEqualTo(1);
  }

  @Test
  void reusedKeyWithDifferentAmount_isAnError() {
    processor.charge(new BigDecimal("10.00"), "USD", "tok_visa", "renewal-1");

    var result = processor.charge(new BigDecimal("11.00"), "USD", "tok_visa", "renewal-1");

    assertThat(result.status()).isEqualTo(ChargeStatus.ERROR);
  }

  @Test
  void errors_areNotRemembered() {
    var first = processor.charge(BigDecimal.ONE, "USD", "tok_error_timeout", "flaky");
    var retry = processor.charge(BigDecimal.ONE, "USD", "tok_error_timeout", "flaky");

    assertThat(first.status()).isEqualTo(ChargeStatus.ERROR);
    assertThat(retry.status()).isEqualTo(ChargeStatus.ERROR);
    assertThat(processor.callCount("flaky")).isEqualTo(2);
  }

  @Test
  void refund_settlesWithARefundReference() {
    var result = processor.refund("ch_sim_1", new BigDecimal("5.00"), "USD", "refund-1");

    assertThat(result.succeeded()).isTrue();
    assertThat(result.processorReference()).startsWith("re_sim_");
  }
}
